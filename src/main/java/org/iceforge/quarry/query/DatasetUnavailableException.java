package org.iceforge.quarry.query;

import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.QuarryException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more datasets of a query could not be fetched or failed validation. Carries every
 * failure, not just the first.
 */
public class DatasetUnavailableException extends QuarryException {
    private final List<QueryModels.DatasetFailure> failures;

    public DatasetUnavailableException(List<QueryModels.DatasetFailure> failures) {
        super(typeOf(failures), message(failures));
        this.failures = List.copyOf(failures);
    }

    public List<QueryModels.DatasetFailure> failures() {
        return failures;
    }

    private static ErrorType typeOf(List<QueryModels.DatasetFailure> failures) {
        return failures.stream().anyMatch(f -> f.errorType() == ErrorType.NETWORK) ? ErrorType.NETWORK : ErrorType.VALIDATION;
    }

    private static String message(List<QueryModels.DatasetFailure> failures) {
        return failures.stream()
                .map(f -> f.url() + " (" + f.errorType().code() + "): " + f.message())
                .collect(Collectors.joining("; ", "Dataset unavailable: ", ""));
    }
}
