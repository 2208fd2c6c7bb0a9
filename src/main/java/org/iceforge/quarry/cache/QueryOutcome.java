package org.iceforge.quarry.cache;

import org.iceforge.quarry.ErrorType;

import java.util.Objects;

/**
 * What a cache tier is offered after an execution: either a {@link QueryResult} or the reason
 * the execution failed. Only successes are ever stored.
 */
public record QueryOutcome(QueryResult result, ErrorType errorType, String reason) {

    public QueryOutcome {
        if (result == null) {
            Objects.requireNonNull(errorType, "errorType");
        } else if (errorType != null) {
            throw new IllegalArgumentException("An outcome is either a result or a failure");
        }
    }

    public static QueryOutcome success(QueryResult result) {
        return new QueryOutcome(Objects.requireNonNull(result, "result"), null, null);
    }

    public static QueryOutcome failure(ErrorType errorType, String reason) {
        return new QueryOutcome(null, errorType, reason);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
