package org.iceforge.quarry.query;

import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.QuarryException;

/**
 * A query reached a worker and failed there. The message is the user-facing explanation;
 * {@link #details()} keeps the engine's own text.
 */
public class QueryExecutionException extends QuarryException {
    private final String details;

    public QueryExecutionException(ErrorType errorType, String message, String details) {
        super(errorType, message);
        this.details = details;
    }

    public String details() {
        return details;
    }
}
