package org.iceforge.quarry;

import java.util.Objects;

/**
 * Base of every domain failure raised by the execution and caching pipeline.
 */
public abstract class QuarryException extends RuntimeException {
    private final ErrorType errorType;

    protected QuarryException(ErrorType errorType, String message) {
        super(message);
        this.errorType = Objects.requireNonNull(errorType, "errorType");
    }

    protected QuarryException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = Objects.requireNonNull(errorType, "errorType");
    }

    public ErrorType errorType() {
        return errorType;
    }
}
