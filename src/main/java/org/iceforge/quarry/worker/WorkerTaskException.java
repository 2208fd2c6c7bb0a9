package org.iceforge.quarry.worker;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.QuarryException;

/**
 * Categorized failure raised by a {@link WorkerFunction}. {@code details} is the raw engine
 * message; {@code context} carries anything the caller may use to explain the failure.
 */
public class WorkerTaskException extends QuarryException {
    private final String details;
    private final transient JsonNode context;

    public WorkerTaskException(ErrorType errorType, String message, String details, JsonNode context) {
        super(errorType, message);
        this.details = details;
        this.context = context;
    }

    public WorkerTaskException(ErrorType errorType, String message, Throwable cause) {
        super(errorType, message, cause);
        this.details = cause == null ? null : cause.getMessage();
        this.context = null;
    }

    public String details() {
        return details;
    }

    public JsonNode context() {
        return context;
    }
}
