package org.iceforge.quarry.worker;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.quarry.ErrorType;

/**
 * What a submitted task produced. Exactly one of {@code value} (on success) or
 * {@code errorType}/{@code message} (on failure) is set.
 */
public record WorkerResult(
        boolean success,
        JsonNode value,
        ErrorType errorType,
        String message,
        String details,
        JsonNode context
) {
    public static WorkerResult ok(JsonNode value) {
        return new WorkerResult(true, value, null, null, null, null);
    }

    public static WorkerResult failed(ErrorType errorType, String message, String details, JsonNode context) {
        return new WorkerResult(false, null, errorType, message, details, context);
    }

    public static WorkerResult timeout(String message) {
        return failed(ErrorType.TIMEOUT, message, null, null);
    }

    public boolean isTimeout() {
        return errorType == ErrorType.TIMEOUT;
    }
}
