package org.iceforge.quarry.worker;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.quarry.ErrorType;

/**
 * Messages exchanged with a worker process, one JSON object per line.
 */
public final class WorkerProtocol {
    private WorkerProtocol() {}

    public record TaskRequest(long taskId, String function, JsonNode args) {}

    public record TaskResponse(
            long taskId,
            boolean ok,
            JsonNode result,
            String errorType,
            String message,
            String details,
            JsonNode context
    ) {
        public static TaskResponse ok(long taskId, JsonNode result) {
            return new TaskResponse(taskId, true, result, null, null, null, null);
        }

        public static TaskResponse failed(long taskId, ErrorType type, String message, String details, JsonNode context) {
            return new TaskResponse(taskId, false, null, type.code(), message, details, context);
        }
    }
}
