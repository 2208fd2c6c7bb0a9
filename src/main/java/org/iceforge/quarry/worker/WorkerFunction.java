package org.iceforge.quarry.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Unit of work executed inside a worker process.
 * <p>
 * Implementations need a public no-arg constructor; the worker instantiates them by class name
 * and reuses the instance for later tasks. Arguments and results must be plain JSON since they
 * cross a process boundary. Throw {@link WorkerTaskException} to report a categorized failure;
 * anything else is reported as an internal error.
 */
@FunctionalInterface
public interface WorkerFunction {
    JsonNode apply(JsonNode args, ObjectMapper mapper) throws Exception;
}
