package org.iceforge.quarry.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.quarry.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Entry point of a worker process: reads task requests from stdin, one JSON line each, and
 * answers each with one response line on stdout. Exits when stdin closes.
 * <p>
 * {@code System.out} is pointed at stderr before anything else runs, so stray prints and log
 * output cannot interleave with protocol lines.
 */
public final class WorkerMain {
    private final Logger logger = LoggerFactory.getLogger(WorkerMain.class);
    private final ObjectMapper mapper;
    private final Map<String, WorkerFunction> functions = new HashMap<>();

    WorkerMain(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static void main(String[] args) throws IOException {
        PrintStream protocol = new PrintStream(new FileOutputStream(FileDescriptor.out), false, StandardCharsets.UTF_8);
        System.setOut(System.err);
        WorkerMain worker = new WorkerMain(new ObjectMapper());
        worker.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), protocol);
    }

    void run(BufferedReader in, PrintStream out) throws IOException {
        logger.debug("Worker {} ready", ProcessHandle.current().pid());
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            out.println(mapper.writeValueAsString(handle(line)));
            out.flush();
        }
        logger.debug("Worker {} input closed, exiting", ProcessHandle.current().pid());
    }

    WorkerProtocol.TaskResponse handle(String line) {
        WorkerProtocol.TaskRequest request;
        try {
            request = mapper.readValue(line, WorkerProtocol.TaskRequest.class);
        } catch (JsonProcessingException e) {
            logger.error("Malformed task request: {}", e.getOriginalMessage());
            return WorkerProtocol.TaskResponse.failed(-1, ErrorType.INTERNAL, "Malformed task request", e.getOriginalMessage(), null);
        }
        try {
            WorkerFunction fn = functions.computeIfAbsent(request.function(), this::instantiate);
            JsonNode args = request.args() == null || request.args().isNull() ? mapper.createObjectNode() : request.args();
            return WorkerProtocol.TaskResponse.ok(request.taskId(), fn.apply(args, mapper));
        } catch (WorkerTaskException e) {
            return WorkerProtocol.TaskResponse.failed(request.taskId(), e.errorType(), e.getMessage(), e.details(), e.context());
        } catch (Exception e) {
            logger.error("Task {} ({}) failed", request.taskId(), request.function(), e);
            return WorkerProtocol.TaskResponse.failed(request.taskId(), ErrorType.INTERNAL,
                    "Unexpected error: " + e.getMessage(), String.valueOf(e), null);
        }
    }

    private WorkerFunction instantiate(String className) {
        try {
            Class<?> type = Class.forName(className);
            if (!WorkerFunction.class.isAssignableFrom(type)) {
                throw new WorkerTaskException(ErrorType.INTERNAL, "Not a worker function: " + className, null, null);
            }
            return (WorkerFunction) type.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException | NoSuchMethodException | InstantiationException
                 | IllegalAccessException | InvocationTargetException e) {
            throw new WorkerTaskException(ErrorType.INTERNAL, "Cannot load worker function " + className, e);
        }
    }
}
