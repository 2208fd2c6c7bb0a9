package org.iceforge.quarry.worker;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Fixed set of isolated worker processes. A task that overruns its timeout costs only the
 * worker running it, which is replaced.
 */
public interface WorkerPool {

    /**
     * Runs {@code function} in a worker and waits for the answer. Time spent waiting for a free
     * worker counts against {@code timeout}. Task failures are returned, not thrown.
     *
     * @throws WorkerPoolException if the pool has been shut down
     */
    WorkerResult submit(Class<? extends WorkerFunction> function, JsonNode args, Duration timeout);

    int size();

    /** Stops every worker and waits for them to exit. Idempotent. */
    void shutdown();
}
