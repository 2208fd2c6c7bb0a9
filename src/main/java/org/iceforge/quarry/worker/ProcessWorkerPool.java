package org.iceforge.quarry.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.quarry.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link WorkerPool} backed by child JVMs running {@link WorkerMain}.
 * <p>
 * Idle workers sit in a queue. A task takes one, writes a request line and waits for the
 * response line on an I/O thread so the wait can be bounded. A worker that overruns, dies, or
 * answers garbage is killed and replaced before the caller gets its result; a healthy one goes
 * back to the queue until it has served {@code maxTasksPerWorker} tasks.
 */
public final class ProcessWorkerPool implements WorkerPool {
    private static final Logger logger = LoggerFactory.getLogger(ProcessWorkerPool.class);
    private static final long IDLE_POLL_MILLIS = 200;

    private final WorkerLauncher launcher;
    private final ObjectMapper mapper;
    private final int poolSize;
    private final int maxTasksPerWorker;
    private final Duration shutdownGrace;

    private final BlockingQueue<WorkerProcess> idle = new LinkedBlockingQueue<>();
    private final Set<WorkerProcess> live = ConcurrentHashMap.newKeySet();
    private final Object lifecycle = new Object();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong taskSeq = new AtomicLong();
    private final AtomicInteger workerSeq = new AtomicInteger();
    private final ExecutorService ioExecutor;

    ProcessWorkerPool(WorkerLauncher launcher, ObjectMapper mapper, int poolSize, int maxTasksPerWorker, Duration shutdownGrace) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be >= 1");
        }
        this.launcher = launcher;
        this.mapper = mapper;
        this.poolSize = poolSize;
        this.maxTasksPerWorker = Math.max(1, maxTasksPerWorker);
        this.shutdownGrace = shutdownGrace;
        this.ioExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "quarry-worker-io");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Spawns {@code poolSize} workers.
     *
     * @throws WorkerSpawnException if any worker cannot be started; already started ones are stopped
     */
    public static ProcessWorkerPool start(WorkerPoolProperties props, ObjectMapper mapper) {
        ProcessWorkerPool pool = new ProcessWorkerPool(
                new WorkerLauncher(props.getJvmOptions(), props.getClasspath()),
                mapper,
                props.getPoolSize(),
                props.getMaxTasksPerWorker(),
                props.getShutdownGrace());
        pool.spawnAll();
        return pool;
    }

    void spawnAll() {
        try {
            for (int i = 0; i < poolSize; i++) {
                idle.add(spawn());
            }
        } catch (WorkerSpawnException e) {
            shutdown();
            throw e;
        }
        logger.info("Worker pool started with {} processes (maxTasksPerWorker={})", poolSize, maxTasksPerWorker);
    }

    @Override
    public WorkerResult submit(Class<? extends WorkerFunction> function, JsonNode args, Duration timeout) {
        ensureOpen();
        long deadline = System.nanoTime() + timeout.toNanos();
        long taskId = taskSeq.incrementAndGet();
        String name = function.getSimpleName();

        WorkerProcess worker = awaitIdle(deadline);
        if (worker == null) {
            logger.warn("Task {} ({}) found no free worker within {}", taskId, name, timeout);
            return WorkerResult.timeout(name + " timed out waiting for a free worker after " + timeout.toSeconds() + "s");
        }

        boolean healthy = false;
        Future<String> pending = null;
        try {
            worker.send(mapper.writeValueAsString(new WorkerProtocol.TaskRequest(taskId, function.getName(), args)));
            pending = ioExecutor.submit(worker::readLine);
            String line = pending.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            if (line == null) {
                failIfClosed(taskId, null);
                logger.warn("Worker {} exited during task {} ({}), exit code {}", worker, taskId, name, worker.exitCode());
                return WorkerResult.failed(ErrorType.INTERNAL, "Worker process exited unexpectedly", "exit code " + worker.exitCode(), null);
            }
            WorkerProtocol.TaskResponse response = mapper.readValue(line, WorkerProtocol.TaskResponse.class);
            if (response.taskId() != taskId) {
                logger.error("Worker {} answered task {} while running task {}", worker, response.taskId(), taskId);
                return WorkerResult.failed(ErrorType.INTERNAL, "Worker protocol out of sync", null, null);
            }
            healthy = true;
            return response.ok()
                    ? WorkerResult.ok(response.result())
                    : WorkerResult.failed(ErrorType.fromCode(response.errorType()), response.message(), response.details(), response.context());
        } catch (TimeoutException e) {
            logger.warn("Task {} ({}) exceeded {}; killing {}", taskId, name, timeout, worker);
            return WorkerResult.timeout(name + " timed out after " + timeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            failIfClosed(taskId, e.getCause());
            logger.warn("Lost contact with {} during task {} ({})", worker, taskId, name, e.getCause());
            return WorkerResult.failed(ErrorType.INTERNAL, "Worker process failed", String.valueOf(e.getCause()), null);
        } catch (JsonProcessingException e) {
            logger.error("Worker {} sent an unreadable response for task {}", worker, taskId, e);
            return WorkerResult.failed(ErrorType.INTERNAL, "Unreadable worker response", e.getOriginalMessage(), null);
        } catch (IOException e) {
            failIfClosed(taskId, e);
            logger.warn("Could not send task {} ({}) to {}", taskId, name, worker, e);
            return WorkerResult.failed(ErrorType.INTERNAL, "Worker process unavailable", e.getMessage(), null);
        } catch (RejectedExecutionException e) {
            // the io executor only stops during shutdown
            throw new WorkerPoolException("Worker pool closed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerPoolException("Interrupted while waiting for task " + taskId, e);
        } finally {
            if (pending != null && !healthy) {
                pending.cancel(true);
            }
            release(worker, healthy);
        }
    }

    @Override
    public int size() {
        return poolSize;
    }

    /** Workers currently alive, busy or idle. */
    public int liveWorkers() {
        return (int) live.stream().filter(WorkerProcess::isAlive).count();
    }

    /** Process ids of live workers, for diagnostics. */
    public List<Long> workerPids() {
        List<Long> pids = new ArrayList<>();
        for (WorkerProcess w : live) {
            pids.add(w.pid());
        }
        return pids;
    }

    @Override
    public void shutdown() {
        List<WorkerProcess> toStop;
        synchronized (lifecycle) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            toStop = new ArrayList<>(live);
            idle.clear();
        }
        logger.info("Stopping {} worker processes", toStop.size());
        List<Future<?>> stops = new ArrayList<>();
        for (WorkerProcess w : toStop) {
            stops.add(ioExecutor.submit(() -> w.terminate(shutdownGrace)));
        }
        for (Future<?> f : stops) {
            try {
                f.get();
            } catch (ExecutionException e) {
                logger.warn("Worker stop failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                toStop.forEach(WorkerProcess::kill);
                break;
            }
        }
        live.clear();
        ioExecutor.shutdownNow();
        logger.info("Worker pool stopped");
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new WorkerPoolException("Worker pool closed");
        }
    }

    /** A worker lost because {@link #shutdown()} stopped it is reported as a closed pool. */
    private void failIfClosed(long taskId, Throwable cause) {
        if (closed.get()) {
            logger.debug("Task {} abandoned: pool shut down while it ran", taskId);
            throw new WorkerPoolException("Worker pool closed", cause);
        }
    }

    private WorkerProcess awaitIdle(long deadline) {
        try {
            while (true) {
                ensureOpen();
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return null;
                }
                WorkerProcess w = idle.poll(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(IDLE_POLL_MILLIS)), TimeUnit.NANOSECONDS);
                if (w != null) {
                    if (w.isAlive()) {
                        return w;
                    }
                    logger.warn("Idle {} found dead (exit code {}); replacing", w, w.exitCode());
                    replace(w);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerPoolException("Interrupted while waiting for a worker", e);
        }
    }

    private void release(WorkerProcess worker, boolean healthy) {
        if (!healthy) {
            worker.kill();
            replace(worker);
            return;
        }
        boolean retire = worker.recordCompletion() >= maxTasksPerWorker;
        synchronized (lifecycle) {
            if (!retire && !closed.get()) {
                idle.add(worker);
                return;
            }
        }
        live.remove(worker);
        worker.terminate(shutdownGrace);
        if (retire) {
            logger.info("Recycled {} after {} tasks", worker, maxTasksPerWorker);
            replace(null);
        }
    }

    /** Drops {@code dead} (if any) and adds a fresh worker to the idle queue unless closed. */
    private void replace(WorkerProcess dead) {
        if (dead != null) {
            live.remove(dead);
        }
        synchronized (lifecycle) {
            if (closed.get()) {
                return;
            }
            try {
                idle.add(spawn());
            } catch (WorkerSpawnException e) {
                logger.error("Could not replace worker; pool is running below its size of {}", poolSize, e);
            }
        }
    }

    private WorkerProcess spawn() {
        int id = workerSeq.incrementAndGet();
        try {
            WorkerProcess w = new WorkerProcess(id, launcher.launch());
            live.add(w);
            logger.debug("Spawned {}", w);
            return w;
        } catch (IOException e) {
            throw new WorkerSpawnException("Failed to start worker process " + id + ": " + e.getMessage(), e);
        }
    }
}
