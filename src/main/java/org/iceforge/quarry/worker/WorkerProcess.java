package org.iceforge.quarry.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One live worker JVM and its protocol streams. Used by one task at a time.
 */
final class WorkerProcess {
    private static final Logger logger = LoggerFactory.getLogger(WorkerProcess.class);
    private static final long KILL_WAIT_SECONDS = 5;

    private final int id;
    private final Process process;
    private final BufferedWriter stdin;
    private final BufferedReader stdout;
    private int tasksCompleted;

    WorkerProcess(int id, Process process) {
        this.id = id;
        this.process = process;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.stdout = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
    }

    int id() {
        return id;
    }

    long pid() {
        return process.pid();
    }

    boolean isAlive() {
        return process.isAlive();
    }

    void send(String line) throws IOException {
        stdin.write(line);
        stdin.newLine();
        stdin.flush();
    }

    /** Blocks for the next response line; null once the worker has exited. */
    String readLine() throws IOException {
        return stdout.readLine();
    }

    int recordCompletion() {
        return ++tasksCompleted;
    }

    /** Closes stdin so the worker exits on its own, killing it after {@code grace}. */
    void terminate(Duration grace) {
        try {
            stdin.close();
        } catch (IOException e) {
            logger.debug("Worker {} stdin already closed: {}", id, e.getMessage());
        }
        try {
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Worker {} (pid {}) did not exit within {}; killing", id, pid(), grace);
                kill();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill();
        }
    }

    /** Forcible stop of the worker and anything it spawned. Waits briefly for the exit. */
    void kill() {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.error("Worker {} (pid {}) still alive after kill", id, pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    Integer exitCode() {
        return process.isAlive() ? null : process.exitValue();
    }

    @Override
    public String toString() {
        return "worker-" + id + "(pid " + pid() + ")";
    }
}
