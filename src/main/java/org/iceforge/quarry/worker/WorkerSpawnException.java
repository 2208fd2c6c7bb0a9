package org.iceforge.quarry.worker;

/** A worker process could not be started. Fatal at pool start. */
public class WorkerSpawnException extends WorkerPoolException {
    public WorkerSpawnException(String message, Throwable cause) { super(message, cause); }
}
