package org.iceforge.quarry.worker;

import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.QuarryException;

public class WorkerPoolException extends QuarryException {
    public WorkerPoolException(String message, Throwable cause) { super(ErrorType.INTERNAL, message, cause); }
    public WorkerPoolException(String message) { super(ErrorType.INTERNAL, message); }
}
