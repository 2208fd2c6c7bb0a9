package org.iceforge.quarry.dataset;

import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.QuarryException;

/**
 * Unreachable host, timeout, or non-2xx answer. {@link #httpStatus()} is null when no HTTP
 * response was received at all.
 */
public class NetworkException extends QuarryException {
    private final Integer httpStatus;

    public NetworkException(String message, Integer httpStatus, Throwable cause) {
        super(ErrorType.NETWORK, message, cause);
        this.httpStatus = httpStatus;
    }

    public NetworkException(String message) {
        this(message, null, null);
    }

    public Integer httpStatus() {
        return httpStatus;
    }
}
