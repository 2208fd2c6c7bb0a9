package org.iceforge.quarry.cache;

import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.QuarryException;

/** A persistent-cache write that could not complete. Logged by the tier, never propagated. */
public class CacheWriteException extends QuarryException {

    public CacheWriteException(String message, Throwable cause) {
        super(ErrorType.CACHE, message, cause);
    }
}
