package org.iceforge.quarry.filecache;

import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.QuarryException;

public class FileCacheException extends QuarryException {
    public FileCacheException(String message, Throwable cause) { super(ErrorType.INTERNAL, message, cause); }
    public FileCacheException(String message) { super(ErrorType.INTERNAL, message); }
}
