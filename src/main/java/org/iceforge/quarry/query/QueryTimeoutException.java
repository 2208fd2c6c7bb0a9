package org.iceforge.quarry.query;

import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.QuarryException;

public class QueryTimeoutException extends QuarryException {

    public QueryTimeoutException(String message) {
        super(ErrorType.TIMEOUT, message);
    }
}
