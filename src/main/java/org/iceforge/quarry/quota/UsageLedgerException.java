package org.iceforge.quarry.quota;

import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.QuarryException;

/** The token ledger could not be read or written. */
public class UsageLedgerException extends QuarryException {

    public UsageLedgerException(String message, Throwable cause) {
        super(ErrorType.INTERNAL, message, cause);
    }
}
