package org.iceforge.quarry.dataset;

import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.QuarryException;

public class DatasetFormatException extends QuarryException {
    public DatasetFormatException(String message) { super(ErrorType.VALIDATION, message); }
}
