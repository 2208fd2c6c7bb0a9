package org.iceforge.quarry.dataset;

import org.iceforge.quarry.ErrorType;

/**
 * Outcome of probing and validating one dataset URL. {@code errorType} and {@code message} are
 * null when valid; {@code fileSizeBytes} is null when the size is unknown.
 */
public record ValidationResult(
        String url,
        boolean valid,
        ErrorType errorType,
        String message,
        Long fileSizeBytes
) {
    public static ValidationResult ok(String url, long fileSizeBytes) {
        return new ValidationResult(url, true, null, null, fileSizeBytes);
    }

    public static ValidationResult failed(String url, ErrorType errorType, String message) {
        return new ValidationResult(url, false, errorType, message, null);
    }
}
