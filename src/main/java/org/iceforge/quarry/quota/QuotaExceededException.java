package org.iceforge.quarry.quota;

import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.QuarryException;

/**
 * Thrown when a user has used up the token window.
 */
public class QuotaExceededException extends QuarryException {
    private final QuotaStatus status;

    public QuotaExceededException(String userId, QuotaStatus status) {
        super(ErrorType.QUOTA, message(userId, status));
        this.status = status;
    }

    private static String message(String userId, QuotaStatus status) {
        String base = "Token quota exceeded for " + userId + ": " + status.usageTokens() + " of " + status.limitTokens() + " used";
        return status.resetsInSeconds() == null ? base : base + "; resets in " + status.resetsInSeconds() + "s";
    }

    public QuotaStatus status() {
        return status;
    }

    public Long resetsInSeconds() {
        return status.resetsInSeconds();
    }
}
