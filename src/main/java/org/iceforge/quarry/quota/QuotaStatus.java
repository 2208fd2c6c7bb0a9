package org.iceforge.quarry.quota;

/**
 * A user's standing against the rolling token window, computed on each check.
 *
 * @param usagePercent    usage over limit times 100, not clamped
 * @param resetsInSeconds seconds until the oldest counted record leaves the window; null without usage
 */
public record QuotaStatus(
        boolean allowed,
        long usageTokens,
        long limitTokens,
        long remainingTokens,
        Long resetsInSeconds,
        double usagePercent,
        boolean warning
) {
}
