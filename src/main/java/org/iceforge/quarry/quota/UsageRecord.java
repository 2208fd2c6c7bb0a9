package org.iceforge.quarry.quota;

import java.time.Instant;

/** One row of the token ledger. */
public record UsageRecord(String id, String userId, long inputTokens, long outputTokens, Instant recordedAt) {

    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
