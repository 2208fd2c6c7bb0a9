package org.iceforge.quarry.cache;

import java.time.Instant;

record CacheEntry(CacheKey key, QueryResult result, Instant createdAt, Instant expiresAt) {

    /** Expired from the instant {@code expiresAt} is reached, not after it. */
    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    int rowCount() {
        return result.rowCount();
    }
}
