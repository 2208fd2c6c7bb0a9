package org.iceforge.quarry.cache;

import java.time.Instant;

/** Row count and creation-time range of the persistent tier; both instants null when empty. */
public record PersistentCacheStats(long size, Instant oldestEntry, Instant newestEntry) {
}
