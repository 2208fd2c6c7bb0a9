package org.iceforge.quarry.cache;

/**
 * Snapshot of the in-memory tier.
 *
 * @param hitRate hits as a percentage of lookups, one decimal place
 */
public record CacheStats(int size, int maxSize, long hits, long misses, double hitRate) {
}
