package org.iceforge.quarry.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tier 1: bounded LRU map of recent results with a fixed TTL.
 * <p>
 * Expired entries are dropped lazily on lookup. One lock guards the map and the hit/miss
 * counters so {@link #stats()} is always consistent.
 */
public class InMemoryResultCache {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryResultCache.class);

    private final int maxSize;
    private final Duration ttl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<CacheKey, CacheEntry> entries;
    private long hits;
    private long misses;

    public InMemoryResultCache(int maxSize, Duration ttl, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1");
        }
        this.maxSize = maxSize;
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, CacheEntry> eldest) {
                return size() > InMemoryResultCache.this.maxSize;
            }
        };
    }

    public Optional<QueryResult> get(CacheKey key) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key);
                misses++;
                logger.debug("Memory cache entry {} expired", key);
                return Optional.empty();
            }
            hits++;
            return Optional.of(entry.result());
        } finally {
            lock.unlock();
        }
    }

    /** Stores a successful outcome; failures are ignored. */
    public void put(CacheKey key, QueryOutcome outcome) {
        Objects.requireNonNull(key, "key");
        if (outcome == null || !outcome.isSuccess()) {
            return;
        }
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(key, outcome.result().withCached(false), now, now.plus(ttl));
        lock.lock();
        try {
            entries.remove(key);
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            long lookups = hits + misses;
            double rate = lookups == 0 ? 0.0 : Math.round(hits * 1000.0 / lookups) / 10.0;
            return new CacheStats(entries.size(), maxSize, hits, misses, rate);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
