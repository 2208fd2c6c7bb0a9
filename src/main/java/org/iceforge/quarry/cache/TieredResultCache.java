package org.iceforge.quarry.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Memory tier in front of the persistent tier. A persistent hit is copied back into memory.
 * Writes go to the persistent tier first; each tier upserts independently, so losing the
 * second write only costs a future cache hit.
 */
public class TieredResultCache {
    private static final Logger logger = LoggerFactory.getLogger(TieredResultCache.class);

    private final InMemoryResultCache memory;
    private final PersistentResultCache persistent;

    public TieredResultCache(InMemoryResultCache memory, PersistentResultCache persistent) {
        this.memory = Objects.requireNonNull(memory, "memory");
        this.persistent = Objects.requireNonNull(persistent, "persistent");
    }

    /** Returns a hit from either tier, flagged as cached. */
    public Optional<QueryResult> get(CacheKey key) {
        Optional<QueryResult> hit = memory.get(key);
        if (hit.isPresent()) {
            logger.debug("Memory cache hit {}", key);
            return hit.map(r -> r.withCached(true));
        }
        Optional<QueryResult> stored = persistent.get(key);
        if (stored.isPresent()) {
            logger.debug("Persistent cache hit {}", key);
            memory.put(key, QueryOutcome.success(stored.get()));
            return stored.map(r -> r.withCached(true));
        }
        return Optional.empty();
    }

    public void put(CacheKey key, String sql, Collection<String> datasetUrls, QueryOutcome outcome) {
        if (outcome == null || !outcome.isSuccess()) {
            logger.debug("Not caching failed outcome for {} ({})", key, outcome == null ? null : outcome.errorType());
            return;
        }
        persistent.put(key, sql, datasetUrls, outcome);
        memory.put(key, outcome);
    }

    public InMemoryResultCache memory() {
        return memory;
    }

    public PersistentResultCache persistent() {
        return persistent;
    }
}
