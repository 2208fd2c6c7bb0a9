package org.iceforge.quarry.cache;

import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryResultCacheTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");

    private static CacheKey key(String sql) {
        return CacheKey.of(sql, List.of("https://data.example/trips.parquet"));
    }

    @Test
    void getAfterPutReturnsTheSamePayload() {
        InMemoryResultCache cache = new InMemoryResultCache(10, Duration.ofSeconds(300), clock);
        QueryResult r = Results.of("n", 1, 2, 3);

        cache.put(key("a"), QueryOutcome.success(r));

        assertEquals(r, cache.get(key("a")).orElseThrow());
    }

    @Test
    void entryExpiresExactlyAtTtl() {
        InMemoryResultCache cache = new InMemoryResultCache(10, Duration.ofSeconds(300), clock);
        cache.put(key("a"), QueryOutcome.success(Results.of("n", 1)));

        clock.advance(Duration.ofSeconds(299));
        assertTrue(cache.get(key("a")).isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get(key("a")).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void leastRecentlyUsedIsEvicted() {
        InMemoryResultCache cache = new InMemoryResultCache(2, Duration.ofSeconds(300), clock);
        cache.put(key("A"), QueryOutcome.success(Results.of("n", 1)));
        cache.put(key("B"), QueryOutcome.success(Results.of("n", 2)));
        cache.get(key("A"));

        cache.put(key("C"), QueryOutcome.success(Results.of("n", 3)));

        assertEquals(2, cache.size());
        assertTrue(cache.get(key("A")).isPresent());
        assertTrue(cache.get(key("B")).isEmpty());
        assertTrue(cache.get(key("C")).isPresent());
    }

    @Test
    void neverHoldsMoreThanMaxSize() {
        InMemoryResultCache cache = new InMemoryResultCache(100, Duration.ofSeconds(300), clock);
        for (int i = 0; i < 101; i++) {
            cache.put(key("q" + i), QueryOutcome.success(Results.of("n", i)));
        }

        assertEquals(100, cache.size());
        assertTrue(cache.get(key("q0")).isEmpty());
        assertTrue(cache.get(key("q1")).isPresent());
        assertTrue(cache.get(key("q100")).isPresent());
    }

    @Test
    void failuresAreNeverStored() {
        InMemoryResultCache cache = new InMemoryResultCache(10, Duration.ofSeconds(300), clock);

        cache.put(key("bad"), QueryOutcome.failure(ErrorType.SQL, "column nope not found"));

        assertTrue(cache.get(key("bad")).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void statsCountHitsAndMisses() {
        InMemoryResultCache cache = new InMemoryResultCache(5, Duration.ofSeconds(300), clock);
        assertEquals(0.0, cache.stats().hitRate());

        cache.put(key("a"), QueryOutcome.success(Results.of("n", 1)));
        cache.get(key("a"));
        cache.get(key("a"));
        cache.get(key("missing"));

        CacheStats stats = cache.stats();
        assertEquals(1, stats.size());
        assertEquals(5, stats.maxSize());
        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(66.7, stats.hitRate());
    }

    @Test
    void clearEmptiesTheCacheButKeepsCounters() {
        InMemoryResultCache cache = new InMemoryResultCache(5, Duration.ofSeconds(300), clock);
        cache.put(key("a"), QueryOutcome.success(Results.of("n", 1)));
        cache.get(key("a"));

        cache.clear();

        assertEquals(0, cache.stats().size());
        assertEquals(1, cache.stats().hits());
    }
}
