package org.iceforge.quarry.cache;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyTest {

    @Test
    void trimmedSqlAndUrlOrderDoNotMatter() {
        CacheKey a = CacheKey.of("SELECT 1", List.of("https://h/a.parquet", "https://h/b.parquet"));
        CacheKey b = CacheKey.of("  SELECT 1\n\t", List.of("https://h/b.parquet", "https://h/a.parquet"));

        assertEquals(a, b);
        assertEquals(64, a.value().length());
        assertTrue(a.value().matches("[0-9a-f]+"));
    }

    @Test
    void anyOtherDifferenceChangesTheKey() {
        CacheKey base = CacheKey.of("SELECT 1", List.of("https://h/a.parquet"));

        assertNotEquals(base, CacheKey.of("SELECT  1", List.of("https://h/a.parquet")));
        assertNotEquals(base, CacheKey.of("select 1", List.of("https://h/a.parquet")));
        assertNotEquals(base, CacheKey.of("SELECT 1", List.of("https://h/a2.parquet")));
        assertNotEquals(base, CacheKey.of("SELECT 1", List.of()));
        assertNotEquals(base, CacheKey.of("SELECT 1", List.of("https://h/a.parquet", "https://h/a.parquet")));
    }

    @Test
    void nullInputsActLikeEmptyOnes() {
        assertEquals(CacheKey.of("", List.of()), CacheKey.of(null, null));
    }
}
