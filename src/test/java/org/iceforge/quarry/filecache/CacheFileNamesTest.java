package org.iceforge.quarry.filecache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheFileNamesTest {

    @Test
    void suffixFollowsUrlPathIgnoringQueryAndFragment() {
        assertEquals(".csv.gz", CacheFileNames.suffixFor("https://h/data/a.CSV.GZ?x=1"));
        assertEquals(".csv", CacheFileNames.suffixFor("https://h/data/a.csv#frag"));
        assertEquals(".tsv", CacheFileNames.suffixFor("https://h/a.tsv"));
        assertEquals(".parquet", CacheFileNames.suffixFor("https://h/a.parquet"));
        assertEquals(".parquet", CacheFileNames.suffixFor("https://h/download?id=7&fmt=csv"));
    }

    @Test
    void equivalentUrlsShareOneName() {
        String a = CacheFileNames.fileName("HTTPS://Example.COM:443/d/x.parquet?b=2&a=1#top");
        String b = CacheFileNames.fileName("https://example.com/d/x.parquet?a=1&b=2");
        assertEquals(a, b);
        assertTrue(a.endsWith(".parquet"));
        assertEquals(64 + ".parquet".length(), a.length());
    }

    @Test
    void pathAndQueryStillDistinguishUrls() {
        assertNotEquals(CacheFileNames.fileName("https://h/a.csv"), CacheFileNames.fileName("https://h/A.csv"));
        assertNotEquals(CacheFileNames.fileName("https://h/a.csv?v=1"), CacheFileNames.fileName("https://h/a.csv?v=2"));
        assertNotEquals(CacheFileNames.fileName("http://h:8080/a.csv"), CacheFileNames.fileName("http://h/a.csv"));
    }

    @Test
    void recognizesTempFiles() {
        assertTrue(CacheFileNames.isTempFile(".download-123.parquet.tmp"));
        assertFalse(CacheFileNames.isTempFile("abc.parquet"));
        assertFalse(CacheFileNames.isTempFile(".download-123.parquet"));
    }

    @Test
    void rejectsBlankUrl() {
        assertThrows(IllegalArgumentException.class, () -> CacheFileNames.fileName(" "));
    }
}
