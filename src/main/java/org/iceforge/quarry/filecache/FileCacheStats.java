package org.iceforge.quarry.filecache;

public record FileCacheStats(int entryCount, long totalBytes, long maxBytes, String cacheDir) {}
