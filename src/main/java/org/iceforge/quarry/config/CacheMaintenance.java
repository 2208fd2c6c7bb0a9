package org.iceforge.quarry.config;

import org.iceforge.quarry.cache.PersistentResultCache;
import org.iceforge.quarry.filecache.FileCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic housekeeping of the file cache and the persistent result cache.
 */
@Component
public class CacheMaintenance {
    private static final Logger logger = LoggerFactory.getLogger(CacheMaintenance.class);

    private final FileCache fileCache;
    private final PersistentResultCache persistentResultCache;

    public CacheMaintenance(FileCache fileCache, PersistentResultCache persistentResultCache) {
        this.fileCache = fileCache;
        this.persistentResultCache = persistentResultCache;
    }

    @Scheduled(initialDelayString = "${quarry.file-cache.sweep-interval:PT10M}",
            fixedDelayString = "${quarry.file-cache.sweep-interval:PT10M}")
    public void sweepFileCache() {
        int temps = fileCache.sweepStaleTempFiles();
        int evicted = fileCache.evict();
        if (temps + evicted > 0) {
            logger.info("File cache sweep removed {} stale temp files and {} entries", temps, evicted);
        }
    }

    @Scheduled(initialDelayString = "${quarry.result-cache.cleanup-interval:PT15M}",
            fixedDelayString = "${quarry.result-cache.cleanup-interval:PT15M}")
    public void purgeExpiredResults() {
        persistentResultCache.cleanup();
    }
}
