package org.iceforge.quarry.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Limits for both result-cache tiers.
 */
@ConfigurationProperties(prefix = "quarry.result-cache")
public class ResultCacheProperties {

    /** Entries held by the in-memory tier before the least recently used is dropped. */
    private int maxSize = 100;

    private Duration ttl = Duration.ofSeconds(300);

    /** Lifetime of rows in the persistent tier. */
    private Duration persistentTtl = Duration.ofSeconds(3600);

    /** Row cap of the persistent tier; the oldest rows go first. */
    private int persistentMaxEntries = 500;

    /** How often expired persistent rows are purged. */
    private Duration cleanupInterval = Duration.ofMinutes(15);

    public int getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(int maxSize) {
        this.maxSize = maxSize;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public Duration getPersistentTtl() {
        return persistentTtl;
    }

    public void setPersistentTtl(Duration persistentTtl) {
        this.persistentTtl = persistentTtl;
    }

    public int getPersistentMaxEntries() {
        return persistentMaxEntries;
    }

    public void setPersistentMaxEntries(int persistentMaxEntries) {
        this.persistentMaxEntries = persistentMaxEntries;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public void setCleanupInterval(Duration cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
    }
}
