package org.iceforge.quarry.filecache;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Local disk cache for downloaded dataset files, plus the HTTP limits used to fill it.
 */
@ConfigurationProperties(prefix = "quarry.file-cache")
public class FileCacheProperties {

    /** Cache root directory. */
    private String dir = System.getProperty("java.io.tmpdir") + "/quarry-cache";

    /** Upper bound on the sum of cached file sizes, e.g. "1GB". */
    private String maxCacheSize = "1GB";

    /** Downloads larger than this are aborted, e.g. "500MB". */
    private String maxFileSize = "500MB";

    /** Temp files older than this are considered orphaned by a crashed download. */
    private Duration staleTempAge = Duration.ofHours(1);

    /** Entries not used for this long are evicted regardless of total size. */
    private Duration maxEntryAge = Duration.ofDays(7);

    private Duration headTimeout = Duration.ofSeconds(10);

    private Duration downloadTimeout = Duration.ofSeconds(300);

    /** Delay between background passes that drop stale temp files and evict entries. */
    private Duration sweepInterval = Duration.ofMinutes(10);

    public String getDir() {
        return dir;
    }

    public void setDir(String dir) {
        this.dir = dir;
    }

    public String getMaxCacheSize() {
        return maxCacheSize;
    }

    public void setMaxCacheSize(String maxCacheSize) {
        this.maxCacheSize = maxCacheSize;
    }

    public String getMaxFileSize() {
        return maxFileSize;
    }

    public void setMaxFileSize(String maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    public Duration getStaleTempAge() {
        return staleTempAge;
    }

    public void setStaleTempAge(Duration staleTempAge) {
        this.staleTempAge = staleTempAge;
    }

    public Duration getMaxEntryAge() {
        return maxEntryAge;
    }

    public void setMaxEntryAge(Duration maxEntryAge) {
        this.maxEntryAge = maxEntryAge;
    }

    public Duration getHeadTimeout() {
        return headTimeout;
    }

    public void setHeadTimeout(Duration headTimeout) {
        this.headTimeout = headTimeout;
    }

    public Duration getDownloadTimeout() {
        return downloadTimeout;
    }

    public void setDownloadTimeout(Duration downloadTimeout) {
        this.downloadTimeout = downloadTimeout;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public long maxCacheBytes() {
        return DataSizeParser.parseBytes(maxCacheSize);
    }

    public long maxFileBytes() {
        return DataSizeParser.parseBytes(maxFileSize);
    }
}
