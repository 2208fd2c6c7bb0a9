package org.iceforge.quarry.filecache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Disk cache of downloaded dataset files.
 * <p>
 * Layout: one flat directory, entries named by {@link CacheFileNames#fileName(String)}, in-progress
 * downloads as {@code .download-*.tmp} siblings. Downloads complete into the temp file and are
 * atomically moved into place, so a reader never sees a partial file under its final name.
 * <p>
 * Entries are reference counted through {@link CachedFile} leases; eviction and cleanup only delete
 * files nobody holds.
 */
public class FileCache {
    private static final Logger logger = LoggerFactory.getLogger(FileCache.class);
    private static final int LOCK_STRIPES = 64;

    /** Writes the body of {@code url} to {@code target}. Validation failures should throw. */
    @FunctionalInterface
    public interface Downloader {
        void download(String url, Path target) throws IOException;
    }

    private final Path root;
    private final long maxCacheBytes;
    private final Duration staleTempAge;
    private final Duration maxEntryAge;
    private final Clock clock;

    private final Map<Path, Integer> references = new HashMap<>();
    private final ReentrantLock[] downloadLocks = new ReentrantLock[LOCK_STRIPES];

    public FileCache(FileCacheProperties props, Clock clock) {
        this(Path.of(props.getDir()), props.maxCacheBytes(), props.getStaleTempAge(), props.getMaxEntryAge(), clock);
    }

    public FileCache(Path root, long maxCacheBytes, Duration staleTempAge, Duration maxEntryAge, Clock clock) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        if (maxCacheBytes <= 0) {
            throw new IllegalArgumentException("maxCacheBytes must be > 0");
        }
        this.maxCacheBytes = maxCacheBytes;
        this.staleTempAge = Objects.requireNonNull(staleTempAge, "staleTempAge");
        this.maxEntryAge = Objects.requireNonNull(maxEntryAge, "maxEntryAge");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (int i = 0; i < LOCK_STRIPES; i++) {
            downloadLocks[i] = new ReentrantLock();
        }
    }

    public Path root() {
        return root;
    }

    /**
     * Runs once at process start: creates the root, removes temp files orphaned by a crash, then
     * evicts down to capacity. Safe to repeat.
     *
     * @return number of files removed
     */
    public int startupCleanup() {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new FileCacheException("Failed to create cache directory: " + root, e);
        }
        int removed = sweepStaleTempFiles() + evict();
        logger.info("File cache ready at {} (removed {} files, maxBytes={})", root, removed, maxCacheBytes);
        return removed;
    }

    /**
     * Returns a lease on the local copy of {@code url}, downloading it first when absent.
     * Concurrent callers for the same URL download once.
     */
    public CachedFile acquire(String url, Downloader downloader) {
        Objects.requireNonNull(downloader, "downloader");
        Path target = pathFor(url);
        retain(target);
        boolean downloaded = false;
        try {
            ReentrantLock lock = lockFor(target);
            lock.lock();
            try {
                if (Files.isRegularFile(target)) {
                    touch(target);
                    logger.debug("File cache hit for {} -> {}", url, target.getFileName());
                } else {
                    download(url, target, downloader);
                    downloaded = true;
                }
            } finally {
                lock.unlock();
            }
            long size = Files.size(target);
            CachedFile lease = new CachedFile(url, target, size, !downloaded, () -> release(target));
            if (downloaded) {
                evict();
            }
            return lease;
        } catch (IOException e) {
            release(target);
            throw new FileCacheException("Failed to materialize " + url, e);
        } catch (RuntimeException e) {
            release(target);
            throw e;
        }
    }

    /** True when {@code url} has a completed local copy. Never downloads. */
    public boolean contains(String url) {
        return Files.isRegularFile(pathFor(url));
    }

    public Path pathFor(String url) {
        return root.resolve(CacheFileNames.fileName(url));
    }

    /**
     * Removes entries older than the max age, then least recently used entries until the total
     * size fits. Referenced entries are skipped.
     *
     * @return number of entries removed
     */
    public int evict() {
        List<Entry> entries = listEntries();
        if (entries.isEmpty()) {
            return 0;
        }
        Instant ageCutoff = clock.instant().minus(maxEntryAge);
        long total = entries.stream().mapToLong(Entry::size).sum();
        entries.sort(Comparator.comparing(Entry::lastUsed));

        int removed = 0;
        for (Entry e : entries) {
            boolean tooOld = e.lastUsed().isBefore(ageCutoff);
            if (!tooOld && total <= maxCacheBytes) {
                continue;
            }
            if (deleteIfUnreferenced(e.path())) {
                total -= e.size();
                removed++;
                logger.info("Evicted cached file {} ({} bytes, lastUsed={})", e.path().getFileName(), e.size(), e.lastUsed());
            }
        }
        if (total > maxCacheBytes) {
            logger.warn("File cache still over capacity after eviction: {} > {} bytes (entries in use)", total, maxCacheBytes);
        }
        return removed;
    }

    /** Deletes temp files left behind by downloads older than the stale threshold. */
    public int sweepStaleTempFiles() {
        if (!Files.isDirectory(root)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(staleTempAge);
        int removed = 0;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(root)) {
            for (Path p : ds) {
                if (!CacheFileNames.isTempFile(p.getFileName().toString())) continue;
                try {
                    if (Files.getLastModifiedTime(p).toInstant().isBefore(cutoff) && Files.deleteIfExists(p)) {
                        removed++;
                        logger.info("Removed stale temp file {}", p.getFileName());
                    }
                } catch (NoSuchFileException e) {
                    logger.debug("Temp file {} already removed", p.getFileName());
                } catch (IOException e) {
                    logger.warn("Failed to remove stale temp file {}", p, e);
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to scan cache directory {} for temp files", root, e);
        }
        return removed;
    }

    /** Removes every unreferenced entry. */
    public int clear() {
        int removed = 0;
        for (Entry e : listEntries()) {
            if (deleteIfUnreferenced(e.path())) removed++;
        }
        return removed;
    }

    /** Entry count and bytes; zeros when the directory is missing or empty. */
    public FileCacheStats stats() {
        List<Entry> entries = listEntries();
        long bytes = entries.stream().mapToLong(Entry::size).sum();
        return new FileCacheStats(entries.size(), bytes, maxCacheBytes, root.toString());
    }

    int referenceCount(Path path) {
        synchronized (references) {
            return references.getOrDefault(path, 0);
        }
    }

    private void download(String url, Path target, Downloader downloader) throws IOException {
        Files.createDirectories(root);
        Path tmp = Files.createTempFile(root, CacheFileNames.TEMP_PREFIX,
                CacheFileNames.suffixFor(url) + CacheFileNames.TEMP_SUFFIX);
        try {
            downloader.download(url, tmp);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            touch(target);
            logger.debug("Cached {} -> {} ({} bytes)", url, target.getFileName(), Files.size(target));
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private void touch(Path p) {
        try {
            Files.setLastModifiedTime(p, FileTime.from(clock.instant()));
        } catch (IOException e) {
            logger.debug("Failed to update access time of {}", p, e);
        }
    }

    private void retain(Path p) {
        synchronized (references) {
            references.merge(p, 1, Integer::sum);
        }
    }

    private void release(Path p) {
        synchronized (references) {
            references.computeIfPresent(p, (k, v) -> v <= 1 ? null : v - 1);
        }
    }

    private boolean deleteIfUnreferenced(Path p) {
        synchronized (references) {
            if (references.getOrDefault(p, 0) > 0) {
                return false;
            }
            try {
                return Files.deleteIfExists(p);
            } catch (IOException e) {
                logger.warn("Failed to delete cached file {}", p, e);
                return false;
            }
        }
    }

    private ReentrantLock lockFor(Path p) {
        return downloadLocks[Math.floorMod(p.hashCode(), LOCK_STRIPES)];
    }

    private List<Entry> listEntries() {
        List<Entry> out = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return out;
        }
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(root)) {
            for (Path p : ds) {
                if (CacheFileNames.isTempFile(p.getFileName().toString()) || !Files.isRegularFile(p)) continue;
                try {
                    out.add(new Entry(p, Files.size(p), Files.getLastModifiedTime(p).toInstant()));
                } catch (NoSuchFileException e) {
                    logger.debug("Cached file {} evicted while listing", p.getFileName());
                } catch (IOException e) {
                    logger.warn("Failed to stat cached file {}", p, e);
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to list cache directory {}", root, e);
        }
        return out;
    }

    private record Entry(Path path, long size, Instant lastUsed) {}
}
