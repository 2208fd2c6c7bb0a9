package org.iceforge.quarry.filecache;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A lease on a materialized dataset file. While open the file cannot be evicted.
 */
public final class CachedFile implements AutoCloseable {
    private final String url;
    private final Path path;
    private final long sizeBytes;
    private final boolean cacheHit;
    private final Runnable onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    CachedFile(String url, Path path, long sizeBytes, boolean cacheHit, Runnable onClose) {
        this.url = Objects.requireNonNull(url, "url");
        this.path = Objects.requireNonNull(path, "path");
        this.sizeBytes = sizeBytes;
        this.cacheHit = cacheHit;
        this.onClose = Objects.requireNonNull(onClose, "onClose");
    }

    /** A lease over a file the cache does not own (e.g. a {@code file://} upload). */
    public static CachedFile unmanaged(String url, Path path, long sizeBytes) {
        return new CachedFile(url, path, sizeBytes, true, () -> { });
    }

    public String url() { return url; }
    public Path path() { return path; }
    public long sizeBytes() { return sizeBytes; }
    public boolean cacheHit() { return cacheHit; }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            onClose.run();
        }
    }

    @Override
    public String toString() {
        return "CachedFile{url=" + url + ", path=" + path + ", sizeBytes=" + sizeBytes + ", cacheHit=" + cacheHit + "}";
    }
}
