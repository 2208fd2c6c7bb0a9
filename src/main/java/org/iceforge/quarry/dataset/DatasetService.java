package org.iceforge.quarry.dataset;

import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.filecache.CachedFile;
import org.iceforge.quarry.filecache.FileCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Resolves dataset URLs to validated local files. Remote URLs go through the {@link FileCache};
 * {@code file://} URLs are validated in place and never copied.
 */
public class DatasetService {
    private static final Logger logger = LoggerFactory.getLogger(DatasetService.class);

    private final DatasetFetcher fetcher;
    private final FileCache fileCache;
    private final long maxFileBytes;

    public DatasetService(DatasetFetcher fetcher, FileCache fileCache, long maxFileBytes) {
        this.fetcher = fetcher;
        this.fileCache = fileCache;
        this.maxFileBytes = maxFileBytes;
    }

    /**
     * Checks reachability and format, then warms the file cache. Never throws for dataset problems;
     * the failure is reported in the result.
     */
    public ValidationResult prefetch(String url) {
        try {
            if (!isLocal(url) && !fileCache.contains(url)) {
                Optional<String> mismatch = probeRemote(url);
                if (mismatch.isPresent()) {
                    logger.info("Dataset {} rejected: {}", url, mismatch.get());
                    return ValidationResult.failed(url, ErrorType.VALIDATION, mismatch.get());
                }
            }
            try (CachedFile file = materialize(url)) {
                return ValidationResult.ok(url, file.sizeBytes());
            }
        } catch (NetworkException e) {
            logger.info("Dataset {} unreachable: {}", url, e.getMessage());
            return ValidationResult.failed(url, ErrorType.NETWORK, e.getMessage());
        } catch (DatasetFormatException e) {
            logger.info("Dataset {} rejected: {}", url, e.getMessage());
            return ValidationResult.failed(url, ErrorType.VALIDATION, e.getMessage());
        }
    }

    /**
     * Returns a lease on a validated local copy. Callers must close it once the file is no longer
     * being read.
     *
     * @throws NetworkException       the resource could not be fetched
     * @throws DatasetFormatException the content is not the format its suffix claims
     */
    public CachedFile materialize(String url) {
        DatasetFormat format = DatasetFormat.fromUrl(url);
        if (isLocal(url)) {
            Path path = localPath(url);
            if (!Files.isRegularFile(path)) {
                throw new NetworkException("File not found: " + url);
            }
            ValidationResult v = FormatValidator.validateFile(url, path, format);
            if (!v.valid()) {
                throw v.errorType() == ErrorType.VALIDATION
                        ? new DatasetFormatException(v.message())
                        : new NetworkException(v.message());
            }
            return CachedFile.unmanaged(url, path, v.fileSizeBytes());
        }
        return fileCache.acquire(url, (u, tmp) -> {
            fetcher.download(u, tmp, maxFileBytes);
            ValidationResult v = FormatValidator.validateFile(u, tmp, format);
            if (!v.valid()) {
                throw new DatasetFormatException(v.message());
            }
        });
    }

    private Optional<String> probeRemote(String url) {
        DatasetFormat format = DatasetFormat.fromUrl(url);
        OptionalLong length = fetcher.probe(url);
        if (length.isPresent() && length.getAsLong() > maxFileBytes) {
            return Optional.of("File exceeds maximum size of " + maxFileBytes + " bytes");
        }
        byte[] head = fetcher.readHead(url, FormatValidator.headBytes(format));
        Optional<String> mismatch = FormatValidator.checkHead(format, head);
        if (mismatch.isPresent() || format != DatasetFormat.PARQUET) {
            return mismatch;
        }
        if (length.isPresent() && length.getAsLong() >= 2L * FormatValidator.MAGIC_BYTES) {
            return fetcher.readTail(url, FormatValidator.MAGIC_BYTES)
                    .flatMap(tail -> FormatValidator.checkTail(format, tail));
        }
        return Optional.empty();
    }

    static boolean isLocal(String url) {
        return url.toLowerCase(Locale.ROOT).startsWith("file:");
    }

    private static Path localPath(String url) {
        try {
            return Path.of(URI.create(url));
        } catch (IllegalArgumentException e) {
            throw new NetworkException("Invalid file URL: " + url, null, e);
        }
    }
}
