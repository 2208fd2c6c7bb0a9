package org.iceforge.quarry.dataset;

import org.iceforge.quarry.ErrorType;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Optional;

/**
 * Magic-marker checks. Only the leading and trailing bytes are read; row content is never parsed,
 * so a well-formed file without rows is valid.
 */
public final class FormatValidator {
    public static final int MAGIC_BYTES = 4;
    static final int TEXT_SNIFF_BYTES = 4096;

    private static final byte[] PARQUET_MAGIC = {'P', 'A', 'R', '1'};
    private static final byte[] GZIP_MAGIC = {(byte) 0x1f, (byte) 0x8b};

    private FormatValidator() {}

    /** Bytes of file head {@link #checkHead} wants for {@code format}. */
    public static int headBytes(DatasetFormat format) {
        return format == DatasetFormat.CSV || format == DatasetFormat.TSV ? TEXT_SNIFF_BYTES : MAGIC_BYTES;
    }

    /**
     * @return a message describing the mismatch, or empty when the head is acceptable
     */
    public static Optional<String> checkHead(DatasetFormat format, byte[] head) {
        switch (format) {
            case PARQUET -> {
                if (head.length < PARQUET_MAGIC.length) {
                    return Optional.of("Not a valid parquet file (too few bytes)");
                }
                if (!Arrays.equals(head, 0, PARQUET_MAGIC.length, PARQUET_MAGIC, 0, PARQUET_MAGIC.length)) {
                    return Optional.of("Not a valid parquet file (missing PAR1 header)");
                }
                return Optional.empty();
            }
            case CSV_GZ -> {
                if (head.length < GZIP_MAGIC.length
                        || !Arrays.equals(head, 0, GZIP_MAGIC.length, GZIP_MAGIC, 0, GZIP_MAGIC.length)) {
                    return Optional.of("Not a valid gzip-compressed CSV file");
                }
                return Optional.empty();
            }
            default -> {
                for (byte b : head) {
                    if (b == 0) {
                        return Optional.of("Not a valid " + format.name().toLowerCase() + " file (binary content)");
                    }
                }
                return Optional.empty();
            }
        }
    }

    /** Parquet repeats its magic in the footer; other formats have nothing to check. */
    public static Optional<String> checkTail(DatasetFormat format, byte[] tail) {
        if (format != DatasetFormat.PARQUET) {
            return Optional.empty();
        }
        if (tail.length < PARQUET_MAGIC.length
                || !Arrays.equals(tail, tail.length - PARQUET_MAGIC.length, tail.length, PARQUET_MAGIC, 0, PARQUET_MAGIC.length)) {
            return Optional.of("Not a valid parquet file (missing PAR1 footer)");
        }
        return Optional.empty();
    }

    public static ValidationResult validateFile(String url, Path file, DatasetFormat format) {
        try (SeekableByteChannel ch = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long size = ch.size();
            byte[] head = read(ch, 0, (int) Math.min(size, headBytes(format)));
            Optional<String> mismatch = checkHead(format, head);
            if (mismatch.isEmpty() && format == DatasetFormat.PARQUET && size >= 2L * MAGIC_BYTES) {
                mismatch = checkTail(format, read(ch, size - MAGIC_BYTES, MAGIC_BYTES));
            }
            return mismatch
                    .map(m -> ValidationResult.failed(url, ErrorType.VALIDATION, m))
                    .orElseGet(() -> ValidationResult.ok(url, size));
        } catch (NoSuchFileException e) {
            return ValidationResult.failed(url, ErrorType.NETWORK, "File not found: " + file);
        } catch (IOException e) {
            return ValidationResult.failed(url, ErrorType.NETWORK, "Failed to validate file: " + e.getMessage());
        }
    }

    private static byte[] read(SeekableByteChannel ch, long position, int length) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(length);
        ch.position(position);
        while (buf.hasRemaining() && ch.read(buf) > 0) {
            // keep filling
        }
        return Arrays.copyOf(buf.array(), buf.position());
    }
}
