package org.iceforge.quarry.filecache;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Locale;

/**
 * Derives stable on-disk names for cached dataset files.
 * <p>
 * The URL is normalized first: scheme and host lower-cased, default ports and fragments
 * dropped, query parameters sorted. The name is {@code sha256(normalized) + suffix}.
 */
public final class CacheFileNames {
    public static final String TEMP_PREFIX = ".download-";
    public static final String TEMP_SUFFIX = ".tmp";

    private CacheFileNames() {}

    public static String fileName(String url) {
        return sha256Hex(normalizeUrl(url)) + suffixFor(url);
    }

    public static boolean isTempFile(String fileName) {
        return fileName.startsWith(TEMP_PREFIX) && fileName.endsWith(TEMP_SUFFIX);
    }

    /**
     * File suffix used by the query engine to pick a reader. Parquet unless the path says otherwise.
     */
    public static String suffixFor(String url) {
        String path = pathOf(url).toLowerCase(Locale.ROOT);
        if (path.endsWith(".csv.gz")) return ".csv.gz";
        if (path.endsWith(".csv")) return ".csv";
        if (path.endsWith(".tsv")) return ".tsv";
        return ".parquet";
    }

    static String normalizeUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is blank");
        }
        String trimmed = url.trim();
        try {
            URI u = new URI(trimmed);
            if (u.getScheme() == null || u.isOpaque()) {
                return stripFragment(trimmed);
            }
            String scheme = u.getScheme().toLowerCase(Locale.ROOT);
            String host = u.getHost() == null ? "" : u.getHost().toLowerCase(Locale.ROOT);
            int port = u.getPort();
            if (("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443)) {
                port = -1;
            }

            StringBuilder sb = new StringBuilder(trimmed.length());
            sb.append(scheme).append("://");
            if (u.getRawUserInfo() != null) sb.append(u.getRawUserInfo()).append('@');
            sb.append(host);
            if (port != -1) sb.append(':').append(port);
            String path = u.getRawPath();
            sb.append(path == null || path.isEmpty() ? "/" : path);
            String query = u.getRawQuery();
            if (query != null && !query.isEmpty()) {
                String[] params = query.split("&");
                Arrays.sort(params);
                sb.append('?').append(String.join("&", params));
            }
            return sb.toString();
        } catch (URISyntaxException e) {
            return stripFragment(trimmed);
        }
    }

    private static String pathOf(String url) {
        String s = stripFragment(url == null ? "" : url.trim());
        int q = s.indexOf('?');
        return q >= 0 ? s.substring(0, q) : s;
    }

    private static String stripFragment(String s) {
        int hash = s.indexOf('#');
        return hash >= 0 ? s.substring(0, hash) : s;
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
