package org.iceforge.quarry.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Deterministic id of a (SQL, dataset set) pair, shared by both result-cache tiers.
 * <p>
 * Canonical form: the trimmed SQL, then each dataset URL in sorted order preceded by a newline.
 * The SHA-256 hex digest of that string is the key.
 */
public record CacheKey(String value) {

    public CacheKey {
        Objects.requireNonNull(value, "value");
    }

    public static CacheKey of(String sql, Collection<String> datasetUrls) {
        StringBuilder sb = new StringBuilder(256);
        sb.append(sql == null ? "" : sql.trim());
        for (String url : sortedUrls(datasetUrls)) {
            sb.append('\n').append(url);
        }
        return new CacheKey(sha256Hex(sb.toString()));
    }

    static List<String> sortedUrls(Collection<String> datasetUrls) {
        if (datasetUrls == null || datasetUrls.isEmpty()) {
            return List.of();
        }
        List<String> urls = new ArrayList<>(datasetUrls.size());
        for (String u : datasetUrls) {
            urls.add(u == null ? "" : u);
        }
        Collections.sort(urls);
        return urls;
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
