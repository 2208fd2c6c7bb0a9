package org.iceforge.quarry.filecache;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-friendly sizes like "1GB", "500MiB", "4*1024*1024" into bytes.
 * <p>
 * Units are binary (KB = 1024). A bare number is a byte count; tokens are multiplied together.
 */
public final class DataSizeParser {
    private static final Pattern TOKEN = Pattern.compile("\\d+\\.\\d*|\\d+|\\*|L|KB|MB|GB|TB");

    private DataSizeParser() {}

    public static long parseBytes(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new IllegalArgumentException("size expression is blank");
        }
        String s = expr.replaceAll("\\s+", "").toUpperCase(Locale.ROOT)
                .replace("KIB", "KB").replace("MIB", "MB").replace("GIB", "GB").replace("TIB", "TB");

        BigDecimal result = BigDecimal.ONE;
        for (String token : tokenize(s, expr)) {
            switch (token) {
                case "*", "L" -> { }
                case "KB" -> result = result.multiply(BigDecimal.valueOf(1L << 10));
                case "MB" -> result = result.multiply(BigDecimal.valueOf(1L << 20));
                case "GB" -> result = result.multiply(BigDecimal.valueOf(1L << 30));
                case "TB" -> result = result.multiply(BigDecimal.valueOf(1L << 40));
                default -> result = result.multiply(new BigDecimal(token));
            }
        }
        long v = result.setScale(0, RoundingMode.FLOOR).longValueExact();
        if (v <= 0L) {
            throw new IllegalArgumentException("size out of range: " + expr);
        }
        return v;
    }

    private static List<String> tokenize(String normalized, String original) {
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(normalized);
        while (m.find()) {
            tokens.add(m.group());
        }
        if (!String.join("", tokens).equals(normalized)) {
            throw new IllegalArgumentException("invalid size expression: " + original);
        }
        return tokens;
    }
}
