package org.iceforge.quarry.quota;

/**
 * Rough token count for text: about 4 characters per token.
 */
public final class TokenEstimator {
    private static final double CHARS_PER_TOKEN = 4.0;

    private TokenEstimator() {}

    public static long estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (long) Math.ceil(text.length() / CHARS_PER_TOKEN);
    }
}
