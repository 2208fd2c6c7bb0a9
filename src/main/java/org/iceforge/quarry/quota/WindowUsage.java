package org.iceforge.quarry.quota;

import java.time.Instant;

/**
 * Tokens a user spent inside a window, and when the oldest counted record was written.
 *
 * @param oldestRecord null when nothing was recorded in the window
 */
public record WindowUsage(long tokens, Instant oldestRecord) {

    static final WindowUsage NONE = new WindowUsage(0, null);
}
