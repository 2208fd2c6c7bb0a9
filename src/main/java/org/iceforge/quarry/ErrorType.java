package org.iceforge.quarry;

import java.util.Locale;

/**
 * Failure categories reported to callers. {@link #code()} is the stable lower-case tag
 * ("network", "timeout", ...) that crosses the worker process boundary.
 */
public enum ErrorType {
    NETWORK,
    VALIDATION,
    SQL,
    TIMEOUT,
    QUOTA,
    CACHE,
    INTERNAL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ErrorType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return INTERNAL;
        }
        for (ErrorType t : values()) {
            if (t.code().equalsIgnoreCase(code.trim())) {
                return t;
            }
        }
        return INTERNAL;
    }
}
