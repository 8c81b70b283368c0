package com.questrail.edl.cmx3600.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Value of the {@code FCM:} header.
 */
public enum FrameCountMode {
    DROP_FRAME("DROP FRAME"),
    NON_DROP_FRAME("NON-DROP FRAME");

    private final String token;

    FrameCountMode(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static Optional<FrameCountMode> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        for (FrameCountMode mode : values()) {
            if (mode.token.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
