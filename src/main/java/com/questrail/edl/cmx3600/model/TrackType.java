package com.questrail.edl.cmx3600.model;

import java.util.Optional;

/**
 * Track identifier column of a CMX 3600 event line.
 *
 * <p>Exactly one identifier ({@code V}) names the video track. {@code A} is
 * the generic audio channel; {@code A1}–{@code A4} are numbered channels.</p>
 */
public enum TrackType {
    V("V"),
    A("A"),
    A1("A1"),
    A2("A2"),
    A3("A3"),
    A4("A4");

    private final String token;

    TrackType(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public boolean isVideo() {
        return this == V;
    }

    public static Optional<TrackType> fromToken(String token) {
        for (TrackType t : values()) {
            if (t.token.equals(token)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the identifier the encoder assigns to the audio track at
     * {@code index} (zero-based): {@code A1}..{@code A4}, then generic {@code A}.
     */
    public static TrackType forAudioIndex(int index) {
        return switch (index) {
            case 0 -> A1;
            case 1 -> A2;
            case 2 -> A3;
            case 3 -> A4;
            default -> A;
        };
    }
}
