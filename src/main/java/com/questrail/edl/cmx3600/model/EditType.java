package com.questrail.edl.cmx3600.model;

/**
 * Edit column of a CMX 3600 event line.
 */
public enum EditType {
    CUT("C"),
    DISSOLVE("D"),
    /** Written as {@code W###}; the full token is kept as the event's wipe code. */
    WIPE("W"),
    KEY_BACKGROUND("KB"),
    KEY("K");

    private final String token;

    EditType(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * Maps an edit token as matched by the event-line grammar. Any token
     * starting with {@code W} is a wipe.
     *
     * @throws IllegalArgumentException for tokens outside the grammar
     */
    public static EditType fromToken(String token) {
        if (token.startsWith("W")) {
            return WIPE;
        }
        for (EditType t : values()) {
            if (t.token.equals(token)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown edit type: " + token);
    }

    public boolean isTransition() {
        return this == DISSOLVE || this == WIPE;
    }
}
