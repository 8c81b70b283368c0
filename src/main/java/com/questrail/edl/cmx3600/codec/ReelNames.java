package com.questrail.edl.cmx3600.codec;

/**
 * Reel name normalization.
 *
 * <p>CMX 3600 reel names are short tokens of letters, digits and underscores.
 * Anything else in a candidate name is replaced, one underscore per
 * character, and the result is cut to the configured length.</p>
 */
public final class ReelNames
{
    /** Reel name length most CMX 3600 consumers accept. */
    public static final int DEFAULT_LENGTH = 8;

    /** Used when a name is empty after normalization. */
    public static final String PLACEHOLDER = "AX";

    private ReelNames() {}

    /**
     * Normalizes {@code name} into a reel token.
     *
     * @param name      candidate name, may be {@code null}
     * @param maxLength maximum length; 0 or negative disables truncation
     * @return the normalized name, never empty
     */
    public static String sanitize(String name, int maxLength) {
        if (name == null || name.isEmpty()) {
            return PLACEHOLDER;
        }

        StringBuilder out = new StringBuilder(name.length());
        name.codePoints().forEach(cp -> out.append(isReelChar(cp) ? (char) cp : '_'));

        if (maxLength > 0 && out.length() > maxLength) {
            out.setLength(maxLength);
        }
        return out.toString();
    }

    private static boolean isReelChar(int cp) {
        return (cp >= 'A' && cp <= 'Z')
                || (cp >= 'a' && cp <= 'z')
                || (cp >= '0' && cp <= '9')
                || cp == '_';
    }
}
