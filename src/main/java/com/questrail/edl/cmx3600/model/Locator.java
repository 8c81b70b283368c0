package com.questrail.edl.cmx3600.model;

import java.util.Objects;

/**
 * A {@code * LOC:} comment. The colour may be empty.
 */
public record Locator(String timecode, String color, String comment)
{
    public Locator {
        Objects.requireNonNull(timecode, "timecode");
        color = (color == null) ? "" : color;
        comment = (comment == null) ? "" : comment;
    }
}
