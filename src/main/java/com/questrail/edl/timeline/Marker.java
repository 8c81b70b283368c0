package com.questrail.edl.timeline;

import java.util.Map;
import java.util.Objects;

/**
 * A named, coloured annotation on a range of a clip's source time.
 *
 * <p>The colour is a free token as written by the originating system
 * (e.g. {@code RED}); it is not validated against a palette.</p>
 */
public record Marker(
        String name,
        TimeRange markedRange,
        String color,
        String comment,
        Map<String, Object> metadata
) {
    public Marker {
        name = (name == null) ? "" : name;
        Objects.requireNonNull(markedRange, "markedRange");
        color = (color == null) ? "" : color;
        comment = (comment == null) ? "" : comment;
        metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
    }
}
