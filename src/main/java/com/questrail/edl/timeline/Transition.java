package com.questrail.edl.timeline;

import java.util.Map;
import java.util.Objects;

/**
 * A transition between the item before it and the item after it on a track.
 *
 * <p>{@code inOffset} is how far the transition reaches into the preceding
 * item, {@code outOffset} how far into the following one.</p>
 */
public record Transition(
        String name,
        TransitionType transitionType,
        RationalTime inOffset,
        RationalTime outOffset,
        Map<String, Object> metadata
) implements Composable
{
    public Transition {
        name = (name == null) ? "" : name;
        Objects.requireNonNull(transitionType, "transitionType");
        Objects.requireNonNull(inOffset, "inOffset");
        Objects.requireNonNull(outOffset, "outOffset");
        metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
    }
}
