package com.questrail.edl.timeline;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A piece of media placed on a track.
 *
 * <p>{@code sourceRange} selects the part of the media that is used. It may be
 * {@code null}, in which case the clip uses the media reference's available
 * range; see {@link #trimmedRange()}.</p>
 */
public record Clip(
        String name,
        MediaReference mediaReference,
        TimeRange sourceRange,
        List<Effect> effects,
        List<Marker> markers,
        Map<String, Object> metadata
) implements Composable
{
    public Clip {
        name = (name == null) ? "" : name;
        mediaReference = (mediaReference == null) ? new MissingReference("", null) : mediaReference;
        effects = (effects == null) ? List.of() : List.copyOf(effects);
        markers = (markers == null) ? List.of() : List.copyOf(markers);
        metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
    }

    public Clip(String name, MediaReference mediaReference, TimeRange sourceRange) {
        this(name, mediaReference, sourceRange, List.of(), List.of(), Map.of());
    }

    /**
     * Returns the range of source media this clip plays.
     *
     * @throws IllegalStateException if neither the clip nor its media reference
     *         define a range
     */
    public TimeRange trimmedRange() {
        if (sourceRange != null) {
            return sourceRange;
        }
        Optional<TimeRange> available = mediaReference.availableRange();
        return available.orElseThrow(() ->
                new IllegalStateException("Clip '" + name + "' has no source range and no available media range"));
    }

    public RationalTime duration() {
        return trimmedRange().duration();
    }
}
