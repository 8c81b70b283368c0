package com.questrail.edl.timeline;

import java.util.Optional;

/**
 * Placeholder for media that is not known.
 */
public record MissingReference(String name, TimeRange range) implements MediaReference
{
    public MissingReference {
        name = (name == null) ? "" : name;
    }

    @Override
    public Optional<TimeRange> availableRange() {
        return Optional.ofNullable(range);
    }
}
