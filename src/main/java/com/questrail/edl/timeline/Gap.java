package com.questrail.edl.timeline;

import java.util.Objects;

/**
 * Empty time on a track.
 */
public record Gap(String name, TimeRange sourceRange) implements Composable
{
    public Gap {
        name = (name == null) ? "" : name;
        Objects.requireNonNull(sourceRange, "sourceRange");
    }

    public static Gap withDuration(RationalTime duration) {
        return new Gap("", new TimeRange(RationalTime.zero(duration.rate()), duration));
    }

    public RationalTime duration() {
        return sourceRange.duration();
    }
}
