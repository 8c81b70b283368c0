package com.questrail.edl.timeline;

import java.util.Objects;

/**
 * A half-open span of time: {@code [startTime, startTime + duration)}.
 */
public record TimeRange(RationalTime startTime, RationalTime duration)
{
    public TimeRange {
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(duration, "duration");
    }

    /**
     * Builds the range spanning {@code start} up to (not including) {@code endExclusive}.
     */
    public static TimeRange fromStartEndTime(RationalTime start, RationalTime endExclusive) {
        return new TimeRange(start, endExclusive.subtract(start).rescaledTo(start.rate()));
    }

    public RationalTime endTimeExclusive() {
        return startTime.add(duration);
    }
}
