package com.questrail.edl.timeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Media stored outside the timeline, addressed by {@code targetUrl}
 * (a path, URL or tape name).
 */
public record ExternalReference(String name, String targetUrl, TimeRange range) implements MediaReference
{
    public ExternalReference {
        name = (name == null) ? "" : name;
        Objects.requireNonNull(targetUrl, "targetUrl");
    }

    @Override
    public Optional<TimeRange> availableRange() {
        return Optional.ofNullable(range);
    }
}
