package com.questrail.edl.timeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Media synthesized on demand, such as black or colour bars.
 */
public record GeneratorReference(String name, String generatorKind, TimeRange range) implements MediaReference
{
    public static final String BLACK = "black";
    public static final String SMPTE_BARS = "SMPTEBars";

    public GeneratorReference {
        name = (name == null) ? "" : name;
        Objects.requireNonNull(generatorKind, "generatorKind");
    }

    @Override
    public Optional<TimeRange> availableRange() {
        return Optional.ofNullable(range);
    }
}
