package com.questrail.edl.timeline;

import java.util.Optional;

/**
 * Where a clip's media comes from.
 */
public sealed interface MediaReference permits ExternalReference, GeneratorReference, MissingReference
{
    String name();

    /**
     * Returns the range of media the reference is known to provide, if any.
     */
    Optional<TimeRange> availableRange();
}
