package com.questrail.edl.cmx3600.model;

import java.util.Objects;

/**
 * Motion effect carried by an {@code M2} line.
 *
 * <p>{@code speed} is the playback rate in frames per second, not a scalar:
 * {@code 48.0} on a 24 fps timeline is double speed.</p>
 *
 * @param name     reel or effect token from the M2 line
 * @param speed    frames per second at which the source plays
 * @param timecode source timecode the speed applies from
 */
public record SpeedEffect(String name, double speed, String timecode)
{
    public SpeedEffect {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timecode, "timecode");
    }
}
