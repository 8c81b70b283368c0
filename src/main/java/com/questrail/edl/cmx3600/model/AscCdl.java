package com.questrail.edl.cmx3600.model;

import java.util.List;
import java.util.Objects;

/**
 * ASC Color Decision List values captured from {@code ASC_SOP} and
 * {@code ASC_SAT} comments.
 *
 * <p>Values are captured verbatim; no colour math is applied. A fresh
 * instance is the identity grade and each comment overwrites only the
 * fields it carries.</p>
 */
public record AscCdl(Rgb slope, Rgb offset, Rgb power, double saturation)
{
    public static final AscCdl IDENTITY = new AscCdl(
            new Rgb(1.0, 1.0, 1.0),
            new Rgb(0.0, 0.0, 0.0),
            new Rgb(1.0, 1.0, 1.0),
            1.0);

    public AscCdl {
        Objects.requireNonNull(slope, "slope");
        Objects.requireNonNull(offset, "offset");
        Objects.requireNonNull(power, "power");
    }

    public AscCdl withSop(Rgb slope, Rgb offset, Rgb power) {
        return new AscCdl(slope, offset, power, saturation);
    }

    public AscCdl withSaturation(double saturation) {
        return new AscCdl(slope, offset, power, saturation);
    }

    /**
     * One red/green/blue coefficient triple.
     */
    public record Rgb(double red, double green, double blue)
    {
        public List<Double> toList() {
            return List.of(red, green, blue);
        }
    }
}
