package com.questrail.edl.timeline;

/**
 * Constant-speed retime. A {@code timeScalar} of 2.0 plays the source twice as fast.
 */
public record LinearTimeWarp(String name, double timeScalar) implements Effect
{
    public LinearTimeWarp {
        name = (name == null) ? "" : name;
    }

    @Override
    public String effectName() {
        return "LinearTimeWarp";
    }
}
