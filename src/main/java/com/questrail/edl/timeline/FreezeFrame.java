package com.questrail.edl.timeline;

/**
 * Holds the first source frame for the whole duration of the clip.
 */
public record FreezeFrame(String name) implements Effect
{
    public FreezeFrame {
        name = (name == null) ? "" : name;
    }

    /**
     * A freeze frame is a time warp with a scalar of zero.
     */
    public double timeScalar() {
        return 0.0;
    }

    @Override
    public String effectName() {
        return "FreezeFrame";
    }
}
