package com.questrail.edl.timeline;

/**
 * Kinds of transition the timeline model distinguishes.
 */
public enum TransitionType {
    SMPTE_DISSOLVE("SMPTE_Dissolve"),
    CUSTOM("Custom_Transition");

    private final String label;

    TransitionType(String label) {
        this.label = label;
    }

    /**
     * Returns the interchange label of this kind, e.g. {@code SMPTE_Dissolve}.
     */
    public String label() {
        return label;
    }
}
