package com.questrail.edl.cmx3600.observability;

/**
 * Something the codec skipped or replaced instead of failing.
 *
 * @param line    1-based physical line, or 0 when not tied to input text
 * @param kind    what was skipped
 * @param message human-readable detail
 */
public record EdlDiagnosticEvent(
    int line,
    Kind kind,
    String message
) {
    public enum Kind {
        /** A line that matches no known shape, or no event is open. */
        IGNORED_LINE,
        /** An {@code M2} line that does not match the speed grammar. */
        MALFORMED_SPEED,
        /** An {@code ASC_SOP} / {@code ASC_SAT} line with unparseable values. */
        MALFORMED_COLOR_DECISION,
        /** A locator whose timecode cannot be converted. */
        DROPPED_MARKER,
        /** An {@code FCM:} header with an unknown mode. */
        UNKNOWN_FRAME_COUNT_MODE,
        /** A timecode the encoder could not render and replaced with zero. */
        TIMECODE_FALLBACK,
        /** A timeline child the encoder does not write. */
        SKIPPED_CHILD
    }
}
