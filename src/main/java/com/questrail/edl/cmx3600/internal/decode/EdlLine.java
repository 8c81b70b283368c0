package com.questrail.edl.cmx3600.internal.decode;

import com.questrail.edl.cmx3600.model.Locator;
import com.questrail.edl.cmx3600.model.SpeedEffect;

/**
 * One classified physical line of EDL text.
 *
 * <p>The set of line kinds is closed by the CMX 3600 grammar. Every variant
 * carries the 1-based physical line number it was read from. The timecode
 * line is not a variant: it is only meaningful directly after an
 * {@link EventLine} and is read by the accumulator itself.</p>
 */
sealed interface EdlLine
{
    int lineNumber();

    record Blank(int lineNumber) implements EdlLine {}

    record Title(int lineNumber, String title) implements EdlLine {}

    record FrameCountModeHeader(int lineNumber, String token) implements EdlLine {}

    record EventLine(int lineNumber, EdlLineGrammar.EventHeader header) implements EdlLine {}

    record SpeedLine(int lineNumber, SpeedEffect speedEffect) implements EdlLine {}

    record MalformedSpeedLine(int lineNumber, String text) implements EdlLine {}

    record ClipNameComment(int lineNumber, String clipName) implements EdlLine {}

    record FilePathComment(int lineNumber, String filePath) implements EdlLine {}

    record FreezeFrameComment(int lineNumber) implements EdlLine {}

    record LocatorComment(int lineNumber, Locator locator) implements EdlLine {}

    record ColorSopComment(int lineNumber, EdlMetadataExtractors.Sop sop) implements EdlLine {}

    record ColorSatComment(int lineNumber, double saturation) implements EdlLine {}

    /**
     * Any other {@code *} line while an event is open.
     *
     * @param malformedColorDecision true when the text names an ASC keyword
     *                               whose values did not parse
     */
    record FreeComment(int lineNumber, String text, boolean malformedColorDecision) implements EdlLine {}

    /**
     * A line with no meaning in the current decoder state.
     */
    record Ignored(int lineNumber, String text) implements EdlLine {}
}
