package com.questrail.edl.timeline;

/**
 * Raised when a timecode string cannot be converted to a {@link RationalTime}
 * at a given rate, or a {@link RationalTime} cannot be rendered as timecode.
 *
 * <p>This exception is checked on purpose: callers in the codec decide whether
 * a bad timecode is fatal (event timecodes), skippable (locators) or replaced
 * by a fallback (encoder output).</p>
 */
public final class InvalidTimecodeException extends Exception
{
    public InvalidTimecodeException(String message) {
        super(message);
    }
}
