package com.questrail.edl.cmx3600.codec;

import com.questrail.edl.timeline.InvalidTimecodeException;
import com.questrail.edl.timeline.RationalTime;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link Timecodes}.
 */
final class TimecodesTest
{
    @Test
    void formatRescalesToTargetRate() throws Exception
    {
        // 2 seconds at 25 fps written at 24 fps
        assertEquals("00:00:02:00", Timecodes.format(RationalTime.fromFrames(50, 25), 24));
    }

    @Test
    void nonDropFrameRateUsesColonSeparator() throws Exception
    {
        assertEquals("00:01:00:00", Timecodes.format(RationalTime.fromFrames(1440, 24), 24));
        assertEquals("00:01:00:00", Timecodes.format(RationalTime.fromFrames(1800, 30), 30));
    }

    @Test
    void dropFrameRateUsesSemicolonSeparator() throws Exception
    {
        assertEquals("00:01:00;02", Timecodes.format(RationalTime.fromFrames(1800, 29.97), 29.97));
    }

    @Test
    void parseAndFormatAgree() throws Exception
    {
        RationalTime t = Timecodes.parse("01:00:04:05", 24);
        assertEquals("01:00:04:05", Timecodes.format(t, 24));
    }

    @Test
    void negativeTimeIsRejected()
    {
        assertThrows(InvalidTimecodeException.class,
                () -> Timecodes.format(RationalTime.fromFrames(-10, 24), 24));
    }
}
