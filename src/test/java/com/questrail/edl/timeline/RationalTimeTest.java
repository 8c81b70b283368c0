package com.questrail.edl.timeline;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RationalTimeTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link RationalTime}.
 *
 * <p>Covers non-drop and drop-frame timecode in both directions, rejection of
 * malformed or out-of-range fields, arithmetic across rates and rescaling.</p>
 */
final class RationalTimeTest
{
    @Test
    void parsesNonDropFrameTimecode() throws Exception
    {
        RationalTime t = RationalTime.fromTimecode("01:00:00:00", 24);
        assertEquals(86400.0, t.value());
        assertEquals(24.0, t.rate());

        assertEquals(5 * 24 + 12, RationalTime.fromTimecode("00:00:05:12", 24).toFrames());
    }

    @Test
    void parsesDropFrameTimecodeAtNtscRate() throws Exception
    {
        assertEquals(1800, RationalTime.fromTimecode("00:01:00;02", 29.97).toFrames());
        assertEquals(17982, RationalTime.fromTimecode("00:10:00;00", 29.97).toFrames());
        assertEquals(3600, RationalTime.fromTimecode("00:01:00;04", 59.94).toFrames());
    }

    @Test
    void formatsDropFrameTimecode() throws Exception
    {
        assertEquals("00:01:00;02", RationalTime.fromFrames(1800, 29.97).toTimecode(29.97));
        assertEquals("00:10:00;00", RationalTime.fromFrames(17982, 29.97).toTimecode(29.97));
        assertEquals("00:00:59;29", RationalTime.fromFrames(1799, 29.97).toTimecode(29.97));
    }

    @Test
    void formatsNonDropFrameTimecode() throws Exception
    {
        assertEquals("01:00:04:05", RationalTime.fromFrames(86400 + 96 + 5, 24).toTimecode(24));
        assertEquals("00:00:01:00", RationalTime.fromFrames(25, 25).toTimecode(25));
    }

    @Test
    void dropFrameNotationRequiresDropFrameRate()
    {
        assertThrows(InvalidTimecodeException.class, () -> RationalTime.fromTimecode("00:00:01;00", 24));
    }

    @Test
    void rejectsMalformedTimecodes()
    {
        assertThrows(InvalidTimecodeException.class, () -> RationalTime.fromTimecode("", 24));
        assertThrows(InvalidTimecodeException.class, () -> RationalTime.fromTimecode("00:00:01", 24));
        assertThrows(InvalidTimecodeException.class, () -> RationalTime.fromTimecode("XX:XX:XX:XX", 24));
        assertThrows(InvalidTimecodeException.class, () -> RationalTime.fromTimecode("00:60:00:00", 24));
        assertThrows(InvalidTimecodeException.class, () -> RationalTime.fromTimecode("00:00:60:00", 24));
        assertThrows(InvalidTimecodeException.class, () -> RationalTime.fromTimecode("00:00:00:24", 24));
        assertThrows(InvalidTimecodeException.class, () -> RationalTime.fromTimecode("00:00:00:00", 0));
    }

    @Test
    void negativeTimeCannotBeFormatted()
    {
        assertThrows(InvalidTimecodeException.class, () -> new RationalTime(-1, 24).toTimecode(24));
        assertThrows(InvalidTimecodeException.class, () -> new RationalTime(Double.NaN, 24).toTimecode(24));
    }

    @Test
    void arithmeticUsesLargerRate()
    {
        RationalTime oneSecondAt24 = RationalTime.fromFrames(24, 24);
        RationalTime oneSecondAt30 = RationalTime.fromFrames(30, 30);

        RationalTime sum = oneSecondAt24.add(oneSecondAt30);
        assertEquals(30.0, sum.rate());
        assertEquals(60.0, sum.value(), 1e-9);

        RationalTime difference = oneSecondAt30.subtract(oneSecondAt24);
        assertEquals(30.0, difference.rate());
        assertEquals(0.0, difference.value(), 1e-9);
    }

    @Test
    void rescalingKeepsSeconds()
    {
        RationalTime t = RationalTime.fromFrames(48, 24).rescaledTo(25);
        assertEquals(50.0, t.value(), 1e-9);
        assertEquals(2.0, t.toSeconds(), 1e-9);
        assertEquals(60, RationalTime.fromFrames(48, 24).toFrames(30));
    }

    @Test
    void detectsDropFrameRates()
    {
        assertTrue(RationalTime.isDropFrameRate(29.97));
        assertTrue(RationalTime.isDropFrameRate(30000.0 / 1001.0));
        assertTrue(RationalTime.isDropFrameRate(59.94));
        assertFalse(RationalTime.isDropFrameRate(24));
        assertFalse(RationalTime.isDropFrameRate(30));
        assertFalse(RationalTime.isDropFrameRate(23.976));
    }

    @Test
    void comparesBySeconds()
    {
        assertTrue(RationalTime.fromFrames(24, 24).compareTo(RationalTime.fromFrames(25, 25)) == 0);
        assertTrue(RationalTime.fromFrames(1, 24).compareTo(RationalTime.fromFrames(2, 24)) < 0);
    }
}
