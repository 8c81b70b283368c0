package com.questrail.edl.cmx3600.codec;

import com.questrail.edl.timeline.InvalidTimecodeException;
import com.questrail.edl.timeline.RationalTime;

/**
 * Timecode rules shared by the EDL decoder and encoder.
 *
 * <p>Decoding reads every timecode at the configured decode rate, whatever the
 * {@code FCM:} header says. Encoding rescales to the configured encode rate
 * and uses {@code :} as the frames separator unless that rate is a drop-frame
 * rate.</p>
 */
public final class Timecodes
{
    /** Written when a time cannot be rendered. */
    public static final String ZERO = "00:00:00:00";

    private Timecodes() {}

    public static boolean isDropFrameRate(double rate) {
        return RationalTime.isDropFrameRate(rate);
    }

    public static RationalTime parse(String timecode, double rate)
            throws InvalidTimecodeException
    {
        return RationalTime.fromTimecode(timecode, rate);
    }

    /**
     * Formats {@code time} for an EDL written at {@code rate}.
     */
    public static String format(RationalTime time, double rate)
            throws InvalidTimecodeException
    {
        String tc = time.rescaledTo(rate).toTimecode(rate);
        if (!isDropFrameRate(rate)) {
            tc = tc.replace(';', ':');
        }
        return tc;
    }
}
