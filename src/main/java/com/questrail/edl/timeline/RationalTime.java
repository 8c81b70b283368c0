package com.questrail.edl.timeline;

/**
 * A point or span in time expressed as a frame count ({@code value}) over a
 * frame {@code rate}.
 *
 * <h2>Arithmetic</h2>
 * <p>{@link #add(RationalTime)} and {@link #subtract(RationalTime)} produce a
 * result at the larger of the two rates, rescaling the other operand first.
 * Rescaling never rounds; rounding only happens when a time is turned into
 * whole frames or timecode.</p>
 *
 * <h2>Timecode</h2>
 * <p>Timecode strings use {@code HH:MM:SS:FF} for non-drop-frame counting and
 * {@code HH:MM:SS;FF} for drop-frame counting. Drop-frame counting is only
 * defined for the NTSC rates (29.97 and 59.94); see {@link #isDropFrameRate(double)}.</p>
 */
public record RationalTime(double value, double rate) implements Comparable<RationalTime>
{
    public static RationalTime zero(double rate) {
        return new RationalTime(0, rate);
    }

    public static RationalTime fromFrames(long frames, double rate) {
        return new RationalTime(frames, rate);
    }

    /**
     * A time is valid when its value is a number and its rate is positive.
     */
    public boolean isValidTime() {
        return !Double.isNaN(value) && !Double.isInfinite(value) && rate > 0;
    }

    public RationalTime add(RationalTime other) {
        if (other.rate > rate) {
            return new RationalTime(valueRescaledTo(other.rate) + other.value, other.rate);
        }
        return new RationalTime(value + other.valueRescaledTo(rate), rate);
    }

    public RationalTime subtract(RationalTime other) {
        if (other.rate > rate) {
            return new RationalTime(valueRescaledTo(other.rate) - other.value, other.rate);
        }
        return new RationalTime(value - other.valueRescaledTo(rate), rate);
    }

    public double valueRescaledTo(double newRate) {
        if (newRate == rate) {
            return value;
        }
        return value * newRate / rate;
    }

    public RationalTime rescaledTo(double newRate) {
        return new RationalTime(valueRescaledTo(newRate), newRate);
    }

    public double toSeconds() {
        return value / rate;
    }

    /**
     * Returns the nearest whole frame count at this time's own rate.
     */
    public long toFrames() {
        return Math.round(value);
    }

    public long toFrames(double atRate) {
        return Math.round(valueRescaledTo(atRate));
    }

    /**
     * Returns true for rates that count timecode in drop-frame fashion
     * (29.97 and 59.94, within a small tolerance window).
     */
    public static boolean isDropFrameRate(double rate) {
        return (rate > 29.96 && rate < 29.98) || (rate > 59.93 && rate < 59.95);
    }

    /**
     * Parses a timecode string at the given rate.
     *
     * <p>A {@code ;} before the frames field selects drop-frame counting, which
     * is only accepted at a drop-frame rate.</p>
     *
     * @throws InvalidTimecodeException if the string is not four numeric
     *         fields, a field is out of range, or the rate cannot count it
     */
    public static RationalTime fromTimecode(String timecode, double rate)
            throws InvalidTimecodeException
    {
        if (timecode == null || timecode.isBlank()) {
            throw new InvalidTimecodeException("Timecode must not be empty");
        }
        if (!(rate > 0)) {
            throw new InvalidTimecodeException("Invalid rate " + rate + " for timecode '" + timecode + "'");
        }

        final boolean dropFrame = timecode.indexOf(';') >= 0;
        if (dropFrame && !isDropFrameRate(rate)) {
            throw new InvalidTimecodeException("Timecode '" + timecode
                    + "' uses drop-frame notation but rate " + rate + " is not a drop-frame rate");
        }

        final String[] fields = timecode.trim().replace(';', ':').split(":", -1);
        if (fields.length != 4) {
            throw new InvalidTimecodeException("Timecode '" + timecode + "' must have 4 fields");
        }

        final int[] parts = new int[4];
        for (int i = 0; i < fields.length; i++) {
            try {
                parts[i] = Integer.parseInt(fields[i]);
            }
            catch (NumberFormatException e) {
                throw new InvalidTimecodeException("Timecode '" + timecode + "' has a non-numeric field");
            }
            if (parts[i] < 0) {
                throw new InvalidTimecodeException("Timecode '" + timecode + "' has a negative field");
            }
        }

        final int hours = parts[0];
        final int minutes = parts[1];
        final int seconds = parts[2];
        final int frames = parts[3];
        final long nominal = Math.round(rate);

        if (minutes >= 60 || seconds >= 60) {
            throw new InvalidTimecodeException("Timecode '" + timecode + "' has minutes or seconds out of range");
        }
        if (frames >= nominal) {
            throw new InvalidTimecodeException("Timecode '" + timecode
                    + "' has more frames than rate " + rate + " allows");
        }

        long value = ((hours * 3600L) + (minutes * 60L) + seconds) * nominal + frames;
        if (dropFrame) {
            final long dropped = nominal / 15;
            final long totalMinutes = hours * 60L + minutes;
            value -= dropped * (totalMinutes - totalMinutes / 10);
        }
        return new RationalTime(value, rate);
    }

    /**
     * Renders this time as timecode at {@code atRate}, counting drop-frame
     * when {@code atRate} is a drop-frame rate.
     *
     * @throws InvalidTimecodeException if the rate is not positive or the time
     *         is negative
     */
    public String toTimecode(double atRate)
            throws InvalidTimecodeException
    {
        if (!(atRate > 0)) {
            throw new InvalidTimecodeException("Invalid rate " + atRate);
        }
        if (!isValidTime()) {
            throw new InvalidTimecodeException("Cannot render invalid time " + this);
        }

        long frames = toFrames(atRate);
        if (frames < 0) {
            throw new InvalidTimecodeException("Cannot render negative time " + this + " as timecode");
        }

        final long nominal = Math.round(atRate);
        final boolean dropFrame = isDropFrameRate(atRate);

        if (dropFrame) {
            final long dropped = nominal / 15;
            final long framesPerTenMinutes = Math.round(atRate * 600);
            final long framesPerMinute = nominal * 60 - dropped;

            final long tens = frames / framesPerTenMinutes;
            final long remainder = frames % framesPerTenMinutes;
            frames += dropped * 9 * tens;
            if (remainder > dropped) {
                frames += dropped * ((remainder - dropped) / framesPerMinute);
            }
        }

        final long ff = frames % nominal;
        final long totalSeconds = frames / nominal;
        final long ss = totalSeconds % 60;
        final long mm = (totalSeconds / 60) % 60;
        final long hh = totalSeconds / 3600;

        return String.format("%02d:%02d:%02d%s%02d", hh, mm, ss, dropFrame ? ";" : ":", ff);
    }

    @Override
    public int compareTo(RationalTime other) {
        return Double.compare(toSeconds(), other.toSeconds());
    }
}
