package com.questrail.edl.cmx3600.config;

import com.questrail.edl.cmx3600.codec.ReelNames;
import com.questrail.edl.cmx3600.model.OutputStyle;

import java.util.Objects;
import java.util.Properties;

/**
 * Settings shared by the EDL decoder and encoder.
 *
 * <p>{@code outputStyle} and {@code ignoreTimecodeMismatch} are accepted and
 * carried but no code path consults them yet.</p>
 *
 * @param decodeRate             frame rate used to read timecodes
 * @param encodeRate             frame rate used to write timecodes
 * @param reelNameLength         maximum written reel name length; 0 or negative is unlimited
 * @param outputStyle            requested EDL flavour
 * @param ignoreTimecodeMismatch whether record/source duration mismatches may be repaired
 */
public record EdlCodecConfig(
    double decodeRate,
    double encodeRate,
    int reelNameLength,
    OutputStyle outputStyle,
    boolean ignoreTimecodeMismatch
) {
    public static final double DEFAULT_RATE = 24.0;

    public static final String DECODE_RATE_KEY = "edl.decode.rate";
    public static final String ENCODE_RATE_KEY = "edl.encode.rate";
    public static final String REEL_NAME_LENGTH_KEY = "edl.reel-name.length";
    public static final String OUTPUT_STYLE_KEY = "edl.output.style";
    public static final String IGNORE_TIMECODE_MISMATCH_KEY = "edl.ignore-timecode-mismatch";

    public EdlCodecConfig {
        if (!(decodeRate > 0)) {
            throw new IllegalArgumentException("decodeRate must be positive (was " + decodeRate + ")");
        }
        if (!(encodeRate > 0)) {
            throw new IllegalArgumentException("encodeRate must be positive (was " + encodeRate + ")");
        }
        Objects.requireNonNull(outputStyle, "outputStyle");
    }

    public static EdlCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a configuration from {@code properties}; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a present value cannot be parsed or is out of range
     */
    public static EdlCodecConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();

        String value = properties.getProperty(DECODE_RATE_KEY);
        if (value != null) {
            builder.withDecodeRate(parseDouble(DECODE_RATE_KEY, value));
        }
        value = properties.getProperty(ENCODE_RATE_KEY);
        if (value != null) {
            builder.withEncodeRate(parseDouble(ENCODE_RATE_KEY, value));
        }
        value = properties.getProperty(REEL_NAME_LENGTH_KEY);
        if (value != null) {
            try {
                builder.withReelNameLength(Integer.parseInt(value.trim()));
            }
            catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + REEL_NAME_LENGTH_KEY + ": " + value, e);
            }
        }
        value = properties.getProperty(OUTPUT_STYLE_KEY);
        if (value != null) {
            builder.withOutputStyle(OutputStyle.fromName(value));
        }
        value = properties.getProperty(IGNORE_TIMECODE_MISMATCH_KEY);
        if (value != null) {
            builder.withIgnoreTimecodeMismatch(Boolean.parseBoolean(value.trim()));
        }
        return builder.build();
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": " + value, e);
        }
    }

    public static final class Builder {
        private double decodeRate = DEFAULT_RATE;
        private double encodeRate = DEFAULT_RATE;
        private int reelNameLength = ReelNames.DEFAULT_LENGTH;
        private OutputStyle outputStyle = OutputStyle.AVID;
        private boolean ignoreTimecodeMismatch = false;

        public Builder withDecodeRate(double decodeRate) {
            this.decodeRate = decodeRate;
            return this;
        }

        public Builder withEncodeRate(double encodeRate) {
            this.encodeRate = encodeRate;
            return this;
        }

        /**
         * Sets decode and encode rate together.
         */
        public Builder withRate(double rate) {
            this.decodeRate = rate;
            this.encodeRate = rate;
            return this;
        }

        public Builder withReelNameLength(int reelNameLength) {
            this.reelNameLength = reelNameLength;
            return this;
        }

        public Builder withOutputStyle(OutputStyle outputStyle) {
            this.outputStyle = outputStyle;
            return this;
        }

        public Builder withIgnoreTimecodeMismatch(boolean ignore) {
            this.ignoreTimecodeMismatch = ignore;
            return this;
        }

        public EdlCodecConfig build() {
            return new EdlCodecConfig(decodeRate, encodeRate, reelNameLength, outputStyle, ignoreTimecodeMismatch);
        }
    }
}
