package com.questrail.edl.cmx3600.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One logical CMX 3600 event: an event line, its timecode line and every
 * comment or metadata line that follows until the next event line.
 *
 * <h2>Lifecycle</h2>
 * <p>The decoder creates an {@link EdlEvent.Builder} when it sees an event
 * line and feeds it the lines that follow. The builder is turned into this
 * immutable record when the next event line or the end of input is reached.
 * The encoder builds events directly from timeline clips.</p>
 *
 * <h2>Optional fields</h2>
 * <p>{@code wipeCode}, {@code clipName}, {@code filePath}, {@code speedEffect},
 * {@code ascCdl} and {@code comment} are {@code null} when the source carried
 * no such information. Timecodes are kept as the strings that were read (or
 * will be written); conversion to {@code RationalTime} happens in the
 * timeline builder.</p>
 *
 * @param timecodeLine 1-based physical line of the timecode line, or 0 for
 *                     events that were not read from text
 */
public record EdlEvent(
        int eventNumber,
        String reelName,
        TrackType trackType,
        EditType editType,
        String sourceIn,
        String sourceOut,
        String recordIn,
        String recordOut,
        int transitionDuration,
        String wipeCode,
        String clipName,
        String filePath,
        boolean freezeFrame,
        SpeedEffect speedEffect,
        List<Locator> locators,
        AscCdl ascCdl,
        String comment,
        int timecodeLine
) {
    public EdlEvent {
        Objects.requireNonNull(reelName, "reelName");
        Objects.requireNonNull(trackType, "trackType");
        Objects.requireNonNull(editType, "editType");
        locators = (locators == null) ? List.of() : List.copyOf(locators);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int eventNumber;
        private String reelName;
        private TrackType trackType;
        private EditType editType = EditType.CUT;
        private String sourceIn = "";
        private String sourceOut = "";
        private String recordIn = "";
        private String recordOut = "";
        private int transitionDuration;
        private String wipeCode;
        private String clipName;
        private String filePath;
        private boolean freezeFrame;
        private SpeedEffect speedEffect;
        private final List<Locator> locators = new ArrayList<>();
        private AscCdl ascCdl;
        private StringBuilder comment;
        private int timecodeLine;

        private Builder() {}

        public Builder eventNumber(int eventNumber) {
            this.eventNumber = eventNumber;
            return this;
        }

        public Builder reelName(String reelName) {
            this.reelName = reelName;
            return this;
        }

        public Builder trackType(TrackType trackType) {
            this.trackType = trackType;
            return this;
        }

        public Builder editType(EditType editType) {
            this.editType = editType;
            return this;
        }

        public Builder timecodes(String sourceIn, String sourceOut, String recordIn, String recordOut) {
            this.sourceIn = sourceIn;
            this.sourceOut = sourceOut;
            this.recordIn = recordIn;
            this.recordOut = recordOut;
            return this;
        }

        public Builder timecodeLine(int timecodeLine) {
            this.timecodeLine = timecodeLine;
            return this;
        }

        public Builder transitionDuration(int frames) {
            this.transitionDuration = frames;
            return this;
        }

        public Builder wipeCode(String wipeCode) {
            this.wipeCode = wipeCode;
            return this;
        }

        public Builder clipName(String clipName) {
            this.clipName = clipName;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder freezeFrame(boolean freezeFrame) {
            this.freezeFrame = freezeFrame;
            return this;
        }

        public Builder speedEffect(SpeedEffect speedEffect) {
            this.speedEffect = speedEffect;
            return this;
        }

        public Builder addLocator(Locator locator) {
            locators.add(Objects.requireNonNull(locator, "locator"));
            return this;
        }

        public Builder sop(AscCdl.Rgb slope, AscCdl.Rgb offset, AscCdl.Rgb power) {
            ascCdl = currentCdl().withSop(slope, offset, power);
            return this;
        }

        public Builder saturation(double saturation) {
            ascCdl = currentCdl().withSaturation(saturation);
            return this;
        }

        /**
         * Appends a free comment line; successive lines are joined with {@code \n}.
         */
        public Builder appendComment(String line) {
            if (comment == null) {
                comment = new StringBuilder(line);
            } else {
                comment.append('\n').append(line);
            }
            return this;
        }

        public EdlEvent build() {
            return new EdlEvent(
                    eventNumber,
                    reelName,
                    trackType,
                    editType,
                    sourceIn,
                    sourceOut,
                    recordIn,
                    recordOut,
                    transitionDuration,
                    wipeCode,
                    clipName,
                    filePath,
                    freezeFrame,
                    speedEffect,
                    locators,
                    ascCdl,
                    (comment == null) ? null : comment.toString(),
                    timecodeLine);
        }

        private AscCdl currentCdl() {
            return (ascCdl == null) ? AscCdl.IDENTITY : ascCdl;
        }
    }
}
