package com.questrail.edl.cmx3600.internal.decode;

import com.questrail.edl.cmx3600.model.AscCdl;
import com.questrail.edl.cmx3600.model.Locator;
import com.questrail.edl.cmx3600.model.SpeedEffect;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * EdlMetadataExtractors
 * -----------------------------------------------------------------------------
 * Parsers for the lines that annotate an open event.
 *
 * <p>Recognized shapes:</p>
 * <pre>
 *   M2   REEL       047.6                01:00:04:05
 *   * FROM CLIP NAME: Shot 1
 *   * FROM CLIP: S:\path\to\clip.mov
 *   * FROM FILE: S:\path\to\clip.exr
 *   * FREEZE FRAME
 *   * LOC: 01:00:04:10 RED Comment text
 *   * ASC_SOP (1.0 1.0 1.0) (0.0 0.0 0.0) (1.0 1.0 1.0)
 *   * ASC_SAT 1.0
 * </pre>
 *
 * <p>Comment keywords are accepted with or without a space after the
 * asterisk. Each extractor returns empty when its shape does not match; none
 * of them throw.</p>
 */
final class EdlMetadataExtractors
{
    private static final String NUMBER = "([-+]?(?:\\d+\\.?\\d*|\\.\\d+))";
    private static final String TRIPLE =
            "\\(\\s*" + NUMBER + "[,\\s]+" + NUMBER + "[,\\s]+" + NUMBER + "\\s*\\)";

    private static final Pattern SPEED = Pattern.compile(
            "^M2\\s+(\\S+)\\s+(-?(?:\\d+\\.?\\d*|\\.\\d+))\\s+(" + EdlLineGrammar.TIMECODE + ")");

    private static final Pattern CLIP_NAME = Pattern.compile("^\\*\\s*FROM CLIP NAME:(.*)$");
    private static final Pattern AVID_FILE_PATH = Pattern.compile("^\\*\\s*FROM CLIP:(.*)$");
    private static final Pattern NUCODA_FILE_PATH = Pattern.compile("^\\*\\s*FROM FILE:(.*)$");
    private static final Pattern FREEZE_FRAME = Pattern.compile("^\\*\\s*FREEZE FRAME");

    private static final Pattern LOCATOR = Pattern.compile(
            "^\\*\\s*LOC:\\s+(" + EdlLineGrammar.TIMECODE + ")\\s+(\\w*)(?:\\s+|$)(.*)");

    private static final Pattern ASC_SOP = Pattern.compile(
            "ASC_SOP\\s*" + TRIPLE + "\\s*" + TRIPLE + "\\s*" + TRIPLE);
    private static final Pattern ASC_SAT = Pattern.compile("ASC_SAT\\s+" + NUMBER);

    static final String FREEZE_FRAME_SUFFIX = " FF";

    private EdlMetadataExtractors() {}

    /**
     * Slope, offset and power triples of one {@code ASC_SOP} comment.
     */
    record Sop(AscCdl.Rgb slope, AscCdl.Rgb offset, AscCdl.Rgb power) {}

    static Optional<SpeedEffect> parseSpeedEffect(String trimmed) {
        Matcher m = SPEED.matcher(trimmed);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new SpeedEffect(m.group(1), Double.parseDouble(m.group(2)), m.group(3)));
    }

    static Optional<String> parseClipName(String trimmed) {
        return captureTrimmed(CLIP_NAME, trimmed);
    }

    /**
     * Avid writes source file paths as {@code FROM CLIP:}.
     */
    static Optional<String> parseAvidFilePath(String trimmed) {
        return captureTrimmed(AVID_FILE_PATH, trimmed);
    }

    /**
     * Nucoda writes source file paths as {@code FROM FILE:}.
     */
    static Optional<String> parseNucodaFilePath(String trimmed) {
        return captureTrimmed(NUCODA_FILE_PATH, trimmed);
    }

    static boolean isFreezeFrame(String trimmed) {
        return FREEZE_FRAME.matcher(trimmed).find() || trimmed.endsWith(FREEZE_FRAME_SUFFIX);
    }

    static Optional<Locator> parseLocator(String trimmed) {
        Matcher m = LOCATOR.matcher(trimmed);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new Locator(m.group(1), m.group(2), m.group(3).trim()));
    }

    static Optional<Sop> parseSop(String trimmed) {
        Matcher m = ASC_SOP.matcher(trimmed);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new Sop(rgb(m, 1), rgb(m, 4), rgb(m, 7)));
    }

    static OptionalDouble parseSaturation(String trimmed) {
        Matcher m = ASC_SAT.matcher(trimmed);
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(m.group(1)));
    }

    /**
     * True when the line names an ASC keyword, whether or not its values parse.
     */
    static boolean mentionsColorDecision(String trimmed) {
        return trimmed.contains("ASC_SOP") || trimmed.contains("ASC_SAT");
    }

    /**
     * Removes the {@code " FF"} suffix some systems append to frozen clip names.
     */
    static String stripFreezeFrameSuffix(String clipName, boolean freezeFrame) {
        if (freezeFrame && clipName.endsWith(FREEZE_FRAME_SUFFIX)) {
            return clipName.substring(0, clipName.length() - FREEZE_FRAME_SUFFIX.length());
        }
        return clipName;
    }

    private static AscCdl.Rgb rgb(Matcher m, int firstGroup) {
        return new AscCdl.Rgb(
                Double.parseDouble(m.group(firstGroup)),
                Double.parseDouble(m.group(firstGroup + 1)),
                Double.parseDouble(m.group(firstGroup + 2)));
    }

    private static Optional<String> captureTrimmed(Pattern pattern, String trimmed) {
        Matcher m = pattern.matcher(trimmed);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(m.group(1).trim());
    }
}
