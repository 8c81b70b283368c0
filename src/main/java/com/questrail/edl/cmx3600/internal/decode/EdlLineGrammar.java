package com.questrail.edl.cmx3600.internal.decode;

import com.questrail.edl.cmx3600.codec.EdlParseException;
import com.questrail.edl.cmx3600.model.EditType;
import com.questrail.edl.cmx3600.model.TrackType;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * EdlLineGrammar
 * -----------------------------------------------------------------------------
 * Structural line shapes of a CMX 3600 list: headers, event lines and
 * timecode lines.
 *
 * <p>Event line:</p>
 * <pre>
 *   001  REEL     V     C
 *   002  REEL     A1    D    030
 *   003  REEL     V     W001 030
 *   ^    ^        ^     ^    ^
 *   |    |        |     |    optional transition duration (frames)
 *   |    |        |     C | D | W### | KB | K
 *   |    |        V | A | A1..A4
 *   |    reel token (any non-blank run)
 *   event number
 * </pre>
 *
 * <p>Timecode line: four {@code HH:MM:SS:FF} (or {@code HH:MM:SS;FF}) fields,
 * source in, source out, record in, record out.</p>
 *
 * <p>The patterns only check shape. Whether a timecode is valid at a given
 * rate is decided later, when it is converted.</p>
 */
final class EdlLineGrammar
{
    static final String TIMECODE = "\\d{2}:\\d{2}:\\d{2}[:;]\\d{2}";

    static final String TITLE_PREFIX = "TITLE:";
    static final String FCM_PREFIX = "FCM:";

    private static final Pattern EVENT_LINE = Pattern.compile(
            "^\\s*(\\d+)\\s+(\\S+)\\s+(V|A[1-4]?)\\s+(C|D|W\\d{3}|KB|K)(?:\\s+(\\d+))?");

    private static final Pattern TIMECODE_LINE = Pattern.compile(
            "^\\s*(" + TIMECODE + ")\\s+(" + TIMECODE + ")\\s+(" + TIMECODE + ")\\s+(" + TIMECODE + ")");

    private EdlLineGrammar() {}

    /**
     * Fields of a matched event line.
     *
     * @param wipeCode           the full {@code W###} token for wipes, otherwise {@code null}
     * @param transitionDuration frames, 0 when the column is absent
     */
    record EventHeader(
            int eventNumber,
            String reelName,
            TrackType trackType,
            EditType editType,
            String wipeCode,
            int transitionDuration
    ) {}

    record TimecodeFields(String sourceIn, String sourceOut, String recordIn, String recordOut) {}

    /**
     * Matches an event line.
     *
     * @throws EdlParseException if the line has the event shape but its event
     *                           number or transition duration does not fit an int
     */
    static Optional<EventHeader> parseEventHeader(int lineNumber, String line) {
        Matcher m = EVENT_LINE.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }

        final int eventNumber;
        final int transitionDuration;
        try {
            eventNumber = Integer.parseInt(m.group(1));
            transitionDuration = (m.group(5) == null) ? 0 : Integer.parseInt(m.group(5));
        }
        catch (NumberFormatException e) {
            throw new EdlParseException(lineNumber, "event number or transition duration out of range", e);
        }

        final String editToken = m.group(4);
        final EditType editType = EditType.fromToken(editToken);
        final String wipeCode = (editType == EditType.WIPE) ? editToken : null;
        final TrackType trackType = TrackType.fromToken(m.group(3)).orElseThrow();

        return Optional.of(new EventHeader(
                eventNumber, m.group(2), trackType, editType, wipeCode, transitionDuration));
    }

    static Optional<TimecodeFields> parseTimecodeLine(String line) {
        Matcher m = TIMECODE_LINE.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new TimecodeFields(m.group(1), m.group(2), m.group(3), m.group(4)));
    }

    static Optional<String> parseTitle(String trimmed) {
        if (!trimmed.startsWith(TITLE_PREFIX)) {
            return Optional.empty();
        }
        return Optional.of(trimmed.substring(TITLE_PREFIX.length()).trim());
    }

    static Optional<String> parseFrameCountMode(String trimmed) {
        if (!trimmed.startsWith(FCM_PREFIX)) {
            return Optional.empty();
        }
        return Optional.of(trimmed.substring(FCM_PREFIX.length()).trim());
    }
}
