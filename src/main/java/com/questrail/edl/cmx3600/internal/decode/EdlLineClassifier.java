package com.questrail.edl.cmx3600.internal.decode;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * EdlLineClassifier
 * -----------------------------------------------------------------------------
 * Decides what one physical line is.
 *
 * <p>Shapes are tested in a fixed priority order:</p>
 * <ol>
 *   <li>Blank</li>
 *   <li>{@code TITLE:} header</li>
 *   <li>{@code FCM:} header</li>
 *   <li>Event line</li>
 *   <li>{@code M2} speed line (only while an event is open)</li>
 *   <li>{@code *} comment variants (only while an event is open): clip name,
 *       Avid file path, Nucoda file path, freeze frame, locator, ASC SOP,
 *       ASC SAT, free comment</li>
 *   <li>Anything else is ignored</li>
 * </ol>
 *
 * <p>The classifier is stateless; the caller says whether an event is open.
 * An event line with numbers too large for an int fails with
 * {@link com.questrail.edl.cmx3600.codec.EdlParseException}.</p>
 */
final class EdlLineClassifier
{
    private EdlLineClassifier() {}

    static EdlLine classify(int lineNumber, String line, boolean eventOpen) {
        final String trimmed = line.strip();

        if (trimmed.isEmpty()) {
            return new EdlLine.Blank(lineNumber);
        }

        Optional<String> title = EdlLineGrammar.parseTitle(trimmed);
        if (title.isPresent()) {
            return new EdlLine.Title(lineNumber, title.get());
        }

        Optional<String> fcm = EdlLineGrammar.parseFrameCountMode(trimmed);
        if (fcm.isPresent()) {
            return new EdlLine.FrameCountModeHeader(lineNumber, fcm.get());
        }

        Optional<EdlLineGrammar.EventHeader> header = EdlLineGrammar.parseEventHeader(lineNumber, line);
        if (header.isPresent()) {
            return new EdlLine.EventLine(lineNumber, header.get());
        }

        if (!eventOpen) {
            return new EdlLine.Ignored(lineNumber, trimmed);
        }

        if (trimmed.startsWith("M2")) {
            return EdlMetadataExtractors.parseSpeedEffect(trimmed)
                    .<EdlLine>map(speed -> new EdlLine.SpeedLine(lineNumber, speed))
                    .orElseGet(() -> new EdlLine.MalformedSpeedLine(lineNumber, trimmed));
        }

        if (trimmed.startsWith("*")) {
            return classifyComment(lineNumber, trimmed);
        }

        return new EdlLine.Ignored(lineNumber, trimmed);
    }

    private static EdlLine classifyComment(int lineNumber, String trimmed) {
        Optional<String> clipName = EdlMetadataExtractors.parseClipName(trimmed);
        if (clipName.isPresent()) {
            return new EdlLine.ClipNameComment(lineNumber, clipName.get());
        }

        Optional<String> filePath = EdlMetadataExtractors.parseAvidFilePath(trimmed)
                .or(() -> EdlMetadataExtractors.parseNucodaFilePath(trimmed));
        if (filePath.isPresent()) {
            return new EdlLine.FilePathComment(lineNumber, filePath.get());
        }

        if (EdlMetadataExtractors.isFreezeFrame(trimmed)) {
            return new EdlLine.FreezeFrameComment(lineNumber);
        }

        var locator = EdlMetadataExtractors.parseLocator(trimmed);
        if (locator.isPresent()) {
            return new EdlLine.LocatorComment(lineNumber, locator.get());
        }

        var sop = EdlMetadataExtractors.parseSop(trimmed);
        if (sop.isPresent()) {
            return new EdlLine.ColorSopComment(lineNumber, sop.get());
        }

        OptionalDouble saturation = EdlMetadataExtractors.parseSaturation(trimmed);
        if (saturation.isPresent()) {
            return new EdlLine.ColorSatComment(lineNumber, saturation.getAsDouble());
        }

        return new EdlLine.FreeComment(lineNumber, trimmed, EdlMetadataExtractors.mentionsColorDecision(trimmed));
    }
}
