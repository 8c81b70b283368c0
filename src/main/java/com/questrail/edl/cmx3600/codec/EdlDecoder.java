package com.questrail.edl.cmx3600.codec;

import com.questrail.edl.timeline.Timeline;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;

/**
 * EdlDecoder
 * -----------------------------------------------------------------------------
 * Reads CMX 3600 EDL text and builds a {@link Timeline}.
 *
 * <p>The decoder is responsible for:</p>
 * <ul>
 *   <li>Classifying each physical line and assembling multi-line events</li>
 *   <li>Converting event timecodes to rational time at the decode rate</li>
 *   <li>Building one track per track identifier, with synthesized gaps,
 *       transitions, markers, effects and media references</li>
 * </ul>
 *
 * <p>Structural violations (an event line without a timecode line, an
 * unconvertible timecode) fail the whole call with {@link EdlParseException}.
 * Lines the decoder does not understand are skipped.</p>
 */
public interface EdlDecoder
{
    /**
     * Decodes a complete EDL from {@code reader}. The reader is consumed but
     * not closed.
     *
     * @throws EdlParseException on a structural violation
     * @throws IOException       if the reader fails
     */
    Timeline decode(Reader reader) throws IOException;

    /**
     * Decodes a complete EDL held in memory.
     *
     * @throws EdlParseException on a structural violation
     */
    default Timeline decode(String edl) {
        try {
            return decode(new StringReader(edl));
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
