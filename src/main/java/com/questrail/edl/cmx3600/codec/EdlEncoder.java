package com.questrail.edl.cmx3600.codec;

import com.questrail.edl.timeline.Timeline;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * EdlEncoder
 * -----------------------------------------------------------------------------
 * Writes a {@link Timeline} as CMX 3600 EDL text.
 *
 * <p>A CMX 3600 list carries at most one video track. Timelines with more
 * than one video track, or no timeline at all, are rejected with
 * {@link EdlEncodeException} before any text is written.</p>
 */
public interface EdlEncoder
{
    /**
     * Encodes {@code timeline} to {@code writer}. The writer is flushed but not closed.
     *
     * @throws EdlEncodeException if the timeline cannot be expressed as an EDL
     * @throws IOException        if the writer fails
     */
    void encode(Timeline timeline, Writer writer) throws IOException;

    /**
     * Encodes {@code timeline} to a string.
     *
     * @throws EdlEncodeException if the timeline cannot be expressed as an EDL
     */
    default String encode(Timeline timeline) {
        StringWriter out = new StringWriter();
        try {
            encode(timeline, out);
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
