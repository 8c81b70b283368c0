package com.questrail.edl.cmx3600.codec.impl;

import com.questrail.edl.cmx3600.codec.EdlDecoder;
import com.questrail.edl.cmx3600.codec.EdlParseException;
import com.questrail.edl.cmx3600.config.EdlCodecConfig;
import com.questrail.edl.cmx3600.internal.decode.EventAccumulator;
import com.questrail.edl.cmx3600.internal.decode.TimelineBuilder;
import com.questrail.edl.cmx3600.model.EdlDocument;
import com.questrail.edl.cmx3600.observability.EdlObservabilitySink;
import com.questrail.edl.cmx3600.observability.NullObservabilitySink;
import com.questrail.edl.timeline.Timeline;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Objects;

/**
 * DefaultEdlDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EdlDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Line splitting, keeping 1-based physical line numbers</li>
 *   <li>Event assembly ({@link EventAccumulator})</li>
 *   <li>Track grouping and timeline construction ({@link TimelineBuilder})
 *       at the configured decode rate</li>
 * </ol>
 *
 * <p>The decoder holds only its configuration and sink. Each call uses fresh
 * accumulator and builder instances, so one decoder may be shared between
 * threads as long as the sink is thread-safe.</p>
 */
public final class DefaultEdlDecoder implements EdlDecoder
{
    private final EdlCodecConfig config;
    private final EdlObservabilitySink sink;

    public DefaultEdlDecoder()
    {
        this(EdlCodecConfig.defaults(), NullObservabilitySink.INSTANCE);
    }

    public DefaultEdlDecoder(EdlCodecConfig config)
    {
        this(config, NullObservabilitySink.INSTANCE);
    }

    public DefaultEdlDecoder(EdlCodecConfig config, EdlObservabilitySink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public Timeline decode(Reader reader) throws IOException
    {
        return new TimelineBuilder(config.decodeRate(), sink).build(read(reader));
    }

    /**
     * Reads the events of an EDL without building a timeline.
     *
     * @throws EdlParseException if an event line is not followed by its timecode line
     * @throws IOException       if the reader fails
     */
    public EdlDocument read(Reader reader) throws IOException
    {
        Objects.requireNonNull(reader, "reader");

        final EventAccumulator accumulator = new EventAccumulator(sink);
        final BufferedReader lines = (reader instanceof BufferedReader buffered)
                ? buffered
                : new BufferedReader(reader);

        int lineNumber = 0;
        String line;
        while ((line = lines.readLine()) != null) {
            accumulator.accept(++lineNumber, line);
        }
        return accumulator.finish();
    }
}
