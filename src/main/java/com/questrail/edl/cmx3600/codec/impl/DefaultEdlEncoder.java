package com.questrail.edl.cmx3600.codec.impl;

import com.questrail.edl.cmx3600.codec.EdlEncodeException;
import com.questrail.edl.cmx3600.codec.EdlEncoder;
import com.questrail.edl.cmx3600.config.EdlCodecConfig;
import com.questrail.edl.cmx3600.internal.encode.EventWriter;
import com.questrail.edl.cmx3600.internal.encode.TrackSerializer;
import com.questrail.edl.cmx3600.model.EdlEvent;
import com.questrail.edl.cmx3600.model.TrackType;
import com.questrail.edl.cmx3600.observability.EdlObservabilitySink;
import com.questrail.edl.cmx3600.observability.NullObservabilitySink;
import com.questrail.edl.timeline.Timeline;
import com.questrail.edl.timeline.Track;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DefaultEdlEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EdlEncoder}.
 *
 * <p>This is the inverse of {@link DefaultEdlDecoder} for the parts of a
 * timeline an EDL can carry: clip names, reels, durations and positions.
 * Effects, markers and colour decisions are not written.</p>
 *
 * <p>Event numbers run from 1 across the whole list: the video track first,
 * then the audio tracks in timeline order as {@code A1}..{@code A4}, with any
 * further audio track written as {@code A}.</p>
 *
 * <p>All events are derived before the first character is written, so a
 * rejected timeline leaves the writer untouched.</p>
 */
public final class DefaultEdlEncoder implements EdlEncoder
{
    private final EdlCodecConfig config;
    private final EdlObservabilitySink sink;

    public DefaultEdlEncoder()
    {
        this(EdlCodecConfig.defaults(), NullObservabilitySink.INSTANCE);
    }

    public DefaultEdlEncoder(EdlCodecConfig config)
    {
        this(config, NullObservabilitySink.INSTANCE);
    }

    public DefaultEdlEncoder(EdlCodecConfig config, EdlObservabilitySink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void encode(Timeline timeline, Writer writer) throws IOException
    {
        if (timeline == null) {
            throw new EdlEncodeException("timeline is null");
        }
        Objects.requireNonNull(writer, "writer");

        final List<EdlEvent> events = events(timeline);

        final EventWriter out = new EventWriter(writer);
        out.writeHeader(timeline.name());
        for (EdlEvent event : events) {
            out.writeEvent(event);
            sink.onEventEncoded(event);
        }
        writer.flush();
    }

    /**
     * Derives the events {@link #encode(Timeline, Writer)} would write.
     *
     * @throws EdlEncodeException if the timeline has more than one video track
     *         or a clip without a source range
     */
    public List<EdlEvent> events(Timeline timeline)
    {
        Objects.requireNonNull(timeline, "timeline");

        final List<Track> videoTracks = timeline.videoTracks();
        if (videoTracks.size() > 1) {
            throw new EdlEncodeException("EDL format supports only one video track (timeline has "
                    + videoTracks.size() + ")");
        }

        final TrackSerializer serializer =
                new TrackSerializer(config.encodeRate(), config.reelNameLength(), sink);
        final List<EdlEvent> events = new ArrayList<>();

        if (!videoTracks.isEmpty()) {
            events.addAll(serializer.serialize(videoTracks.get(0), TrackType.V, events.size() + 1));
        }

        final List<Track> audioTracks = timeline.audioTracks();
        for (int i = 0; i < audioTracks.size(); i++) {
            events.addAll(serializer.serialize(audioTracks.get(i), TrackType.forAudioIndex(i), events.size() + 1));
        }

        return events;
    }
}
