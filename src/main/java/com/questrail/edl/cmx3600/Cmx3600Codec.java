package com.questrail.edl.cmx3600;

import com.questrail.edl.cmx3600.codec.EdlDecoder;
import com.questrail.edl.cmx3600.codec.EdlEncoder;
import com.questrail.edl.cmx3600.codec.impl.DefaultEdlDecoder;
import com.questrail.edl.cmx3600.codec.impl.DefaultEdlEncoder;
import com.questrail.edl.cmx3600.config.EdlCodecConfig;
import com.questrail.edl.cmx3600.observability.EdlObservabilitySink;
import com.questrail.edl.cmx3600.observability.Slf4jEdlObservabilitySink;
import com.questrail.edl.timeline.Timeline;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Objects;

/**
 * Cmx3600Codec
 * =============================================================================
 * Entry point that wires an {@link EdlCodecConfig} and an observability sink
 * into a matching decoder and encoder.
 *
 * <pre>
 *   Cmx3600Codec codec = Cmx3600Codec.create(EdlCodecConfig.builder().withRate(25).build());
 *   Timeline timeline = codec.decode(text);
 *   String edl = codec.encode(timeline);
 * </pre>
 *
 * <p>{@link #create(EdlCodecConfig)} logs through SLF4J. Instances are
 * immutable and may be shared.</p>
 */
public final class Cmx3600Codec
{
    private final EdlCodecConfig config;
    private final EdlDecoder decoder;
    private final EdlEncoder encoder;

    private Cmx3600Codec(EdlCodecConfig config, EdlObservabilitySink sink)
    {
        this.config = config;
        this.decoder = new DefaultEdlDecoder(config, sink);
        this.encoder = new DefaultEdlEncoder(config, sink);
    }

    public static Cmx3600Codec create(EdlCodecConfig config)
    {
        return create(config, new Slf4jEdlObservabilitySink());
    }

    public static Cmx3600Codec create(EdlCodecConfig config, EdlObservabilitySink sink)
    {
        return new Cmx3600Codec(
                Objects.requireNonNull(config, "config"),
                Objects.requireNonNull(sink, "sink"));
    }

    public EdlCodecConfig config()
    {
        return config;
    }

    public Timeline decode(String edl)
    {
        return decoder.decode(edl);
    }

    public Timeline decode(Reader reader) throws IOException
    {
        return decoder.decode(reader);
    }

    public String encode(Timeline timeline)
    {
        return encoder.encode(timeline);
    }

    public void encode(Timeline timeline, Writer writer) throws IOException
    {
        encoder.encode(timeline, writer);
    }
}
