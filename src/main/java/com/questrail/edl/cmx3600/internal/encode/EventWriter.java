package com.questrail.edl.cmx3600.internal.encode;

import com.questrail.edl.cmx3600.model.EdlEvent;
import com.questrail.edl.cmx3600.model.EditType;
import com.questrail.edl.cmx3600.model.FrameCountMode;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * EventWriter
 * -----------------------------------------------------------------------------
 * Writes the EDL header and events as text.
 *
 * <pre>
 *   TITLE: Example
 *   FCM: NON-DROP FRAME
 *
 *   001  REEL1    V     C
 *        01:00:00:00 01:00:05:00 00:00:00:00 00:00:05:00
 *   * FROM CLIP NAME: Shot 1
 *
 *   002  REEL2    V     D      030
 *        ...
 * </pre>
 *
 * <p>Every line ends with {@code \n}. The writer is never flushed or closed
 * here.</p>
 */
public final class EventWriter
{
    static final String DEFAULT_TITLE = "Timeline";

    private final Writer out;

    public EventWriter(Writer out)
    {
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Writes the {@code TITLE:} and {@code FCM:} lines and a blank line.
     *
     * @param title timeline name; empty or {@code null} writes {@value #DEFAULT_TITLE}
     */
    public void writeHeader(String title) throws IOException
    {
        final String effective = (title == null || title.isEmpty()) ? DEFAULT_TITLE : title;
        line("TITLE: " + effective);
        line("FCM: " + FrameCountMode.NON_DROP_FRAME.token());
        line("");
    }

    public void writeEvent(EdlEvent event) throws IOException
    {
        line(eventLine(event));
        line(String.format("     %s %s %s %s",
                event.sourceIn(), event.sourceOut(), event.recordIn(), event.recordOut()));
        if (event.clipName() != null && !event.clipName().isEmpty()) {
            line("* FROM CLIP NAME: " + event.clipName());
        }
        line("");
    }

    static String eventLine(EdlEvent event)
    {
        String line = String.format("%03d  %-8s %s    %-2s",
                event.eventNumber(),
                event.reelName(),
                event.trackType().token(),
                event.editType().token());

        if (event.editType() == EditType.DISSOLVE && event.transitionDuration() > 0) {
            line += String.format("   %03d", event.transitionDuration());
        }
        return line;
    }

    private void line(String text) throws IOException
    {
        out.write(text);
        out.write('\n');
    }
}
