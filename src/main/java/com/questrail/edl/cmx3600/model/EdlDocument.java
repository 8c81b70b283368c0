package com.questrail.edl.cmx3600.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of reading EDL text: the header values and the flushed events in
 * the order they were read.
 *
 * <p>The frame count mode is informational. Timecodes are always interpreted
 * at the decoder's configured rate, whatever the header says.</p>
 */
public record EdlDocument(
        Optional<String> title,
        Optional<FrameCountMode> frameCountMode,
        List<EdlEvent> events
) {
    public EdlDocument {
        title = (title == null) ? Optional.empty() : title;
        frameCountMode = (frameCountMode == null) ? Optional.empty() : frameCountMode;
        events = (events == null) ? List.of() : List.copyOf(events);
    }
}
