package com.questrail.edl.cmx3600.observability;

import com.questrail.edl.cmx3600.model.EdlEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of EdlObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jEdlObservabilitySink implements EdlObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jEdlObservabilitySink.class);

    @Override
    public void onEventDecoded(EdlEvent event) {
        log.debug("EDL decoded event {}: reel={} track={} edit={} record {}-{}",
            event.eventNumber(),
            event.reelName(),
            event.trackType().token(),
            event.editType().token(),
            event.recordIn(),
            event.recordOut());
    }

    @Override
    public void onEventEncoded(EdlEvent event) {
        log.debug("EDL encoded event {}: reel={} track={} edit={} record {}-{}",
            event.eventNumber(),
            event.reelName(),
            event.trackType().token(),
            event.editType().token(),
            event.recordIn(),
            event.recordOut());
    }

    @Override
    public void onDiagnostic(EdlDiagnosticEvent event) {
        if (event.line() > 0) {
            log.warn("EDL {} at line {}: {}", event.kind(), event.line(), event.message());
        } else {
            log.warn("EDL {}: {}", event.kind(), event.message());
        }
    }
}
