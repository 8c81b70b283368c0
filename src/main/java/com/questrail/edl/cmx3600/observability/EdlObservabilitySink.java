package com.questrail.edl.cmx3600.observability;

import com.questrail.edl.cmx3600.model.EdlEvent;

/**
 * Receives what the EDL codec reads, writes and skips.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface EdlObservabilitySink {
    /**
     * Called for each event flushed by the decoder, in input order.
     * @param event the decoded event
     */
    void onEventDecoded(EdlEvent event);

    /**
     * Called for each event the encoder writes, in output order.
     * @param event the written event
     */
    void onEventEncoded(EdlEvent event);

    /**
     * Called when input or timeline content is skipped rather than failing the call.
     * @param event the diagnostic
     */
    void onDiagnostic(EdlDiagnosticEvent event);
}
