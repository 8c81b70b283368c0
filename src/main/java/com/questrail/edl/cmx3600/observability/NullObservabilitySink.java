package com.questrail.edl.cmx3600.observability;

import com.questrail.edl.cmx3600.model.EdlEvent;

/**
 * No-op implementation of EdlObservabilitySink.
 */
public final class NullObservabilitySink implements EdlObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onEventDecoded(EdlEvent event) {}

    @Override
    public void onEventEncoded(EdlEvent event) {}

    @Override
    public void onDiagnostic(EdlDiagnosticEvent event) {}
}
