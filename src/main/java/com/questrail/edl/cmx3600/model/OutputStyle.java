package com.questrail.edl.cmx3600.model;

import java.util.Locale;

/**
 * Flavour of EDL requested from the encoder.
 *
 * <p>Accepted by the configuration but not yet consulted: all styles
 * currently produce identical output.</p>
 */
public enum OutputStyle {
    AVID,
    NUCODA,
    PREMIERE;

    public static OutputStyle fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
