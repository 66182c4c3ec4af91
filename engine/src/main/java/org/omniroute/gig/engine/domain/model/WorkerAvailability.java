package org.omniroute.gig.engine.domain.model;

import java.util.Locale;

/**
 * Live availability reported by the worker app.
 */
public enum WorkerAvailability {
    ONLINE,
    OFFLINE,
    BUSY;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WorkerAvailability fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
