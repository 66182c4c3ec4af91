package org.omniroute.gig.engine.domain.model;

import java.util.Locale;

/**
 * Capability class of a gig worker.
 */
public enum WorkerType {
    DRIVER,
    RIDER,
    CYCLIST,
    COLLECTOR,
    SURVEYOR,
    MERCHANDISER,
    WALKER;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WorkerType fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
