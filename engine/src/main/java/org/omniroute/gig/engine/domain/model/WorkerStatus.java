package org.omniroute.gig.engine.domain.model;

import java.util.Locale;

/**
 * Account status of a gig worker, owned by the worker-profile service.
 */
public enum WorkerStatus {
    ACTIVE,
    INACTIVE,
    SUSPENDED,
    DEACTIVATED;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WorkerStatus fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
