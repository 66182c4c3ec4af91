package org.omniroute.gig.engine.domain.model;

import java.util.Locale;

/**
 * Executable allocation strategies.
 */
public enum AllocationStrategy {
    /** Single offer to the top-ranked candidate. */
    NEAREST,
    /** Parallel offers to the top candidates; first accept wins. */
    BROADCAST,
    /** Advisor-selected candidate, falling back to NEAREST. */
    AI_OPTIMIZED;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AllocationStrategy fromCode(String code) {
        String normalized = code.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("AIOPTIMIZED".equals(normalized)) {
            return AI_OPTIMIZED;
        }
        return valueOf(normalized);
    }
}
