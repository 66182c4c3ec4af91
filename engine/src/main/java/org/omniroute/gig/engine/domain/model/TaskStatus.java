package org.omniroute.gig.engine.domain.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Task lifecycle status. The engine only drives pending, offered and accepted;
 * later states belong to the task owner.
 */
public enum TaskStatus {
    PENDING,
    OFFERED,
    ACCEPTED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    FAILED;

    /**
     * Statuses from which a worker may still take the task.
     */
    public static final Set<TaskStatus> OFFERABLE = EnumSet.of(PENDING, OFFERED);

    public boolean isOfferable() {
        return OFFERABLE.contains(this);
    }

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskStatus fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
