package org.omniroute.gig.engine.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Task preferences declared by a worker.
 * An empty preferred-type set means every task type is accepted.
 */
public final class TaskPreferences {

    private static final TaskPreferences NONE = new TaskPreferences(Collections.emptySet(), false);

    private final Set<TaskType> preferredTypes;
    private final boolean acceptCod;

    public TaskPreferences(Set<TaskType> preferredTypes, boolean acceptCod) {
        this.preferredTypes = preferredTypes == null || preferredTypes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(preferredTypes));
        this.acceptCod = acceptCod;
    }

    public static TaskPreferences none() {
        return NONE;
    }

    public Set<TaskType> getPreferredTypes() {
        return preferredTypes;
    }

    public boolean isAcceptCod() {
        return acceptCod;
    }

    public boolean accepts(TaskType type) {
        return preferredTypes.isEmpty() || preferredTypes.contains(type);
    }
}
