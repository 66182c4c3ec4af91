package org.omniroute.gig.engine.spi;

import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.TaskStatus;

import java.util.Optional;
import java.util.UUID;

/**
 * Task storage used by the engine.
 */
public interface TaskRepository {

    Optional<Task> findById(UUID taskId);

    void updateStatus(UUID taskId, TaskStatus status);

    /**
     * Assigns the worker and moves the task to {@link TaskStatus#ACCEPTED}, but only while the
     * task is still pending or offered. This is the single serialization point for concurrent accepts.
     *
     * @return true if this call performed the assignment, false if the task was no longer offerable
     */
    boolean assignWorker(UUID taskId, UUID workerId);

    /**
     * Reverts an assignment made by {@link #assignWorker} back to {@link TaskStatus#OFFERED},
     * only if the task is still accepted by the given worker.
     *
     * @return true if the assignment was released
     */
    boolean releaseAssignment(UUID taskId, UUID workerId);
}
