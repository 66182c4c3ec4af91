package org.omniroute.gig.engine.registry;

import org.omniroute.gig.engine.domain.model.GeoPoint;
import org.omniroute.gig.engine.domain.model.WorkerAvailability;
import org.omniroute.gig.engine.domain.model.WorkerState;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Live worker location and availability, keyed by worker id.
 * Entries are created lazily on first write.
 */
public interface WorkerStateRegistry {

    Optional<WorkerState> find(UUID workerId);

    /**
     * Records a heartbeat with the worker's current position.
     */
    WorkerState updateLocation(UUID workerId, GeoPoint location);

    WorkerState setAvailability(UUID workerId, WorkerAvailability availability);

    /**
     * Increments the active task count and sets the current task.
     */
    WorkerState recordAssignment(UUID workerId, UUID taskId);

    /**
     * Decrements the active task count (never below zero) and clears the current task if it matches.
     */
    WorkerState recordRelease(UUID workerId, UUID taskId);

    /**
     * Moves online workers whose last heartbeat is older than {@code maxAge} offline.
     *
     * @return number of workers moved offline
     */
    int markStaleOffline(Duration maxAge);

    /**
     * Copy of the current state of every known worker.
     */
    Map<UUID, WorkerState> snapshot();
}
