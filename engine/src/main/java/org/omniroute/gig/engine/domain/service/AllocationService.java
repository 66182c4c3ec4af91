package org.omniroute.gig.engine.domain.service;

import org.omniroute.gig.engine.domain.model.AllocationResult;
import org.omniroute.gig.engine.domain.model.AllocationStrategy;
import org.omniroute.gig.engine.domain.model.GeoPoint;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.WorkerAvailability;
import org.omniroute.gig.engine.domain.model.WorkerState;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for allocating tasks to gig workers.
 * All failures are reported as {@link AllocationException}.
 */
public interface AllocationService extends TaskAllocator {

    /**
     * Find, score and offer the task to workers using the given strategy.
     *
     * @param taskId   the task to allocate
     * @param strategy how offers are dispatched
     * @return the outcome; unsuccessful when no offer could be made
     */
    @Override
    AllocationResult allocateTask(UUID taskId, AllocationStrategy strategy);

    Task acceptOffer(UUID offerId, UUID workerId);

    void declineOffer(UUID offerId, UUID workerId, String reason);

    /**
     * Record a location heartbeat.
     */
    void updateWorkerLocation(UUID workerId, GeoPoint location);

    void setWorkerAvailability(UUID workerId, WorkerAvailability availability);

    /**
     * Record that a worker is done with a task (completed, failed or cancelled upstream).
     */
    void releaseWorkerTask(UUID workerId, UUID taskId);

    /**
     * Expire pending offers past their deadline.
     *
     * @return number of offers expired
     */
    int expireStaleOffers();

    /**
     * Take workers offline whose last heartbeat is older than the given age.
     *
     * @return number of workers taken offline
     */
    int markStaleWorkersOffline(Duration maxHeartbeatAge);

    Optional<WorkerState> findWorkerState(UUID workerId);
}
