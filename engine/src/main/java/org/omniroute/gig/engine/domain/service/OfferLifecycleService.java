package org.omniroute.gig.engine.domain.service;

import org.omniroute.gig.engine.domain.model.Task;

import java.util.UUID;

/**
 * Service handling worker responses to offers.
 */
public interface OfferLifecycleService {

    /**
     * Accept an offer. At most one offer per task can ever be accepted.
     *
     * @return the task, now accepted and assigned to the worker
     * @throws AllocationException with NOT_FOUND, UNAUTHORIZED, INVALID_STATE or EXPIRED
     */
    Task acceptOffer(UUID offerId, UUID workerId);

    /**
     * Decline an offer. Re-allocates the task asynchronously when no pending offer remains.
     *
     * @throws AllocationException with NOT_FOUND, UNAUTHORIZED or INVALID_STATE
     */
    void declineOffer(UUID offerId, UUID workerId, String reason);
}
