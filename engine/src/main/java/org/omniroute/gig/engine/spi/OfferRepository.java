package org.omniroute.gig.engine.spi;

import org.omniroute.gig.engine.domain.model.OfferStatus;
import org.omniroute.gig.engine.domain.model.TaskOffer;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Offer storage used by the engine.
 */
public interface OfferRepository {

    void create(TaskOffer offer);

    Optional<TaskOffer> findById(UUID offerId);

    /**
     * @return offers for the task still in {@link OfferStatus#PENDING}
     */
    List<TaskOffer> findActiveForTask(UUID taskId);

    /**
     * @return offers for the worker still in {@link OfferStatus#PENDING}
     */
    List<TaskOffer> findActiveForWorker(UUID workerId);

    /**
     * Conditional status transition.
     *
     * @param offerId  offer to update
     * @param expected status the offer must currently have
     * @param target   new status
     * @param reason   decline reason, or null
     * @return true if the offer was in {@code expected} and is now in {@code target}
     */
    boolean updateStatus(UUID offerId, OfferStatus expected, OfferStatus target, String reason);

    /**
     * Marks every pending offer whose expiry is before {@code now} as expired.
     *
     * @return number of offers expired
     */
    int expireStale(Instant now);
}
