package org.omniroute.gig.engine.domain.service;

import org.omniroute.gig.engine.domain.model.AllocationResult;
import org.omniroute.gig.engine.domain.model.AllocationStrategy;
import org.omniroute.gig.engine.domain.model.OfferStatus;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.TaskOffer;
import org.omniroute.gig.engine.domain.model.TaskStatus;
import org.omniroute.gig.engine.registry.WorkerStateRegistry;
import org.omniroute.gig.engine.spi.CollaboratorException;
import org.omniroute.gig.engine.spi.OfferRepository;
import org.omniroute.gig.engine.spi.TaskRepository;
import org.omniroute.gig.engine.spi.WorkerNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Implementation of OfferLifecycleService.
 *
 * Acceptance order: task assignment (compare-and-set) first, offer transition second. The task
 * repository decides the race between sibling offers, so an offer only becomes accepted once its
 * task is already taken by the same worker.
 */
public final class OfferLifecycleServiceImpl implements OfferLifecycleService {

    private static final Logger LOG = LoggerFactory.getLogger(OfferLifecycleServiceImpl.class);

    private final OfferRepository offerRepository;
    private final TaskRepository taskRepository;
    private final WorkerStateRegistry registry;
    private final WorkerNotifier notifier;
    private final TaskAllocator allocator;
    private final Executor reallocationExecutor;
    private final Clock clock;

    public OfferLifecycleServiceImpl(OfferRepository offerRepository, TaskRepository taskRepository,
                                     WorkerStateRegistry registry, WorkerNotifier notifier,
                                     TaskAllocator allocator, Executor reallocationExecutor, Clock clock) {
        this.offerRepository = Objects.requireNonNull(offerRepository, "offerRepository must not be null");
        this.taskRepository = Objects.requireNonNull(taskRepository, "taskRepository must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        this.reallocationExecutor = Objects.requireNonNull(reallocationExecutor,
                "reallocationExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Task acceptOffer(UUID offerId, UUID workerId) {
        TaskOffer offer = loadAuthorizedOffer(offerId, workerId);

        if (!offer.isPending()) {
            throw AllocationException.invalidState("Offer " + offerId + " is no longer pending (" + offer.getStatus() + ")");
        }

        Instant now = clock.instant();
        if (offer.isExpiredAt(now)) {
            expireQuietly(offer);
            throw new AllocationException(AllocationException.Reason.EXPIRED,
                    "Offer " + offerId + " expired at " + offer.getExpiresAt());
        }

        Task task = taskRepository.findById(offer.getTaskId())
                .orElseThrow(() -> AllocationException.notFound("Task", offer.getTaskId()));
        if (!task.getStatus().isOfferable()) {
            throw AllocationException.invalidState("Task " + task.getId() + " is no longer available (" + task.getStatus() + ")");
        }

        if (!taskRepository.assignWorker(task.getId(), workerId)) {
            throw AllocationException.invalidState("Task " + task.getId() + " was already taken");
        }

        boolean offerAccepted;
        try {
            offerAccepted = offerRepository.updateStatus(offerId, OfferStatus.PENDING, OfferStatus.ACCEPTED, null);
        } catch (RuntimeException e) {
            releaseQuietly(task.getId(), workerId);
            throw e;
        }
        if (!offerAccepted) {
            releaseQuietly(task.getId(), workerId);
            throw AllocationException.invalidState("Offer " + offerId + " left pending before it could be accepted");
        }

        cancelSiblingOffers(task.getId(), offerId);
        registry.recordAssignment(workerId, task.getId());

        Task accepted = task.toBuilder()
                .status(TaskStatus.ACCEPTED)
                .assignedWorkerId(workerId)
                .acceptedAt(now)
                .build();

        try {
            notifier.sendTaskUpdate(workerId, accepted, "Task assigned to you");
        } catch (RuntimeException e) {
            LOG.warn("Failed to notify worker {} of assignment {}: {}", workerId, task.getId(), e.getMessage());
        }

        LOG.info("Offer {} accepted: task {} assigned to worker {}", offerId, task.getId(), workerId);
        return accepted;
    }

    @Override
    public void declineOffer(UUID offerId, UUID workerId, String reason) {
        TaskOffer offer = loadAuthorizedOffer(offerId, workerId);

        if (!offerRepository.updateStatus(offerId, OfferStatus.PENDING, OfferStatus.DECLINED, reason)) {
            throw AllocationException.invalidState("Offer " + offerId + " is no longer pending");
        }
        LOG.info("Offer {} declined by worker {}: {}", offerId, workerId, reason);

        List<TaskOffer> remaining = offerRepository.findActiveForTask(offer.getTaskId());
        if (remaining.isEmpty()) {
            scheduleReallocation(offer.getTaskId());
        }
    }

    private TaskOffer loadAuthorizedOffer(UUID offerId, UUID workerId) {
        TaskOffer offer = offerRepository.findById(offerId)
                .orElseThrow(() -> AllocationException.notFound("Offer", offerId));
        if (!offer.getWorkerId().equals(workerId)) {
            throw new AllocationException(AllocationException.Reason.UNAUTHORIZED,
                    "Offer " + offerId + " does not belong to worker " + workerId);
        }
        return offer;
    }

    /**
     * Best-effort sweep: a failed cancellation leaves the sibling pending until it expires.
     */
    private void cancelSiblingOffers(UUID taskId, UUID acceptedOfferId) {
        List<TaskOffer> offers;
        try {
            offers = offerRepository.findActiveForTask(taskId);
        } catch (CollaboratorException e) {
            LOG.error("Failed to load offers of task {} for cancellation", taskId, e);
            return;
        }

        for (TaskOffer sibling : offers) {
            if (sibling.getId().equals(acceptedOfferId) || !sibling.isPending()) {
                continue;
            }
            try {
                if (offerRepository.updateStatus(sibling.getId(), OfferStatus.PENDING, OfferStatus.CANCELLED, null)) {
                    LOG.debug("Cancelled sibling offer {} of task {}", sibling.getId(), taskId);
                }
            } catch (CollaboratorException e) {
                LOG.warn("Failed to cancel offer {} of task {}: {}", sibling.getId(), taskId, e.getMessage());
            }
        }
    }

    private void scheduleReallocation(UUID taskId) {
        LOG.info("No active offers left for task {}, re-allocating", taskId);
        try {
            reallocationExecutor.execute(() -> {
                try {
                    AllocationResult result = allocator.allocateTask(taskId, AllocationStrategy.BROADCAST);
                    if (!result.isSuccess()) {
                        LOG.warn("Re-allocation of task {} found no taker: {}", taskId, result.getMessage());
                    }
                } catch (AllocationException e) {
                    if (e.getReason() == AllocationException.Reason.INVALID_STATE) {
                        LOG.info("Re-allocation of task {} skipped: {}", taskId, e.getMessage());
                    } else {
                        LOG.error("Failed to re-allocate task {}", taskId, e);
                    }
                } catch (RuntimeException e) {
                    LOG.error("Failed to re-allocate task {}", taskId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.error("Re-allocation of task {} rejected", taskId, e);
        }
    }

    private void expireQuietly(TaskOffer offer) {
        try {
            offerRepository.updateStatus(offer.getId(), OfferStatus.PENDING, OfferStatus.EXPIRED, null);
        } catch (CollaboratorException e) {
            LOG.warn("Failed to mark offer {} expired: {}", offer.getId(), e.getMessage());
        }
    }

    private void releaseQuietly(UUID taskId, UUID workerId) {
        try {
            if (!taskRepository.releaseAssignment(taskId, workerId)) {
                LOG.warn("Assignment of task {} to worker {} was already changed", taskId, workerId);
            }
        } catch (CollaboratorException e) {
            LOG.error("Failed to release assignment of task {} to worker {}", taskId, workerId, e);
        }
    }
}
