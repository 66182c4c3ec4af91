package org.omniroute.gig.engine.domain.service;

import org.omniroute.gig.engine.domain.model.AllocationResult;
import org.omniroute.gig.engine.domain.model.AllocationStrategy;
import org.omniroute.gig.engine.domain.model.Candidate;
import org.omniroute.gig.engine.domain.model.FailureReason;
import org.omniroute.gig.engine.domain.model.GeoPoint;
import org.omniroute.gig.engine.domain.model.ScoredCandidate;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.WorkerAvailability;
import org.omniroute.gig.engine.domain.model.WorkerState;
import org.omniroute.gig.engine.registry.WorkerStateRegistry;
import org.omniroute.gig.engine.spi.CollaboratorException;
import org.omniroute.gig.engine.spi.OfferRepository;
import org.omniroute.gig.engine.spi.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Implementation of AllocationService.
 * Runs discovery, scoring and strategy execution, and delegates offer responses to the lifecycle service.
 * Collaborator failures surface as {@link AllocationException.Reason#COLLABORATOR_FAILURE}.
 * Allocations of the same task are serialized, and a task holding an unexpired pending offer
 * is not offered again.
 */
public final class AllocationServiceImpl implements AllocationService {

    private static final Logger LOG = LoggerFactory.getLogger(AllocationServiceImpl.class);
    private static final int LOCK_STRIPES = 64;

    private final TaskRepository taskRepository;
    private final OfferRepository offerRepository;
    private final WorkerStateRegistry registry;
    private final CandidateDiscoveryService discoveryService;
    private final ScoringService scoringService;
    private final StrategyExecutor strategyExecutor;
    private final OfferLifecycleService lifecycleService;
    private final Clock clock;
    private final AtomicLong allocationCount = new AtomicLong();
    private final AtomicLong totalMatchMillis = new AtomicLong();
    private final Object[] allocationLocks = new Object[LOCK_STRIPES];

    /**
     * @param lifecycleFactory builds the lifecycle service around this allocator, for re-allocation
     */
    public AllocationServiceImpl(TaskRepository taskRepository, OfferRepository offerRepository,
                                 WorkerStateRegistry registry, CandidateDiscoveryService discoveryService,
                                 ScoringService scoringService, StrategyExecutor strategyExecutor,
                                 LifecycleFactory lifecycleFactory, Clock clock) {
        this.taskRepository = Objects.requireNonNull(taskRepository, "taskRepository must not be null");
        this.offerRepository = Objects.requireNonNull(offerRepository, "offerRepository must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.discoveryService = Objects.requireNonNull(discoveryService, "discoveryService must not be null");
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
        this.strategyExecutor = Objects.requireNonNull(strategyExecutor, "strategyExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        for (int i = 0; i < allocationLocks.length; i++) {
            allocationLocks[i] = new Object();
        }
        this.lifecycleService = Objects.requireNonNull(lifecycleFactory, "lifecycleFactory must not be null")
                .create(this::allocateTask);
    }

    /**
     * Creates the lifecycle service once the allocator it re-allocates through exists.
     */
    @FunctionalInterface
    public interface LifecycleFactory {
        OfferLifecycleService create(TaskAllocator allocator);
    }

    @Override
    public AllocationResult allocateTask(UUID taskId, AllocationStrategy strategy) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        LOG.info("Allocating task {} with strategy {}", taskId, strategy);
        long start = clock.millis();

        return collaborating("allocate task " + taskId, () -> {
            synchronized (lockFor(taskId)) {
                return allocateLocked(taskId, strategy, start);
            }
        });
    }

    private AllocationResult allocateLocked(UUID taskId, AllocationStrategy strategy, long start) {
        Task task = taskRepository.findById(taskId)
                .orElseThrow(() -> AllocationException.notFound("Task", taskId));
        if (!task.getStatus().isOfferable()) {
            throw AllocationException.invalidState("Task " + taskId + " is " + task.getStatus());
        }

        Instant now = clock.instant();
        long pending = offerRepository.findActiveForTask(taskId).stream()
                .filter(offer -> !offer.isExpiredAt(now))
                .count();
        if (pending > 0) {
            throw AllocationException.invalidState("Task " + taskId + " already has " + pending + " pending offers");
        }

        List<Candidate> candidates = discoveryService.findCandidates(task);
        AllocationResult result;
        if (candidates.isEmpty()) {
            LOG.warn("No eligible workers for task {}", taskId);
            result = AllocationResult.failure(taskId, strategy,
                    FailureReason.NO_ELIGIBLE_WORKERS, "No eligible workers available");
        } else {
            List<ScoredCandidate> ranked = scoringService.rank(candidates, strategy);
            result = strategyExecutor.execute(strategy, task, ranked);
        }

        long elapsed = clock.millis() - start;
        allocationCount.incrementAndGet();
        totalMatchMillis.addAndGet(elapsed);
        LOG.info("Task allocation completed: task={}, strategy={}, success={}, eligible={}, offers={}, took={}ms",
                taskId, strategy, result.isSuccess(), candidates.size(), result.getOffersCreated(), elapsed);
        return result;
    }

    private Object lockFor(UUID taskId) {
        return allocationLocks[Math.floorMod(taskId.hashCode(), allocationLocks.length)];
    }

    @Override
    public Task acceptOffer(UUID offerId, UUID workerId) {
        Objects.requireNonNull(offerId, "offerId must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");
        return collaborating("accept offer " + offerId, () -> lifecycleService.acceptOffer(offerId, workerId));
    }

    @Override
    public void declineOffer(UUID offerId, UUID workerId, String reason) {
        Objects.requireNonNull(offerId, "offerId must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");
        collaborating("decline offer " + offerId, () -> {
            lifecycleService.declineOffer(offerId, workerId, reason);
            return null;
        });
    }

    @Override
    public void updateWorkerLocation(UUID workerId, GeoPoint location) {
        registry.updateLocation(workerId, location);
    }

    @Override
    public void setWorkerAvailability(UUID workerId, WorkerAvailability availability) {
        registry.setAvailability(workerId, availability);
    }

    @Override
    public void releaseWorkerTask(UUID workerId, UUID taskId) {
        WorkerState state = registry.recordRelease(workerId, taskId);
        LOG.info("Worker {} released task {} ({} active)", workerId, taskId, state.getActiveTaskCount());
    }

    @Override
    public int expireStaleOffers() {
        int expired = collaborating("expire offers", () -> offerRepository.expireStale(clock.instant()));
        if (expired > 0) {
            LOG.info("Expired {} stale offers", expired);
        }
        return expired;
    }

    @Override
    public int markStaleWorkersOffline(Duration maxHeartbeatAge) {
        return registry.markStaleOffline(maxHeartbeatAge);
    }

    @Override
    public Optional<WorkerState> findWorkerState(UUID workerId) {
        return registry.find(workerId);
    }

    /**
     * @return number of allocation attempts that reached a result
     */
    public long getAllocationCount() {
        return allocationCount.get();
    }

    /**
     * @return mean duration of the counted allocation attempts in milliseconds, 0 before the first
     */
    public double getAverageMatchTimeMillis() {
        long count = allocationCount.get();
        return count == 0 ? 0.0 : (double) totalMatchMillis.get() / count;
    }

    private static <T> T collaborating(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (CollaboratorException e) {
            throw new AllocationException(AllocationException.Reason.COLLABORATOR_FAILURE,
                    "Failed to " + action + ": " + e.getMessage(), e);
        }
    }
}
