package org.omniroute.gig.engine.domain.service;

import org.omniroute.gig.engine.domain.model.AllocationConfig;
import org.omniroute.gig.engine.domain.model.AllocationResult;
import org.omniroute.gig.engine.domain.model.AllocationStrategy;
import org.omniroute.gig.engine.domain.model.FailureReason;
import org.omniroute.gig.engine.domain.model.ScoredCandidate;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.TaskOffer;
import org.omniroute.gig.engine.domain.model.TaskStatus;
import org.omniroute.gig.engine.spi.CollaboratorException;
import org.omniroute.gig.engine.spi.OfferRepository;
import org.omniroute.gig.engine.spi.OptimizationAdvisor;
import org.omniroute.gig.engine.spi.TaskRepository;
import org.omniroute.gig.engine.spi.WorkerNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Turns a ranked candidate list into offers according to an {@link AllocationStrategy}.
 * Strategies are looked up in a table of handlers; scoring is shared and happens before this step.
 */
public final class StrategyExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(StrategyExecutor.class);

    /**
     * Executes one allocation strategy over candidates ranked best first.
     */
    @FunctionalInterface
    interface StrategyHandler {
        AllocationResult execute(Task task, List<ScoredCandidate> ranked);
    }

    private final OfferRepository offerRepository;
    private final TaskRepository taskRepository;
    private final WorkerNotifier notifier;
    private final OptimizationAdvisor advisor;
    private final ExecutorService broadcastExecutor;
    private final AllocationConfig config;
    private final Clock clock;
    private final Map<AllocationStrategy, StrategyHandler> handlers = new EnumMap<>(AllocationStrategy.class);

    /**
     * @param advisor           optional model-driven selector, may be null
     * @param broadcastExecutor pool running broadcast offer creation; not owned by this class
     */
    public StrategyExecutor(OfferRepository offerRepository, TaskRepository taskRepository,
                            WorkerNotifier notifier, OptimizationAdvisor advisor,
                            ExecutorService broadcastExecutor, AllocationConfig config, Clock clock) {
        this.offerRepository = Objects.requireNonNull(offerRepository, "offerRepository must not be null");
        this.taskRepository = Objects.requireNonNull(taskRepository, "taskRepository must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.advisor = advisor;
        this.broadcastExecutor = Objects.requireNonNull(broadcastExecutor, "broadcastExecutor must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        handlers.put(AllocationStrategy.NEAREST,
                (task, ranked) -> offerToTopCandidate(task, ranked, AllocationStrategy.NEAREST));
        handlers.put(AllocationStrategy.BROADCAST, this::broadcastToCandidates);
        handlers.put(AllocationStrategy.AI_OPTIMIZED, this::allocateWithAdvisor);
    }

    /**
     * Run the strategy over the ranked candidates.
     *
     * @param strategy strategy to execute
     * @param task     task being allocated
     * @param ranked   candidates sorted best first
     * @return the allocation outcome; never null
     */
    public AllocationResult execute(AllocationStrategy strategy, Task task, List<ScoredCandidate> ranked) {
        StrategyHandler handler = handlers.get(Objects.requireNonNull(strategy, "strategy must not be null"));
        return handler.execute(task, ranked);
    }

    /**
     * Single offer to the first candidate.
     */
    private AllocationResult offerToTopCandidate(Task task, List<ScoredCandidate> ranked,
                                                 AllocationStrategy strategy) {
        if (ranked.isEmpty()) {
            return AllocationResult.failure(task.getId(), strategy,
                    FailureReason.NO_ELIGIBLE_WORKERS, "No eligible workers");
        }

        ScoredCandidate best = ranked.get(0);
        TaskOffer offer;
        try {
            offer = createAndNotify(task, best);
        } catch (CollaboratorException e) {
            LOG.error("Failed to create offer for task {} to worker {}", task.getId(), best.getWorkerId(), e);
            return AllocationResult.failure(task.getId(), strategy,
                    FailureReason.OFFER_CREATION_FAILED, "Failed to create offer");
        }

        markOffered(task);

        LOG.info("Offered task {} to worker {} (score={}, ETA={}min)", task.getId(), best.getWorkerId(),
                String.format("%.2f", best.getScore()), best.getEtaMinutes());

        return new AllocationResult.Builder()
                .success(true)
                .taskId(task.getId())
                .strategy(strategy)
                .workerId(best.getWorkerId())
                .offerId(offer.getId())
                .offerIds(List.of(offer.getId()))
                .candidateWorkerIds(List.of(best.getWorkerId()))
                .offersCreated(1)
                .earning(best.getEarning())
                .build();
    }

    /**
     * Parallel offers to the top candidates. Blocks until every attempt has finished.
     */
    private AllocationResult broadcastToCandidates(Task task, List<ScoredCandidate> ranked) {
        if (ranked.isEmpty()) {
            return AllocationResult.failure(task.getId(), AllocationStrategy.BROADCAST,
                    FailureReason.NO_ELIGIBLE_WORKERS, "No eligible workers");
        }

        int fanOut = Math.min(config.getMaxConcurrentOffers(), ranked.size());
        List<ScoredCandidate> targets = ranked.subList(0, fanOut);

        List<Callable<TaskOffer>> attempts = new ArrayList<>(fanOut);
        for (ScoredCandidate candidate : targets) {
            attempts.add(() -> createAndNotify(task, candidate));
        }

        List<Future<TaskOffer>> futures;
        try {
            futures = broadcastExecutor.invokeAll(attempts);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AllocationException(AllocationException.Reason.INTERRUPTED,
                    "Broadcast interrupted for task " + task.getId(), e);
        }

        List<UUID> offerIds = new ArrayList<>(fanOut);
        List<UUID> workerIds = new ArrayList<>(fanOut);
        for (int i = 0; i < futures.size(); i++) {
            ScoredCandidate candidate = targets.get(i);
            try {
                TaskOffer offer = futures.get(i).get();
                offerIds.add(offer.getId());
                workerIds.add(candidate.getWorkerId());
            } catch (ExecutionException e) {
                LOG.error("Failed to create broadcast offer for task {} to worker {}",
                        task.getId(), candidate.getWorkerId(), e.getCause());
            } catch (InterruptedException e) {
                // every attempt is already done after invokeAll
                Thread.currentThread().interrupt();
            }
        }

        int created = offerIds.size();
        if (created == 0) {
            return AllocationResult.failure(task.getId(), AllocationStrategy.BROADCAST,
                    FailureReason.OFFER_CREATION_FAILED, "Failed to create any of " + fanOut + " offers");
        }

        markOffered(task);

        if (created < fanOut) {
            LOG.warn("Partial broadcast for task {}: {}/{} offers created", task.getId(), created, fanOut);
        } else {
            LOG.info("Broadcast task {} to {} workers", task.getId(), created);
        }

        return new AllocationResult.Builder()
                .success(true)
                .taskId(task.getId())
                .strategy(AllocationStrategy.BROADCAST)
                .offerIds(offerIds)
                .candidateWorkerIds(workerIds)
                .offersCreated(created)
                .message(String.format("Broadcasted to %d workers", created))
                .build();
    }

    /**
     * Advisor-selected single offer. Falls back to the ranking whenever the advisor is
     * disabled, absent, failing, or picks a worker outside the candidate list.
     */
    private AllocationResult allocateWithAdvisor(Task task, List<ScoredCandidate> ranked) {
        if (!config.isAiOptimizationEnabled() || advisor == null || ranked.isEmpty()) {
            return offerToTopCandidate(task, ranked, AllocationStrategy.AI_OPTIMIZED);
        }

        Optional<UUID> recommended;
        try {
            recommended = advisor.recommend(task, Collections.unmodifiableList(ranked));
        } catch (RuntimeException e) {
            LOG.warn("Optimization advisor failed for task {}, using ranking: {}", task.getId(), e.getMessage());
            recommended = Optional.empty();
        }

        if (recommended.isEmpty()) {
            return offerToTopCandidate(task, ranked, AllocationStrategy.AI_OPTIMIZED);
        }

        UUID pick = recommended.get();
        List<ScoredCandidate> reordered = new ArrayList<>(ranked.size());
        for (ScoredCandidate candidate : ranked) {
            if (candidate.getWorkerId().equals(pick)) {
                reordered.add(0, candidate);
            } else {
                reordered.add(candidate);
            }
        }
        if (!reordered.get(0).getWorkerId().equals(pick)) {
            LOG.warn("Optimization advisor picked unknown worker {} for task {}, using ranking", pick, task.getId());
        }
        return offerToTopCandidate(task, reordered, AllocationStrategy.AI_OPTIMIZED);
    }

    /**
     * Persist an offer, then notify. A notification failure never undoes the persisted offer.
     */
    private TaskOffer createAndNotify(Task task, ScoredCandidate candidate) {
        Instant now = clock.instant();
        TaskOffer offer = TaskOffer.builder()
                .id(UUID.randomUUID())
                .taskId(task.getId())
                .workerId(candidate.getWorkerId())
                .offeredAt(now)
                .expiresAt(now.plusSeconds(config.getOfferTimeoutSeconds()))
                .baseEarning(candidate.getEarning().getBaseEarning())
                .bonusEarning(candidate.getEarning().getBonusEarning())
                .estimatedTimeMinutes(candidate.getEtaMinutes())
                .distanceKm(candidate.getDistanceKm())
                .build();

        offerRepository.create(offer);

        try {
            notifier.sendTaskOffer(candidate.getWorkerId(), offer, task);
        } catch (RuntimeException e) {
            LOG.error("Failed to notify worker {} of offer {}", candidate.getWorkerId(), offer.getId(), e);
        }
        return offer;
    }

    private void markOffered(Task task) {
        try {
            taskRepository.updateStatus(task.getId(), TaskStatus.OFFERED);
        } catch (CollaboratorException e) {
            LOG.error("Failed to mark task {} as offered", task.getId(), e);
        }
    }
}
