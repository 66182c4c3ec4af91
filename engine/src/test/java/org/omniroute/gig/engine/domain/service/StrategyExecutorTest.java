package org.omniroute.gig.engine.domain.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.omniroute.gig.engine.domain.model.AllocationConfig;
import org.omniroute.gig.engine.domain.model.AllocationResult;
import org.omniroute.gig.engine.domain.model.AllocationStrategy;
import org.omniroute.gig.engine.domain.model.Candidate;
import org.omniroute.gig.engine.domain.model.FailureReason;
import org.omniroute.gig.engine.domain.model.GigWorker;
import org.omniroute.gig.engine.domain.model.ScoredCandidate;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.TaskOffer;
import org.omniroute.gig.engine.domain.model.TaskStatus;
import org.omniroute.gig.engine.spi.OptimizationAdvisor;
import org.omniroute.gig.engine.spi.WorkerNotifier;
import org.omniroute.gig.engine.support.InMemoryOfferRepository;
import org.omniroute.gig.engine.support.InMemoryTaskRepository;
import org.omniroute.gig.engine.support.TestData;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StrategyExecutorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private WorkerNotifier notifier;

    @Mock
    private OptimizationAdvisor advisor;

    private InMemoryOfferRepository offerRepository;
    private InMemoryTaskRepository taskRepository;
    private ExecutorService broadcastExecutor;
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private Task task;

    @BeforeEach
    void setUp() {
        offerRepository = new InMemoryOfferRepository();
        taskRepository = new InMemoryTaskRepository();
        broadcastExecutor = Executors.newFixedThreadPool(4);
        task = taskRepository.save(TestData.delivery(3).build());
    }

    @AfterEach
    void tearDown() {
        broadcastExecutor.shutdownNow();
    }

    private StrategyExecutor executor(AllocationConfig config, OptimizationAdvisor optimizationAdvisor) {
        return new StrategyExecutor(offerRepository, taskRepository, notifier, optimizationAdvisor,
                broadcastExecutor, config, clock);
    }

    private StrategyExecutor executor() {
        return executor(AllocationConfig.defaults(), null);
    }

    /**
     * Candidates ranked by ascending distance: 1km, 2km, 3km...
     */
    private List<ScoredCandidate> ranked(int count) {
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            GigWorker worker = TestData.worker().build();
            candidates.add(TestData.candidate(worker, i, 0));
        }
        return new ScoringServiceImpl(AllocationConfig.defaults()).rank(candidates, AllocationStrategy.NEAREST);
    }

    @Test
    void nearestOffersTopCandidateAndMarksTaskOffered() {
        List<ScoredCandidate> ranked = ranked(3);
        ScoredCandidate best = ranked.get(0);

        AllocationResult result = executor().execute(AllocationStrategy.NEAREST, task, ranked);

        assertTrue(result.isSuccess());
        assertEquals(AllocationStrategy.NEAREST, result.getStrategy());
        assertEquals(best.getWorkerId(), result.getWorkerId());
        assertEquals(1, result.getOffersCreated());
        assertSame(best.getEarning(), result.getEarning());

        TaskOffer offer = offerRepository.get(result.getOfferId());
        assertTrue(offer.isPending());
        assertEquals(NOW, offer.getOfferedAt());
        assertEquals(NOW.plusSeconds(60), offer.getExpiresAt());
        assertEquals(best.getEtaMinutes(), offer.getEstimatedTimeMinutes());
        assertEquals(TaskStatus.OFFERED, taskRepository.get(task.getId()).getStatus());
        verify(notifier).sendTaskOffer(eq(best.getWorkerId()), any(TaskOffer.class), eq(task));
    }

    @Test
    void nearestWithoutCandidatesFailsWithoutSideEffects() {
        AllocationResult result = executor().execute(AllocationStrategy.NEAREST, task, List.of());

        assertFalse(result.isSuccess());
        assertEquals(FailureReason.NO_ELIGIBLE_WORKERS, result.getFailureReason());
        assertEquals(0, offerRepository.createCalls());
        assertEquals(0, taskRepository.statusUpdates());
        verifyNoInteractions(notifier);
    }

    @Test
    void nearestCreationFailureLeavesTaskUntouched() {
        List<ScoredCandidate> ranked = ranked(2);
        offerRepository.failCreateFor(ranked.get(0).getWorkerId());

        AllocationResult result = executor().execute(AllocationStrategy.NEAREST, task, ranked);

        assertFalse(result.isSuccess());
        assertEquals(FailureReason.OFFER_CREATION_FAILED, result.getFailureReason());
        assertEquals(TaskStatus.PENDING, taskRepository.get(task.getId()).getStatus());
        assertTrue(offerRepository.all().isEmpty());
        verifyNoInteractions(notifier);
    }

    @Test
    void notificationFailureKeepsPersistedOffer() {
        doThrow(new RuntimeException("push gateway down")).when(notifier).sendTaskOffer(any(), any(), any());

        AllocationResult result = executor().execute(AllocationStrategy.NEAREST, task, ranked(1));

        assertTrue(result.isSuccess());
        assertNotNull(offerRepository.get(result.getOfferId()));
        assertEquals(TaskStatus.OFFERED, taskRepository.get(task.getId()).getStatus());
    }

    @Test
    void broadcastOffersUpToMaxConcurrentOffers() {
        List<ScoredCandidate> ranked = ranked(7);

        AllocationResult result = executor().execute(AllocationStrategy.BROADCAST, task, ranked);

        assertTrue(result.isSuccess());
        assertEquals(5, result.getOffersCreated());
        assertEquals(5, offerRepository.createCalls());
        assertEquals(5, offerRepository.findActiveForTask(task.getId()).size());
        assertEquals(5, result.getOfferIds().size());
        assertEquals("Broadcasted to 5 workers", result.getMessage());
        for (int i = 0; i < 5; i++) {
            assertTrue(result.getCandidateWorkerIds().contains(ranked.get(i).getWorkerId()));
        }
        assertFalse(result.getCandidateWorkerIds().contains(ranked.get(5).getWorkerId()));
        assertEquals(TaskStatus.OFFERED, taskRepository.get(task.getId()).getStatus());
        verify(notifier, times(5)).sendTaskOffer(any(), any(), any());
    }

    @Test
    void broadcastToFewerCandidatesThanLimitOffersEachOnce() {
        AllocationConfig config = AllocationConfig.fromMap(Map.of(AllocationConfig.MAX_CONCURRENT_OFFERS, 10.0));

        AllocationResult result = executor(config, null).execute(AllocationStrategy.BROADCAST, task, ranked(3));

        assertEquals(3, result.getOffersCreated());
        assertEquals(3, offerRepository.createCalls());
    }

    @Test
    void partialBroadcastCountsOnlyCreatedOffers() {
        List<ScoredCandidate> ranked = ranked(3);
        offerRepository.failCreateFor(ranked.get(1).getWorkerId());

        AllocationResult result = executor().execute(AllocationStrategy.BROADCAST, task, ranked);

        assertTrue(result.isSuccess());
        assertEquals(2, result.getOffersCreated());
        assertEquals(3, offerRepository.createCalls());
        assertEquals(2, offerRepository.all().size());
        assertFalse(result.getCandidateWorkerIds().contains(ranked.get(1).getWorkerId()));
    }

    @Test
    void broadcastWithEveryCreateFailingReportsFailure() {
        List<ScoredCandidate> ranked = ranked(2);
        ranked.forEach(c -> offerRepository.failCreateFor(c.getWorkerId()));

        AllocationResult result = executor().execute(AllocationStrategy.BROADCAST, task, ranked);

        assertFalse(result.isSuccess());
        assertEquals(FailureReason.OFFER_CREATION_FAILED, result.getFailureReason());
        assertEquals(0, result.getOffersCreated());
        assertEquals(TaskStatus.PENDING, taskRepository.get(task.getId()).getStatus());
    }

    @Test
    void broadcastWithoutCandidatesFails() {
        AllocationResult result = executor().execute(AllocationStrategy.BROADCAST, task, List.of());

        assertEquals(FailureReason.NO_ELIGIBLE_WORKERS, result.getFailureReason());
    }

    @Test
    void aiOptimizedFallsBackToTopCandidateWhenDisabled() {
        List<ScoredCandidate> ranked = ranked(3);

        AllocationResult result = executor(AllocationConfig.defaults(), advisor)
                .execute(AllocationStrategy.AI_OPTIMIZED, task, ranked);

        assertTrue(result.isSuccess());
        assertEquals(AllocationStrategy.AI_OPTIMIZED, result.getStrategy());
        assertEquals(ranked.get(0).getWorkerId(), result.getWorkerId());
        verifyNoInteractions(advisor);
    }

    @Test
    void aiOptimizedOffersToAdvisorPick() {
        List<ScoredCandidate> ranked = ranked(3);
        UUID pick = ranked.get(2).getWorkerId();
        when(advisor.recommend(eq(task), any())).thenReturn(Optional.of(pick));

        AllocationResult result = executor(aiEnabled(), advisor).execute(AllocationStrategy.AI_OPTIMIZED, task, ranked);

        assertTrue(result.isSuccess());
        assertEquals(pick, result.getWorkerId());
        assertEquals(pick, offerRepository.get(result.getOfferId()).getWorkerId());
    }

    @Test
    void aiOptimizedIgnoresFailingOrUnknownAdvice() {
        List<ScoredCandidate> ranked = ranked(2);
        when(advisor.recommend(any(), any()))
                .thenThrow(new IllegalStateException("model unavailable"))
                .thenReturn(Optional.of(UUID.randomUUID()))
                .thenReturn(Optional.empty());
        StrategyExecutor strategyExecutor = executor(aiEnabled(), advisor);

        for (int i = 0; i < 3; i++) {
            Task fresh = taskRepository.save(TestData.delivery(1).build());
            AllocationResult result = strategyExecutor.execute(AllocationStrategy.AI_OPTIMIZED, fresh, ranked);
            assertEquals(ranked.get(0).getWorkerId(), result.getWorkerId());
        }
    }

    @Test
    void aiOptimizedWithoutAdvisorUsesRanking() {
        List<ScoredCandidate> ranked = ranked(2);

        AllocationResult result = executor(aiEnabled(), null).execute(AllocationStrategy.AI_OPTIMIZED, task, ranked);

        assertEquals(ranked.get(0).getWorkerId(), result.getWorkerId());
    }

    private static AllocationConfig aiEnabled() {
        return AllocationConfig.fromMap(Map.of(AllocationConfig.ENABLE_AI_OPTIMIZATION, 1.0));
    }
}
