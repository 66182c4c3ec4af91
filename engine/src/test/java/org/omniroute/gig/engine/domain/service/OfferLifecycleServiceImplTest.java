package org.omniroute.gig.engine.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.omniroute.gig.engine.domain.model.AllocationResult;
import org.omniroute.gig.engine.domain.model.AllocationStrategy;
import org.omniroute.gig.engine.domain.model.FailureReason;
import org.omniroute.gig.engine.domain.model.OfferStatus;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.TaskOffer;
import org.omniroute.gig.engine.domain.model.TaskStatus;
import org.omniroute.gig.engine.domain.model.WorkerState;
import org.omniroute.gig.engine.registry.InMemoryWorkerStateRegistry;
import org.omniroute.gig.engine.spi.OfferRepository;
import org.omniroute.gig.engine.spi.WorkerNotifier;
import org.omniroute.gig.engine.support.InMemoryOfferRepository;
import org.omniroute.gig.engine.support.InMemoryTaskRepository;
import org.omniroute.gig.engine.support.MutableClock;
import org.omniroute.gig.engine.support.TestData;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OfferLifecycleServiceImplTest {

    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private WorkerNotifier notifier;

    @Mock
    private TaskAllocator allocator;

    private InMemoryOfferRepository offerRepository;
    private InMemoryTaskRepository taskRepository;
    private InMemoryWorkerStateRegistry registry;
    private MutableClock clock;
    private OfferLifecycleServiceImpl lifecycle;
    private Task task;

    @BeforeEach
    void setUp() {
        offerRepository = new InMemoryOfferRepository();
        taskRepository = new InMemoryTaskRepository();
        clock = new MutableClock(START);
        registry = new InMemoryWorkerStateRegistry(clock);
        lifecycle = new OfferLifecycleServiceImpl(offerRepository, taskRepository, registry, notifier,
                allocator, Runnable::run, clock);
        task = taskRepository.save(TestData.delivery(2).status(TaskStatus.OFFERED).build());
    }

    private TaskOffer offer(UUID workerId) {
        return offerRepository.save(TestData.pendingOffer(task.getId(), workerId, START, 60).build());
    }

    @Test
    void acceptAssignsTaskAndCancelsSiblingOffers() {
        UUID winner = UUID.randomUUID();
        TaskOffer accepted = offer(winner);
        TaskOffer sibling1 = offer(UUID.randomUUID());
        TaskOffer sibling2 = offer(UUID.randomUUID());

        Task result = lifecycle.acceptOffer(accepted.getId(), winner);

        assertEquals(TaskStatus.ACCEPTED, result.getStatus());
        assertEquals(winner, result.getAssignedWorkerId());
        assertEquals(START, result.getAcceptedAt());
        assertEquals(TaskStatus.ACCEPTED, taskRepository.get(task.getId()).getStatus());
        assertEquals(OfferStatus.ACCEPTED, offerRepository.get(accepted.getId()).getStatus());
        assertEquals(OfferStatus.CANCELLED, offerRepository.get(sibling1.getId()).getStatus());
        assertEquals(OfferStatus.CANCELLED, offerRepository.get(sibling2.getId()).getStatus());

        WorkerState state = registry.find(winner).orElseThrow();
        assertEquals(1, state.getActiveTaskCount());
        assertEquals(task.getId(), state.getCurrentTaskId());
        verify(notifier).sendTaskUpdate(eq(winner), any(Task.class), anyString());
    }

    @Test
    void acceptByAnotherWorkerIsUnauthorized() {
        TaskOffer offer = offer(UUID.randomUUID());

        AllocationException e = assertThrows(AllocationException.class,
                () -> lifecycle.acceptOffer(offer.getId(), UUID.randomUUID()));

        assertEquals(AllocationException.Reason.UNAUTHORIZED, e.getReason());
        assertTrue(offerRepository.get(offer.getId()).isPending());
    }

    @Test
    void acceptOfUnknownOfferIsNotFound() {
        AllocationException e = assertThrows(AllocationException.class,
                () -> lifecycle.acceptOffer(UUID.randomUUID(), UUID.randomUUID()));

        assertEquals(AllocationException.Reason.NOT_FOUND, e.getReason());
    }

    @Test
    void acceptOfDeclinedOfferIsInvalidState() {
        UUID workerId = UUID.randomUUID();
        TaskOffer offer = offerRepository.save(TestData.pendingOffer(task.getId(), workerId, START, 60)
                .status(OfferStatus.DECLINED).build());

        AllocationException e = assertThrows(AllocationException.class,
                () -> lifecycle.acceptOffer(offer.getId(), workerId));

        assertEquals(AllocationException.Reason.INVALID_STATE, e.getReason());
    }

    @Test
    void acceptAfterDeadlineFailsEvenThoughOfferIsStoredPending() {
        UUID workerId = UUID.randomUUID();
        TaskOffer offer = offer(workerId);
        clock.advance(Duration.ofSeconds(61));

        AllocationException e = assertThrows(AllocationException.class,
                () -> lifecycle.acceptOffer(offer.getId(), workerId));

        assertEquals(AllocationException.Reason.EXPIRED, e.getReason());
        assertEquals(OfferStatus.EXPIRED, offerRepository.get(offer.getId()).getStatus());
        assertEquals(TaskStatus.OFFERED, taskRepository.get(task.getId()).getStatus());
        assertTrue(registry.find(workerId).isEmpty());
    }

    @Test
    void acceptAtExactDeadlineSucceeds() {
        UUID workerId = UUID.randomUUID();
        TaskOffer offer = offer(workerId);
        clock.advance(Duration.ofSeconds(60));

        assertEquals(workerId, lifecycle.acceptOffer(offer.getId(), workerId).getAssignedWorkerId());
    }

    @Test
    void acceptOfTakenTaskIsInvalidStateAndLeavesOfferPending() {
        UUID workerId = UUID.randomUUID();
        TaskOffer offer = offer(workerId);
        taskRepository.save(task.toBuilder().status(TaskStatus.ACCEPTED).assignedWorkerId(UUID.randomUUID()).build());

        AllocationException e = assertThrows(AllocationException.class,
                () -> lifecycle.acceptOffer(offer.getId(), workerId));

        assertEquals(AllocationException.Reason.INVALID_STATE, e.getReason());
        assertTrue(offerRepository.get(offer.getId()).isPending());
    }

    @Test
    void concurrentAcceptsAssignTheTaskExactlyOnce() throws Exception {
        int workers = 8;
        List<TaskOffer> offers = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            offers.add(offer(UUID.randomUUID()));
        }

        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        try {
            for (TaskOffer offer : offers) {
                outcomes.add(pool.submit(() -> {
                    start.await();
                    try {
                        lifecycle.acceptOffer(offer.getId(), offer.getWorkerId());
                        return true;
                    } catch (AllocationException e) {
                        assertEquals(AllocationException.Reason.INVALID_STATE, e.getReason());
                        return false;
                    }
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> outcome : outcomes) {
                if (outcome.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }

        List<TaskOffer> accepted = new ArrayList<>();
        for (TaskOffer offer : offerRepository.all()) {
            if (offer.getStatus() == OfferStatus.ACCEPTED) {
                accepted.add(offer);
            }
        }
        assertEquals(1, accepted.size());
        assertEquals(accepted.get(0).getWorkerId(), taskRepository.get(task.getId()).getAssignedWorkerId());
        assertEquals(1, registry.find(accepted.get(0).getWorkerId()).orElseThrow().getActiveTaskCount());
    }

    @Test
    void lostOfferTransitionReleasesTheAssignment() {
        UUID workerId = UUID.randomUUID();
        TaskOffer offer = TestData.pendingOffer(task.getId(), workerId, START, 60).build();
        OfferRepository racingOffers = mock(OfferRepository.class);
        when(racingOffers.findById(offer.getId())).thenReturn(Optional.of(offer));
        when(racingOffers.updateStatus(offer.getId(), OfferStatus.PENDING, OfferStatus.ACCEPTED, null))
                .thenReturn(false);
        OfferLifecycleServiceImpl racing = new OfferLifecycleServiceImpl(racingOffers, taskRepository, registry,
                notifier, allocator, Runnable::run, clock);

        AllocationException e = assertThrows(AllocationException.class,
                () -> racing.acceptOffer(offer.getId(), workerId));

        assertEquals(AllocationException.Reason.INVALID_STATE, e.getReason());
        Task current = taskRepository.get(task.getId());
        assertEquals(TaskStatus.OFFERED, current.getStatus());
        assertNull(current.getAssignedWorkerId());
        assertTrue(registry.find(workerId).isEmpty());
        verifyNoInteractions(notifier);
    }

    @Test
    void assignmentNotificationFailureDoesNotFailAccept() {
        UUID workerId = UUID.randomUUID();
        TaskOffer offer = offer(workerId);
        doThrow(new RuntimeException("push gateway down")).when(notifier).sendTaskUpdate(any(), any(), any());

        Task result = lifecycle.acceptOffer(offer.getId(), workerId);

        assertEquals(TaskStatus.ACCEPTED, result.getStatus());
    }

    @Test
    void declineOfLastOfferTriggersOneBroadcastReallocation() {
        UUID workerId = UUID.randomUUID();
        TaskOffer offer = offer(workerId);
        when(allocator.allocateTask(task.getId(), AllocationStrategy.BROADCAST)).thenReturn(
                AllocationResult.failure(task.getId(), AllocationStrategy.BROADCAST,
                        FailureReason.NO_ELIGIBLE_WORKERS, "No eligible workers available"));

        lifecycle.declineOffer(offer.getId(), workerId, "too far");

        TaskOffer declined = offerRepository.get(offer.getId());
        assertEquals(OfferStatus.DECLINED, declined.getStatus());
        assertEquals("too far", declined.getDeclineReason());
        verify(allocator, times(1)).allocateTask(task.getId(), AllocationStrategy.BROADCAST);
        verifyNoMoreInteractions(allocator);
    }

    @Test
    void declineWithOtherPendingOffersDoesNotReallocate() {
        UUID workerId = UUID.randomUUID();
        TaskOffer offer = offer(workerId);
        offer(UUID.randomUUID());

        lifecycle.declineOffer(offer.getId(), workerId, null);

        verifyNoInteractions(allocator);
    }

    @Test
    void declineOfAnsweredOfferIsInvalidState() {
        UUID workerId = UUID.randomUUID();
        TaskOffer offer = offer(workerId);
        lifecycle.acceptOffer(offer.getId(), workerId);

        AllocationException e = assertThrows(AllocationException.class,
                () -> lifecycle.declineOffer(offer.getId(), workerId, "changed my mind"));

        assertEquals(AllocationException.Reason.INVALID_STATE, e.getReason());
        verifyNoInteractions(allocator);
    }

    @Test
    void declineByAnotherWorkerIsUnauthorized() {
        TaskOffer offer = offer(UUID.randomUUID());

        AllocationException e = assertThrows(AllocationException.class,
                () -> lifecycle.declineOffer(offer.getId(), UUID.randomUUID(), null));

        assertEquals(AllocationException.Reason.UNAUTHORIZED, e.getReason());
    }

    @Test
    void reallocationFailureIsNotSurfacedToDecliningWorker() {
        UUID workerId = UUID.randomUUID();
        TaskOffer offer = offer(workerId);
        when(allocator.allocateTask(any(), any())).thenThrow(new AllocationException(
                AllocationException.Reason.COLLABORATOR_FAILURE, "platform down"));

        assertDoesNotThrow(() -> lifecycle.declineOffer(offer.getId(), workerId, "busy"));
        assertEquals(OfferStatus.DECLINED, offerRepository.get(offer.getId()).getStatus());
    }

    @Test
    void reallocationOfAlreadyOfferedTaskIsQuietlySkipped() {
        UUID workerId = UUID.randomUUID();
        TaskOffer offer = offer(workerId);
        when(allocator.allocateTask(any(), any())).thenThrow(AllocationException.invalidState(
                "Task " + offer.getTaskId() + " already has 2 pending offers"));

        assertDoesNotThrow(() -> lifecycle.declineOffer(offer.getId(), workerId, "busy"));
        verify(allocator).allocateTask(offer.getTaskId(), AllocationStrategy.BROADCAST);
    }
}
