package org.omniroute.gig.engine.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.omniroute.gig.engine.domain.model.GeoPoint;
import org.omniroute.gig.engine.domain.model.WorkerAvailability;
import org.omniroute.gig.engine.domain.model.WorkerState;
import org.omniroute.gig.engine.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWorkerStateRegistryTest {

    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");
    private static final GeoPoint POINT = new GeoPoint(6.52, 3.37);

    private MutableClock clock;
    private InMemoryWorkerStateRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        registry = new InMemoryWorkerStateRegistry(clock);
    }

    @Test
    void unknownWorkerHasNoState() {
        assertTrue(registry.find(UUID.randomUUID()).isEmpty());
        assertTrue(registry.snapshot().isEmpty());
    }

    @Test
    void firstWriteCreatesOfflineEntry() {
        UUID workerId = UUID.randomUUID();

        WorkerState state = registry.updateLocation(workerId, POINT);

        assertEquals(POINT, state.getLocation());
        assertEquals(WorkerAvailability.OFFLINE, state.getAvailability());
        assertEquals(0, state.getActiveTaskCount());
        assertEquals(START, state.getLastHeartbeat());
        assertEquals(state.getLocation(), registry.find(workerId).orElseThrow().getLocation());
    }

    @Test
    void locationUpdateRefreshesHeartbeatButAvailabilityDoesNot() {
        UUID workerId = UUID.randomUUID();
        registry.updateLocation(workerId, POINT);
        clock.advance(Duration.ofMinutes(2));

        registry.setAvailability(workerId, WorkerAvailability.ONLINE);
        assertEquals(START, registry.find(workerId).orElseThrow().getLastHeartbeat());

        registry.updateLocation(workerId, new GeoPoint(6.53, 3.38));
        assertEquals(START.plus(Duration.ofMinutes(2)), registry.find(workerId).orElseThrow().getLastHeartbeat());
    }

    @Test
    void releaseNeverDropsBelowZero() {
        UUID workerId = UUID.randomUUID();
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        registry.recordAssignment(workerId, first);
        registry.recordAssignment(workerId, second);

        WorkerState afterOther = registry.recordRelease(workerId, first);
        assertEquals(1, afterOther.getActiveTaskCount());
        assertEquals(second, afterOther.getCurrentTaskId());

        registry.recordRelease(workerId, second);
        WorkerState floored = registry.recordRelease(workerId, second);
        assertEquals(0, floored.getActiveTaskCount());
        assertNull(floored.getCurrentTaskId());
    }

    @Test
    void onlyStaleOnlineWorkersGoOffline() {
        UUID stale = UUID.randomUUID();
        UUID fresh = UUID.randomUUID();
        UUID alreadyOffline = UUID.randomUUID();
        registry.updateLocation(stale, POINT);
        registry.setAvailability(stale, WorkerAvailability.ONLINE);
        registry.updateLocation(alreadyOffline, POINT);
        clock.advance(Duration.ofMinutes(6));
        registry.updateLocation(fresh, POINT);
        registry.setAvailability(fresh, WorkerAvailability.ONLINE);

        assertEquals(1, registry.markStaleOffline(Duration.ofMinutes(5)));

        assertEquals(WorkerAvailability.OFFLINE, registry.find(stale).orElseThrow().getAvailability());
        assertTrue(registry.find(fresh).orElseThrow().isOnline());
        assertEquals(0, registry.markStaleOffline(Duration.ofMinutes(5)));
    }

    @Test
    void snapshotIsDetachedFromLaterWrites() {
        UUID workerId = UUID.randomUUID();
        registry.setAvailability(workerId, WorkerAvailability.ONLINE);

        Map<UUID, WorkerState> snapshot = registry.snapshot();
        registry.setAvailability(workerId, WorkerAvailability.BUSY);

        assertEquals(WorkerAvailability.ONLINE, snapshot.get(workerId).getAvailability());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove(workerId));
    }

    @Test
    void concurrentAssignmentsAreAllCounted() throws Exception {
        UUID workerId = UUID.randomUUID();
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        registry.recordAssignment(workerId, UUID.randomUUID());
                        registry.updateLocation(workerId, POINT);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(threads * perThread, registry.find(workerId).orElseThrow().getActiveTaskCount());
    }

    @Test
    void rejectsNullArguments() {
        UUID workerId = UUID.randomUUID();
        assertThrows(NullPointerException.class, () -> registry.updateLocation(null, POINT));
        assertThrows(NullPointerException.class, () -> registry.updateLocation(workerId, null));
        assertThrows(NullPointerException.class, () -> registry.setAvailability(workerId, null));
    }
}
