package org.omniroute.gig.engine.registry;

import org.omniroute.gig.engine.domain.model.GeoPoint;
import org.omniroute.gig.engine.domain.model.WorkerAvailability;
import org.omniroute.gig.engine.domain.model.WorkerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * Thread-safe implementation of WorkerStateRegistry.
 * Uses read-write lock for concurrent reads with exclusive writes; values are immutable snapshots.
 */
public final class InMemoryWorkerStateRegistry implements WorkerStateRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryWorkerStateRegistry.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<UUID, WorkerState> states = new HashMap<>();
    private final Clock clock;

    public InMemoryWorkerStateRegistry() {
        this(Clock.systemUTC());
    }

    public InMemoryWorkerStateRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<WorkerState> find(UUID workerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(states.get(workerId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public WorkerState updateLocation(UUID workerId, GeoPoint location) {
        Objects.requireNonNull(location, "location must not be null");
        Instant now = clock.instant();
        return update(workerId, state -> state.withLocation(location, now));
    }

    @Override
    public WorkerState setAvailability(UUID workerId, WorkerAvailability availability) {
        Objects.requireNonNull(availability, "availability must not be null");
        WorkerState updated = update(workerId, state -> state.withAvailability(availability));
        LOG.debug("Worker {} is now {}", workerId, availability);
        return updated;
    }

    @Override
    public WorkerState recordAssignment(UUID workerId, UUID taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return update(workerId, state -> state.withAssignedTask(taskId));
    }

    @Override
    public WorkerState recordRelease(UUID workerId, UUID taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return update(workerId, state -> state.withReleasedTask(taskId));
    }

    @Override
    public int markStaleOffline(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int marked = 0;
        lock.writeLock().lock();
        try {
            for (Map.Entry<UUID, WorkerState> entry : states.entrySet()) {
                WorkerState state = entry.getValue();
                if (state.isOnline() && state.getLastHeartbeat().isBefore(cutoff)) {
                    entry.setValue(state.withAvailability(WorkerAvailability.OFFLINE));
                    marked++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (marked > 0) {
            LOG.info("Marked {} workers offline after missed heartbeats", marked);
        }
        return marked;
    }

    @Override
    public Map<UUID, WorkerState> snapshot() {
        lock.readLock().lock();
        try {
            return Map.copyOf(states);
        } finally {
            lock.readLock().unlock();
        }
    }

    private WorkerState update(UUID workerId, UnaryOperator<WorkerState> change) {
        Objects.requireNonNull(workerId, "workerId must not be null");
        lock.writeLock().lock();
        try {
            WorkerState current = states.get(workerId);
            if (current == null) {
                current = WorkerState.initial(workerId, clock.instant());
            }
            WorkerState updated = change.apply(current);
            states.put(workerId, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
