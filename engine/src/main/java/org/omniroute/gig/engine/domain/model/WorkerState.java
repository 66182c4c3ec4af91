package org.omniroute.gig.engine.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable snapshot of a worker's live state. Never persisted.
 */
public final class WorkerState {

    private final UUID workerId;
    private final GeoPoint location;
    private final WorkerAvailability availability;
    private final int activeTaskCount;
    private final Instant lastHeartbeat;
    private final UUID currentTaskId;

    public WorkerState(UUID workerId, GeoPoint location, WorkerAvailability availability,
                       int activeTaskCount, Instant lastHeartbeat, UUID currentTaskId) {
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
        this.location = location;
        this.availability = Objects.requireNonNull(availability, "availability must not be null");
        if (activeTaskCount < 0) {
            throw new IllegalArgumentException("activeTaskCount must not be negative");
        }
        this.activeTaskCount = activeTaskCount;
        this.lastHeartbeat = Objects.requireNonNull(lastHeartbeat, "lastHeartbeat must not be null");
        this.currentTaskId = currentTaskId;
    }

    /**
     * State for a worker seen for the first time: offline, no location, no tasks.
     */
    public static WorkerState initial(UUID workerId, Instant now) {
        return new WorkerState(workerId, null, WorkerAvailability.OFFLINE, 0, now, null);
    }

    public UUID getWorkerId() {
        return workerId;
    }

    /**
     * @return last reported location, or null before the first heartbeat
     */
    public GeoPoint getLocation() {
        return location;
    }

    public WorkerAvailability getAvailability() {
        return availability;
    }

    public int getActiveTaskCount() {
        return activeTaskCount;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public UUID getCurrentTaskId() {
        return currentTaskId;
    }

    public boolean isOnline() {
        return availability == WorkerAvailability.ONLINE;
    }

    public WorkerState withLocation(GeoPoint newLocation, Instant heartbeat) {
        return new WorkerState(workerId, newLocation, availability, activeTaskCount, heartbeat, currentTaskId);
    }

    public WorkerState withAvailability(WorkerAvailability newAvailability) {
        return new WorkerState(workerId, location, newAvailability, activeTaskCount, lastHeartbeat, currentTaskId);
    }

    public WorkerState withAssignedTask(UUID taskId) {
        return new WorkerState(workerId, location, availability, activeTaskCount + 1, lastHeartbeat, taskId);
    }

    public WorkerState withReleasedTask(UUID taskId) {
        UUID remaining = Objects.equals(currentTaskId, taskId) ? null : currentTaskId;
        return new WorkerState(workerId, location, availability, Math.max(0, activeTaskCount - 1),
                lastHeartbeat, remaining);
    }

    @Override
    public String toString() {
        return "WorkerState{workerId=" + workerId +
                ", location=" + location +
                ", availability=" + availability +
                ", activeTaskCount=" + activeTaskCount +
                ", lastHeartbeat=" + lastHeartbeat +
                ", currentTaskId=" + currentTaskId +
                '}';
    }
}
