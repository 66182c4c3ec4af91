package org.omniroute.gig.engine.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Unit of field work created upstream in {@link TaskStatus#PENDING}.
 */
public final class Task {

    private final UUID id;
    private final TaskType type;
    private final Address pickup;
    private final Address dropoff;
    private final double totalWeight;
    private final BigDecimal collectionAmount;
    private final TaskStatus status;
    private final UUID assignedWorkerId;
    private final Instant acceptedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.pickup = builder.pickup;
        this.dropoff = Objects.requireNonNull(builder.dropoff, "dropoff must not be null");
        this.totalWeight = builder.totalWeight;
        this.collectionAmount = builder.collectionAmount != null ? builder.collectionAmount : BigDecimal.ZERO;
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.assignedWorkerId = builder.assignedWorkerId;
        this.acceptedAt = builder.acceptedAt;
    }

    public UUID getId() {
        return id;
    }

    public TaskType getType() {
        return type;
    }

    public Address getPickup() {
        return pickup;
    }

    public Address getDropoff() {
        return dropoff;
    }

    /**
     * Location workers are matched against: the pickup when present, else the dropoff.
     */
    public GeoPoint getEffectiveLocation() {
        return pickup != null ? pickup.getLocation() : dropoff.getLocation();
    }

    public double getTotalWeight() {
        return totalWeight;
    }

    public BigDecimal getCollectionAmount() {
        return collectionAmount;
    }

    public boolean requiresCashCollection() {
        return collectionAmount.signum() > 0;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public UUID getAssignedWorkerId() {
        return assignedWorkerId;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .pickup(pickup)
                .dropoff(dropoff)
                .totalWeight(totalWeight)
                .collectionAmount(collectionAmount)
                .status(status)
                .assignedWorkerId(assignedWorkerId)
                .acceptedAt(acceptedAt);
    }

    @Override
    public String toString() {
        return String.format("Task{id=%s, type=%s, status=%s, weight=%.1f}", id, type, status, totalWeight);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Task.
     */
    public static final class Builder {
        private UUID id;
        private TaskType type;
        private Address pickup;
        private Address dropoff;
        private double totalWeight;
        private BigDecimal collectionAmount;
        private TaskStatus status = TaskStatus.PENDING;
        private UUID assignedWorkerId;
        private Instant acceptedAt;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder type(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder pickup(Address pickup) {
            this.pickup = pickup;
            return this;
        }

        public Builder dropoff(Address dropoff) {
            this.dropoff = dropoff;
            return this;
        }

        public Builder totalWeight(double totalWeight) {
            if (totalWeight < 0) {
                throw new IllegalArgumentException("totalWeight must not be negative");
            }
            this.totalWeight = totalWeight;
            return this;
        }

        public Builder collectionAmount(BigDecimal collectionAmount) {
            this.collectionAmount = collectionAmount;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder assignedWorkerId(UUID assignedWorkerId) {
            this.assignedWorkerId = assignedWorkerId;
            return this;
        }

        public Builder acceptedAt(Instant acceptedAt) {
            this.acceptedAt = acceptedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }
}
