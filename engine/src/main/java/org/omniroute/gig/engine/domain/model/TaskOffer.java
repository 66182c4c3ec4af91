package org.omniroute.gig.engine.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Time-boxed proposal of a task to one worker.
 */
public final class TaskOffer {

    private final UUID id;
    private final UUID taskId;
    private final UUID workerId;
    private final Instant offeredAt;
    private final Instant expiresAt;
    private final Instant respondedAt;
    private final OfferStatus status;
    private final BigDecimal baseEarning;
    private final BigDecimal bonusEarning;
    private final int estimatedTimeMinutes;
    private final double distanceKm;
    private final String declineReason;

    private TaskOffer(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId must not be null");
        this.workerId = Objects.requireNonNull(builder.workerId, "workerId must not be null");
        this.offeredAt = Objects.requireNonNull(builder.offeredAt, "offeredAt must not be null");
        this.expiresAt = Objects.requireNonNull(builder.expiresAt, "expiresAt must not be null");
        this.respondedAt = builder.respondedAt;
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.baseEarning = builder.baseEarning != null ? builder.baseEarning : BigDecimal.ZERO;
        this.bonusEarning = builder.bonusEarning != null ? builder.bonusEarning : BigDecimal.ZERO;
        this.estimatedTimeMinutes = builder.estimatedTimeMinutes;
        this.distanceKm = builder.distanceKm;
        this.declineReason = builder.declineReason;
    }

    public UUID getId() {
        return id;
    }

    public UUID getTaskId() {
        return taskId;
    }

    public UUID getWorkerId() {
        return workerId;
    }

    public Instant getOfferedAt() {
        return offeredAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Instant getRespondedAt() {
        return respondedAt;
    }

    public OfferStatus getStatus() {
        return status;
    }

    public BigDecimal getBaseEarning() {
        return baseEarning;
    }

    public BigDecimal getBonusEarning() {
        return bonusEarning;
    }

    public BigDecimal getTotalEarning() {
        return baseEarning.add(bonusEarning);
    }

    public int getEstimatedTimeMinutes() {
        return estimatedTimeMinutes;
    }

    public double getDistanceKm() {
        return distanceKm;
    }

    public String getDeclineReason() {
        return declineReason;
    }

    public boolean isPending() {
        return status == OfferStatus.PENDING;
    }

    /**
     * Wall-clock expiry, independent of the stored status.
     */
    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .taskId(taskId)
                .workerId(workerId)
                .offeredAt(offeredAt)
                .expiresAt(expiresAt)
                .respondedAt(respondedAt)
                .status(status)
                .baseEarning(baseEarning)
                .bonusEarning(bonusEarning)
                .estimatedTimeMinutes(estimatedTimeMinutes)
                .distanceKm(distanceKm)
                .declineReason(declineReason);
    }

    @Override
    public String toString() {
        return String.format("TaskOffer{id=%s, task=%s, worker=%s, status=%s, expiresAt=%s}",
                id, taskId, workerId, status, expiresAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for TaskOffer.
     */
    public static final class Builder {
        private UUID id;
        private UUID taskId;
        private UUID workerId;
        private Instant offeredAt;
        private Instant expiresAt;
        private Instant respondedAt;
        private OfferStatus status = OfferStatus.PENDING;
        private BigDecimal baseEarning;
        private BigDecimal bonusEarning;
        private int estimatedTimeMinutes;
        private double distanceKm;
        private String declineReason;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder taskId(UUID taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder workerId(UUID workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder offeredAt(Instant offeredAt) {
            this.offeredAt = offeredAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder respondedAt(Instant respondedAt) {
            this.respondedAt = respondedAt;
            return this;
        }

        public Builder status(OfferStatus status) {
            this.status = status;
            return this;
        }

        public Builder baseEarning(BigDecimal baseEarning) {
            this.baseEarning = baseEarning;
            return this;
        }

        public Builder bonusEarning(BigDecimal bonusEarning) {
            this.bonusEarning = bonusEarning;
            return this;
        }

        public Builder estimatedTimeMinutes(int estimatedTimeMinutes) {
            this.estimatedTimeMinutes = estimatedTimeMinutes;
            return this;
        }

        public Builder distanceKm(double distanceKm) {
            this.distanceKm = distanceKm;
            return this;
        }

        public Builder declineReason(String declineReason) {
            this.declineReason = declineReason;
            return this;
        }

        public TaskOffer build() {
            return new TaskOffer(this);
        }
    }
}
