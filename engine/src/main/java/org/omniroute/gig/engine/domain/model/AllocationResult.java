package org.omniroute.gig.engine.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of a single allocation attempt.
 */
public final class AllocationResult {

    private final boolean success;
    private final UUID taskId;
    private final AllocationStrategy strategy;
    private final UUID workerId;
    private final UUID offerId;
    private final List<UUID> offerIds;
    private final List<UUID> candidateWorkerIds;
    private final int offersCreated;
    private final EarningEstimate earning;
    private final FailureReason failureReason;
    private final String message;

    private AllocationResult(Builder builder) {
        this.success = builder.success;
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId must not be null");
        this.strategy = Objects.requireNonNull(builder.strategy, "strategy must not be null");
        this.workerId = builder.workerId;
        this.offerId = builder.offerId;
        this.offerIds = List.copyOf(builder.offerIds);
        this.candidateWorkerIds = List.copyOf(builder.candidateWorkerIds);
        this.offersCreated = builder.offersCreated;
        this.earning = builder.earning;
        this.failureReason = builder.failureReason;
        this.message = builder.message;
    }

    public static AllocationResult failure(UUID taskId, AllocationStrategy strategy,
                                           FailureReason reason, String message) {
        return new Builder()
                .success(false)
                .taskId(taskId)
                .strategy(strategy)
                .failureReason(reason)
                .message(message)
                .build();
    }

    public boolean isSuccess() {
        return success;
    }

    public UUID getTaskId() {
        return taskId;
    }

    public AllocationStrategy getStrategy() {
        return strategy;
    }

    /**
     * @return the offered worker for single-offer strategies, else null
     */
    public UUID getWorkerId() {
        return workerId;
    }

    /**
     * @return the created offer for single-offer strategies, else null
     */
    public UUID getOfferId() {
        return offerId;
    }

    public List<UUID> getOfferIds() {
        return offerIds;
    }

    public List<UUID> getCandidateWorkerIds() {
        return candidateWorkerIds;
    }

    public int getOffersCreated() {
        return offersCreated;
    }

    public EarningEstimate getEarning() {
        return earning;
    }

    public FailureReason getFailureReason() {
        return failureReason;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "AllocationResult{success=" + success +
                ", taskId=" + taskId +
                ", strategy=" + strategy +
                ", offersCreated=" + offersCreated +
                (failureReason != null ? ", failureReason=" + failureReason : "") +
                (message != null ? ", message='" + message + '\'' : "") +
                '}';
    }

    /**
     * Builder for AllocationResult.
     */
    public static final class Builder {
        private boolean success;
        private UUID taskId;
        private AllocationStrategy strategy;
        private UUID workerId;
        private UUID offerId;
        private List<UUID> offerIds = Collections.emptyList();
        private List<UUID> candidateWorkerIds = Collections.emptyList();
        private int offersCreated;
        private EarningEstimate earning;
        private FailureReason failureReason;
        private String message;

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder taskId(UUID taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder strategy(AllocationStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder workerId(UUID workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder offerId(UUID offerId) {
            this.offerId = offerId;
            return this;
        }

        public Builder offerIds(List<UUID> offerIds) {
            this.offerIds = Objects.requireNonNull(offerIds, "offerIds must not be null");
            return this;
        }

        public Builder candidateWorkerIds(List<UUID> candidateWorkerIds) {
            this.candidateWorkerIds = Objects.requireNonNull(candidateWorkerIds, "candidateWorkerIds must not be null");
            return this;
        }

        public Builder offersCreated(int offersCreated) {
            this.offersCreated = offersCreated;
            return this;
        }

        public Builder earning(EarningEstimate earning) {
            this.earning = earning;
            return this;
        }

        public Builder failureReason(FailureReason failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public AllocationResult build() {
            return new AllocationResult(this);
        }
    }
}
