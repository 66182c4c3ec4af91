package org.omniroute.gig.engine.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Read-only profile of a gig worker as served by the worker-profile service.
 */
public final class GigWorker {

    private final UUID id;
    private final String name;
    private final WorkerType type;
    private final WorkerStatus status;
    private final VerificationStatus verificationStatus;
    private final double rating;
    private final int completedTasks;
    private final double acceptanceRate;
    private final double onTimeRate;
    private final Vehicle vehicle;
    private final TaskPreferences taskPreferences;

    private GigWorker(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = builder.name;
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.verificationStatus = Objects.requireNonNull(builder.verificationStatus,
                "verificationStatus must not be null");
        this.rating = builder.rating;
        this.completedTasks = builder.completedTasks;
        this.acceptanceRate = builder.acceptanceRate;
        this.onTimeRate = builder.onTimeRate;
        this.vehicle = builder.vehicle;
        this.taskPreferences = builder.taskPreferences != null ? builder.taskPreferences : TaskPreferences.none();
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public WorkerType getType() {
        return type;
    }

    public WorkerStatus getStatus() {
        return status;
    }

    public VerificationStatus getVerificationStatus() {
        return verificationStatus;
    }

    public double getRating() {
        return rating;
    }

    public int getCompletedTasks() {
        return completedTasks;
    }

    public double getAcceptanceRate() {
        return acceptanceRate;
    }

    public double getOnTimeRate() {
        return onTimeRate;
    }

    /**
     * @return the registered vehicle, or null for walkers and unregistered workers
     */
    public Vehicle getVehicle() {
        return vehicle;
    }

    public TaskPreferences getTaskPreferences() {
        return taskPreferences;
    }

    @Override
    public String toString() {
        return String.format("GigWorker{id=%s, type=%s, rating=%.2f, completed=%d}",
                id, type, rating, completedTasks);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for GigWorker.
     */
    public static final class Builder {
        private UUID id;
        private String name;
        private WorkerType type;
        private WorkerStatus status = WorkerStatus.ACTIVE;
        private VerificationStatus verificationStatus = VerificationStatus.PENDING;
        private double rating;
        private int completedTasks;
        private double acceptanceRate;
        private double onTimeRate;
        private Vehicle vehicle;
        private TaskPreferences taskPreferences;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(WorkerType type) {
            this.type = type;
            return this;
        }

        public Builder status(WorkerStatus status) {
            this.status = status;
            return this;
        }

        public Builder verificationStatus(VerificationStatus verificationStatus) {
            this.verificationStatus = verificationStatus;
            return this;
        }

        public Builder rating(double rating) {
            if (rating < 0.0 || rating > 5.0) {
                throw new IllegalArgumentException("rating must be between 0 and 5");
            }
            this.rating = rating;
            return this;
        }

        public Builder completedTasks(int completedTasks) {
            if (completedTasks < 0) {
                throw new IllegalArgumentException("completedTasks must not be negative");
            }
            this.completedTasks = completedTasks;
            return this;
        }

        public Builder acceptanceRate(double acceptanceRate) {
            this.acceptanceRate = requireRate(acceptanceRate, "acceptanceRate");
            return this;
        }

        public Builder onTimeRate(double onTimeRate) {
            this.onTimeRate = requireRate(onTimeRate, "onTimeRate");
            return this;
        }

        public Builder vehicle(Vehicle vehicle) {
            this.vehicle = vehicle;
            return this;
        }

        public Builder taskPreferences(TaskPreferences taskPreferences) {
            this.taskPreferences = taskPreferences;
            return this;
        }

        public GigWorker build() {
            return new GigWorker(this);
        }

        private static double requireRate(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0 and 1");
            }
            return value;
        }
    }
}
