package org.omniroute.gig.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.omniroute.gig.engine.domain.model.GigWorker;
import org.omniroute.gig.engine.domain.model.TaskPreferences;
import org.omniroute.gig.engine.domain.model.TaskType;
import org.omniroute.gig.engine.domain.model.Vehicle;
import org.omniroute.gig.engine.domain.model.VerificationStatus;
import org.omniroute.gig.engine.domain.model.WorkerStatus;
import org.omniroute.gig.engine.domain.model.WorkerType;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * DTO for a worker profile served by the gig platform.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkerDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("worker_type")
    private String workerType;

    @JsonProperty("status")
    private String status;

    @JsonProperty("verification_status")
    private String verificationStatus;

    @JsonProperty("rating")
    private double rating;

    @JsonProperty("completed_tasks")
    private int completedTasks;

    @JsonProperty("acceptance_rate")
    private double acceptanceRate;

    @JsonProperty("on_time_rate")
    private double onTimeRate;

    @JsonProperty("vehicle")
    private VehicleDto vehicle;

    @JsonProperty("task_preferences")
    private PreferencesDto taskPreferences;

    public GigWorker toDomain() {
        GigWorker.Builder builder = GigWorker.builder()
                .id(UUID.fromString(id))
                .name(name)
                .type(WorkerType.fromCode(workerType))
                .rating(rating)
                .completedTasks(completedTasks)
                .acceptanceRate(acceptanceRate)
                .onTimeRate(onTimeRate);
        if (status != null) {
            builder.status(WorkerStatus.fromCode(status));
        }
        if (verificationStatus != null) {
            builder.verificationStatus(VerificationStatus.fromCode(verificationStatus));
        }
        if (vehicle != null) {
            builder.vehicle(new Vehicle(vehicle.type, vehicle.capacityKg));
        }
        if (taskPreferences != null) {
            builder.taskPreferences(taskPreferences.toDomain());
        }
        return builder.build();
    }

    public String getId() {
        return id;
    }

    public String getWorkerType() {
        return workerType;
    }

    /**
     * Nested vehicle DTO.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class VehicleDto {
        @JsonProperty("type")
        private String type;

        @JsonProperty("capacity_kg")
        private double capacityKg;
    }

    /**
     * Nested preferences DTO.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PreferencesDto {
        @JsonProperty("preferred_task_types")
        private List<String> preferredTaskTypes;

        @JsonProperty("accept_cod")
        private boolean acceptCod;

        TaskPreferences toDomain() {
            Set<TaskType> types = EnumSet.noneOf(TaskType.class);
            if (preferredTaskTypes != null) {
                for (String code : preferredTaskTypes) {
                    types.add(TaskType.fromCode(code));
                }
            }
            return new TaskPreferences(types, acceptCod);
        }
    }
}
