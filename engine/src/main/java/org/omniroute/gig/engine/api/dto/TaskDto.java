package org.omniroute.gig.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.TaskStatus;
import org.omniroute.gig.engine.domain.model.TaskType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * DTO for a task served by the gig platform.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TaskDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("task_type")
    private String taskType;

    @JsonProperty("pickup")
    private AddressDto pickup;

    @JsonProperty("dropoff")
    private AddressDto dropoff;

    @JsonProperty("total_weight")
    private double totalWeight;

    @JsonProperty("collection_amount")
    private BigDecimal collectionAmount;

    @JsonProperty("status")
    private String status;

    @JsonProperty("assigned_worker_id")
    private String assignedWorkerId;

    @JsonProperty("accepted_at")
    private Instant acceptedAt;

    public Task toDomain() {
        return Task.builder()
                .id(UUID.fromString(id))
                .type(TaskType.fromCode(taskType))
                .pickup(pickup != null ? pickup.toDomain() : null)
                .dropoff(dropoff.toDomain())
                .totalWeight(totalWeight)
                .collectionAmount(collectionAmount)
                .status(TaskStatus.fromCode(status))
                .assignedWorkerId(assignedWorkerId != null ? UUID.fromString(assignedWorkerId) : null)
                .acceptedAt(acceptedAt)
                .build();
    }

    public static TaskDto from(Task task) {
        TaskDto dto = new TaskDto();
        dto.id = task.getId().toString();
        dto.taskType = task.getType().getCode();
        dto.pickup = AddressDto.from(task.getPickup());
        dto.dropoff = AddressDto.from(task.getDropoff());
        dto.totalWeight = task.getTotalWeight();
        dto.collectionAmount = task.getCollectionAmount();
        dto.status = task.getStatus().getCode();
        dto.assignedWorkerId = task.getAssignedWorkerId() != null ? task.getAssignedWorkerId().toString() : null;
        dto.acceptedAt = task.getAcceptedAt();
        return dto;
    }

    public String getId() {
        return id;
    }

    public String getStatus() {
        return status;
    }

    public String getAssignedWorkerId() {
        return assignedWorkerId;
    }
}
