package org.omniroute.gig.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.omniroute.gig.engine.domain.model.OfferStatus;
import org.omniroute.gig.engine.domain.model.TaskOffer;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * DTO for a task offer, used in both directions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class OfferDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("task_id")
    private String taskId;

    @JsonProperty("worker_id")
    private String workerId;

    @JsonProperty("offered_at")
    private Instant offeredAt;

    @JsonProperty("expires_at")
    private Instant expiresAt;

    @JsonProperty("responded_at")
    private Instant respondedAt;

    @JsonProperty("status")
    private String status;

    @JsonProperty("base_earning")
    private BigDecimal baseEarning;

    @JsonProperty("bonus_earning")
    private BigDecimal bonusEarning;

    @JsonProperty("estimated_time_minutes")
    private int estimatedTimeMinutes;

    @JsonProperty("distance_km")
    private double distanceKm;

    @JsonProperty("decline_reason")
    private String declineReason;

    public TaskOffer toDomain() {
        return TaskOffer.builder()
                .id(UUID.fromString(id))
                .taskId(UUID.fromString(taskId))
                .workerId(UUID.fromString(workerId))
                .offeredAt(offeredAt)
                .expiresAt(expiresAt)
                .respondedAt(respondedAt)
                .status(OfferStatus.fromCode(status))
                .baseEarning(baseEarning)
                .bonusEarning(bonusEarning)
                .estimatedTimeMinutes(estimatedTimeMinutes)
                .distanceKm(distanceKm)
                .declineReason(declineReason)
                .build();
    }

    public static OfferDto from(TaskOffer offer) {
        OfferDto dto = new OfferDto();
        dto.id = offer.getId().toString();
        dto.taskId = offer.getTaskId().toString();
        dto.workerId = offer.getWorkerId().toString();
        dto.offeredAt = offer.getOfferedAt();
        dto.expiresAt = offer.getExpiresAt();
        dto.respondedAt = offer.getRespondedAt();
        dto.status = offer.getStatus().getCode();
        dto.baseEarning = offer.getBaseEarning();
        dto.bonusEarning = offer.getBonusEarning();
        dto.estimatedTimeMinutes = offer.getEstimatedTimeMinutes();
        dto.distanceKm = offer.getDistanceKm();
        dto.declineReason = offer.getDeclineReason();
        return dto;
    }

    public String getId() {
        return id;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getStatus() {
        return status;
    }
}
