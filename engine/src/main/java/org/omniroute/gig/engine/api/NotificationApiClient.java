package org.omniroute.gig.engine.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import okhttp3.OkHttpClient;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.TaskOffer;
import org.omniroute.gig.engine.spi.WorkerNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.http.Body;
import retrofit2.http.POST;
import retrofit2.http.Path;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Retrofit-based client of the push notification service.
 */
public final class NotificationApiClient implements WorkerNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationApiClient.class);

    private final NotificationApi api;

    public NotificationApiClient(String baseUrl) {
        this(baseUrl, ApiSupport.httpClient());
    }

    public NotificationApiClient(String baseUrl, OkHttpClient client) {
        this.api = ApiSupport.create(baseUrl, client, NotificationApi.class);
        LOG.info("Notification client configured for: {}", baseUrl);
    }

    @Override
    public void sendTaskOffer(UUID workerId, TaskOffer offer, Task task) {
        ApiSupport.execute(api.sendOffer(workerId.toString(), new OfferNotification(offer, task)),
                "POST /v1/notifications/workers/{id}/offers");
        LOG.debug("Pushed offer {} to worker {}", offer.getId(), workerId);
    }

    @Override
    public void sendTaskUpdate(UUID workerId, Task task, String message) {
        ApiSupport.execute(api.sendTaskUpdate(workerId.toString(), new TaskUpdateNotification(task, message)),
                "POST /v1/notifications/workers/{id}/task-updates");
        LOG.debug("Pushed update of task {} to worker {}", task.getId(), workerId);
    }

    interface NotificationApi {
        @POST("v1/notifications/workers/{workerId}/offers")
        Call<Void> sendOffer(@Path("workerId") String workerId, @Body OfferNotification body);

        @POST("v1/notifications/workers/{workerId}/task-updates")
        Call<Void> sendTaskUpdate(@Path("workerId") String workerId, @Body TaskUpdateNotification body);
    }

    static final class OfferNotification {
        @JsonProperty("offer_id")
        private final String offerId;
        @JsonProperty("task_id")
        private final String taskId;
        @JsonProperty("task_type")
        private final String taskType;
        @JsonProperty("pickup_address")
        private final String pickupAddress;
        @JsonProperty("dropoff_address")
        private final String dropoffAddress;
        @JsonProperty("total_earning")
        private final BigDecimal totalEarning;
        @JsonProperty("distance_km")
        private final double distanceKm;
        @JsonProperty("estimated_time_minutes")
        private final int estimatedTimeMinutes;
        @JsonProperty("expires_at")
        private final Instant expiresAt;

        OfferNotification(TaskOffer offer, Task task) {
            this.offerId = offer.getId().toString();
            this.taskId = task.getId().toString();
            this.taskType = task.getType().getCode();
            this.pickupAddress = task.getPickup() != null ? task.getPickup().getLine() : null;
            this.dropoffAddress = task.getDropoff().getLine();
            this.totalEarning = offer.getTotalEarning();
            this.distanceKm = offer.getDistanceKm();
            this.estimatedTimeMinutes = offer.getEstimatedTimeMinutes();
            this.expiresAt = offer.getExpiresAt();
        }
    }

    static final class TaskUpdateNotification {
        @JsonProperty("task_id")
        private final String taskId;
        @JsonProperty("status")
        private final String status;
        @JsonProperty("message")
        private final String message;

        TaskUpdateNotification(Task task, String message) {
            this.taskId = task.getId().toString();
            this.status = task.getStatus().getCode();
            this.message = message;
        }
    }
}
