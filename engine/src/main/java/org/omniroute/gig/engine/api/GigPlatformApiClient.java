package org.omniroute.gig.engine.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import okhttp3.OkHttpClient;
import org.omniroute.gig.engine.api.dto.OfferDto;
import org.omniroute.gig.engine.api.dto.TaskDto;
import org.omniroute.gig.engine.api.dto.WorkerDto;
import org.omniroute.gig.engine.domain.model.GeoPoint;
import org.omniroute.gig.engine.domain.model.GigWorker;
import org.omniroute.gig.engine.domain.model.OfferStatus;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.TaskOffer;
import org.omniroute.gig.engine.domain.model.TaskStatus;
import org.omniroute.gig.engine.domain.model.WorkerType;
import org.omniroute.gig.engine.spi.OfferRepository;
import org.omniroute.gig.engine.spi.TaskRepository;
import org.omniroute.gig.engine.spi.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.http.Body;
import retrofit2.http.GET;
import retrofit2.http.PATCH;
import retrofit2.http.POST;
import retrofit2.http.Path;
import retrofit2.http.Query;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Retrofit-based client of the gig platform REST API.
 * Exposes the worker, task and offer repositories. The platform answers 409 when a conditional update loses.
 */
public final class GigPlatformApiClient {

    private static final Logger LOG = LoggerFactory.getLogger(GigPlatformApiClient.class);

    private final GigPlatformApi api;
    private final WorkerRepository workers = new Workers();
    private final TaskRepository tasks = new Tasks();
    private final OfferRepository offers = new Offers();

    public GigPlatformApiClient(String baseUrl) {
        this(baseUrl, ApiSupport.httpClient());
    }

    public GigPlatformApiClient(String baseUrl, OkHttpClient client) {
        this.api = ApiSupport.create(baseUrl, client, GigPlatformApi.class);
        LOG.info("Gig platform client configured for: {}", baseUrl);
    }

    public WorkerRepository workers() {
        return workers;
    }

    public TaskRepository tasks() {
        return tasks;
    }

    public OfferRepository offers() {
        return offers;
    }

    private final class Workers implements WorkerRepository {

        @Override
        public Optional<GigWorker> findById(UUID workerId) {
            return findOptional(api.getWorker(workerId.toString()), "GET /v1/workers/{id}")
                    .map(WorkerDto::toDomain);
        }

        @Override
        public List<GigWorker> findOnlineWithinRadius(GeoPoint center, double radiusKm, Set<WorkerType> types) {
            String typeCodes = types.stream().map(WorkerType::getCode).sorted().collect(Collectors.joining(","));
            List<WorkerDto> dtos = ApiSupport.execute(
                    api.findNearbyWorkers(center.getLatitude(), center.getLongitude(), radiusKm, typeCodes),
                    "GET /v1/workers/nearby");
            List<GigWorker> result = new ArrayList<>();
            if (dtos == null) {
                return result;
            }
            for (WorkerDto dto : dtos) {
                result.add(dto.toDomain());
            }
            LOG.debug("Found {} online workers within {}km of {}", result.size(), radiusKm, center);
            return result;
        }
    }

    private final class Tasks implements TaskRepository {

        @Override
        public Optional<Task> findById(UUID taskId) {
            return findOptional(api.getTask(taskId.toString()), "GET /v1/tasks/{id}").map(TaskDto::toDomain);
        }

        @Override
        public void updateStatus(UUID taskId, TaskStatus status) {
            ApiSupport.execute(api.updateTaskStatus(taskId.toString(),
                    new StatusRequest(status.getCode(), null, null)), "PATCH /v1/tasks/{id}/status");
        }

        @Override
        public boolean assignWorker(UUID taskId, UUID workerId) {
            return conditional(api.assignTask(taskId.toString(), new WorkerRequest(workerId.toString())),
                    "POST /v1/tasks/{id}/assign");
        }

        @Override
        public boolean releaseAssignment(UUID taskId, UUID workerId) {
            return conditional(api.releaseTask(taskId.toString(), new WorkerRequest(workerId.toString())),
                    "POST /v1/tasks/{id}/release");
        }
    }

    private final class Offers implements OfferRepository {

        @Override
        public void create(TaskOffer offer) {
            ApiSupport.execute(api.createOffer(OfferDto.from(offer)), "POST /v1/offers");
        }

        @Override
        public Optional<TaskOffer> findById(UUID offerId) {
            return findOptional(api.getOffer(offerId.toString()), "GET /v1/offers/{id}").map(OfferDto::toDomain);
        }

        @Override
        public List<TaskOffer> findActiveForTask(UUID taskId) {
            return toOffers(ApiSupport.execute(api.getTaskOffers(taskId.toString(), OfferStatus.PENDING.getCode()),
                    "GET /v1/tasks/{id}/offers"));
        }

        @Override
        public List<TaskOffer> findActiveForWorker(UUID workerId) {
            return toOffers(ApiSupport.execute(api.getWorkerOffers(workerId.toString(), OfferStatus.PENDING.getCode()),
                    "GET /v1/workers/{id}/offers"));
        }

        @Override
        public boolean updateStatus(UUID offerId, OfferStatus expected, OfferStatus target, String reason) {
            StatusRequest request = new StatusRequest(target.getCode(), expected.getCode(), reason);
            return conditional(api.updateOfferStatus(offerId.toString(), request), "PATCH /v1/offers/{id}/status");
        }

        @Override
        public int expireStale(Instant now) {
            ExpireResponse response = ApiSupport.execute(api.expireOffers(new ExpireRequest(now)),
                    "POST /v1/offers/expire");
            return response != null ? response.getExpired() : 0;
        }
    }

    private static <T> Optional<T> findOptional(Call<T> call, String description) {
        Response<T> response = ApiSupport.send(call, description);
        if (response.code() == ApiSupport.NOT_FOUND) {
            return Optional.empty();
        }
        if (!response.isSuccessful()) {
            throw ApiSupport.failure(response, description);
        }
        return Optional.ofNullable(response.body());
    }

    private static boolean conditional(Call<Void> call, String description) {
        Response<Void> response = ApiSupport.send(call, description);
        if (response.code() == ApiSupport.CONFLICT) {
            LOG.debug("[API] {} lost a conditional update", description);
            return false;
        }
        if (!response.isSuccessful()) {
            throw ApiSupport.failure(response, description);
        }
        return true;
    }

    private static List<TaskOffer> toOffers(List<OfferDto> dtos) {
        List<TaskOffer> offers = new ArrayList<>();
        if (dtos != null) {
            for (OfferDto dto : dtos) {
                offers.add(dto.toDomain());
            }
        }
        return offers;
    }

    /**
     * Retrofit service interface for the gig platform API.
     */
    interface GigPlatformApi {
        @GET("v1/workers/{workerId}")
        Call<WorkerDto> getWorker(@Path("workerId") String workerId);

        @GET("v1/workers/nearby")
        Call<List<WorkerDto>> findNearbyWorkers(@Query("lat") double lat, @Query("lon") double lon,
                                                @Query("radius_km") double radiusKm, @Query("types") String types);

        @GET("v1/tasks/{taskId}")
        Call<TaskDto> getTask(@Path("taskId") String taskId);

        @PATCH("v1/tasks/{taskId}/status")
        Call<Void> updateTaskStatus(@Path("taskId") String taskId, @Body StatusRequest request);

        @POST("v1/tasks/{taskId}/assign")
        Call<Void> assignTask(@Path("taskId") String taskId, @Body WorkerRequest request);

        @POST("v1/tasks/{taskId}/release")
        Call<Void> releaseTask(@Path("taskId") String taskId, @Body WorkerRequest request);

        @POST("v1/offers")
        Call<Void> createOffer(@Body OfferDto offer);

        @GET("v1/offers/{offerId}")
        Call<OfferDto> getOffer(@Path("offerId") String offerId);

        @GET("v1/tasks/{taskId}/offers")
        Call<List<OfferDto>> getTaskOffers(@Path("taskId") String taskId, @Query("status") String status);

        @GET("v1/workers/{workerId}/offers")
        Call<List<OfferDto>> getWorkerOffers(@Path("workerId") String workerId, @Query("status") String status);

        @PATCH("v1/offers/{offerId}/status")
        Call<Void> updateOfferStatus(@Path("offerId") String offerId, @Body StatusRequest request);

        @POST("v1/offers/expire")
        Call<ExpireResponse> expireOffers(@Body ExpireRequest request);
    }

    /**
     * Request DTO for status transitions. {@code expected_status} makes the update conditional.
     */
    static final class StatusRequest {
        @JsonProperty("status")
        private final String status;

        @JsonProperty("expected_status")
        private final String expectedStatus;

        @JsonProperty("reason")
        private final String reason;

        StatusRequest(String status, String expectedStatus, String reason) {
            this.status = status;
            this.expectedStatus = expectedStatus;
            this.reason = reason;
        }
    }

    /**
     * Request DTO naming a worker.
     */
    static final class WorkerRequest {
        @JsonProperty("worker_id")
        private final String workerId;

        WorkerRequest(String workerId) {
            this.workerId = workerId;
        }
    }

    /**
     * Request DTO for the expiry sweep.
     */
    static final class ExpireRequest {
        @JsonProperty("now")
        private final Instant now;

        ExpireRequest(Instant now) {
            this.now = now;
        }
    }

    /**
     * Response DTO of the expiry sweep.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class ExpireResponse {
        @JsonProperty("expired")
        private int expired;

        public int getExpired() {
            return expired;
        }
    }
}
