package org.omniroute.gig.engine.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import okhttp3.OkHttpClient;
import org.omniroute.gig.engine.domain.model.EarningEstimate;
import org.omniroute.gig.engine.domain.model.GigWorker;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.spi.CollaboratorException;
import org.omniroute.gig.engine.spi.EarningCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.http.Body;
import retrofit2.http.POST;

import java.math.BigDecimal;

/**
 * Retrofit-based client of the pricing engine.
 */
public final class PricingApiClient implements EarningCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(PricingApiClient.class);

    private final PricingApi api;

    public PricingApiClient(String baseUrl) {
        this(baseUrl, ApiSupport.httpClient());
    }

    public PricingApiClient(String baseUrl, OkHttpClient client) {
        this.api = ApiSupport.create(baseUrl, client, PricingApi.class);
        LOG.info("Pricing client configured for: {}", baseUrl);
    }

    @Override
    public EarningEstimate calculate(Task task, GigWorker worker, double distanceKm) {
        EstimateRequest request = new EstimateRequest(task, worker, distanceKm);
        EstimateResponse body = ApiSupport.execute(api.estimate(request), "POST /v1/pricing/estimate");
        if (body == null || body.totalEarning == null) {
            throw new CollaboratorException("Pricing returned no estimate for task " + task.getId());
        }
        return EarningEstimate.builder()
                .baseEarning(body.baseEarning)
                .distanceEarning(body.distanceEarning)
                .weightEarning(body.weightEarning)
                .timeEarning(body.timeEarning)
                .surgeMultiplier(body.surgeMultiplier)
                .bonusEarning(body.bonusEarning)
                .totalEarning(body.totalEarning)
                .build();
    }

    interface PricingApi {
        @POST("v1/pricing/estimate")
        Call<EstimateResponse> estimate(@Body EstimateRequest request);
    }

    static final class EstimateRequest {
        @JsonProperty("task_id")
        private final String taskId;
        @JsonProperty("task_type")
        private final String taskType;
        @JsonProperty("worker_id")
        private final String workerId;
        @JsonProperty("worker_type")
        private final String workerType;
        @JsonProperty("distance_km")
        private final double distanceKm;
        @JsonProperty("weight_kg")
        private final double weightKg;
        @JsonProperty("collection_amount")
        private final BigDecimal collectionAmount;

        EstimateRequest(Task task, GigWorker worker, double distanceKm) {
            this.taskId = task.getId().toString();
            this.taskType = task.getType().getCode();
            this.workerId = worker.getId().toString();
            this.workerType = worker.getType().getCode();
            this.distanceKm = distanceKm;
            this.weightKg = task.getTotalWeight();
            this.collectionAmount = task.getCollectionAmount();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class EstimateResponse {
        @JsonProperty("base_earning")
        private BigDecimal baseEarning;
        @JsonProperty("distance_earning")
        private BigDecimal distanceEarning;
        @JsonProperty("weight_earning")
        private BigDecimal weightEarning;
        @JsonProperty("time_earning")
        private BigDecimal timeEarning;
        @JsonProperty("surge_multiplier")
        private BigDecimal surgeMultiplier;
        @JsonProperty("bonus_earning")
        private BigDecimal bonusEarning;
        @JsonProperty("total_earning")
        private BigDecimal totalEarning;
    }
}
