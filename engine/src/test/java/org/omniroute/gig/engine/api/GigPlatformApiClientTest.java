package org.omniroute.gig.engine.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.omniroute.gig.engine.domain.model.GigWorker;
import org.omniroute.gig.engine.domain.model.OfferStatus;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.TaskOffer;
import org.omniroute.gig.engine.domain.model.TaskStatus;
import org.omniroute.gig.engine.domain.model.TaskType;
import org.omniroute.gig.engine.domain.model.VerificationStatus;
import org.omniroute.gig.engine.domain.model.WorkerType;
import org.omniroute.gig.engine.spi.CollaboratorException;
import org.omniroute.gig.engine.support.TestData;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GigPlatformApiClientTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private StubHttpServer stub;
    private GigPlatformApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        stub = new StubHttpServer();
        client = new GigPlatformApiClient(stub.baseUrl());
    }

    @AfterEach
    void tearDown() {
        stub.close();
    }

    private static String workerJson(UUID id) {
        return "{\"id\":\"" + id + "\",\"name\":\"Ada\",\"worker_type\":\"rider\",\"status\":\"active\","
                + "\"verification_status\":\"approved\",\"rating\":4.6,\"completed_tasks\":120,"
                + "\"acceptance_rate\":0.9,\"on_time_rate\":0.95,\"shift\":\"morning\","
                + "\"vehicle\":{\"type\":\"motorcycle\",\"capacity_kg\":25},"
                + "\"task_preferences\":{\"preferred_task_types\":[\"delivery\"],\"accept_cod\":true}}";
    }

    private static String offerJson(UUID id, UUID taskId, UUID workerId) {
        return "{\"id\":\"" + id + "\",\"task_id\":\"" + taskId + "\",\"worker_id\":\"" + workerId + "\","
                + "\"offered_at\":\"2026-03-01T09:00:00Z\",\"expires_at\":\"2026-03-01T09:01:00Z\","
                + "\"status\":\"pending\",\"base_earning\":1200,\"bonus_earning\":300,"
                + "\"estimated_time_minutes\":9,\"distance_km\":2.5}";
    }

    @Test
    void findsWorkerProfile() {
        UUID workerId = UUID.randomUUID();
        stub.respond("GET", "/v1/workers/" + workerId, 200, workerJson(workerId));

        GigWorker worker = client.workers().findById(workerId).orElseThrow();

        assertEquals(workerId, worker.getId());
        assertEquals(WorkerType.RIDER, worker.getType());
        assertEquals(VerificationStatus.APPROVED, worker.getVerificationStatus());
        assertEquals(120, worker.getCompletedTasks());
        assertEquals(25.0, worker.getVehicle().getCapacityKg());
        assertTrue(worker.getTaskPreferences().isAcceptCod());
        assertTrue(worker.getTaskPreferences().accepts(TaskType.DELIVERY));
        assertFalse(worker.getTaskPreferences().accepts(TaskType.SURVEY));
    }

    @Test
    void missingResourcesAreEmpty() {
        assertTrue(client.workers().findById(UUID.randomUUID()).isEmpty());
        assertTrue(client.tasks().findById(UUID.randomUUID()).isEmpty());
        assertTrue(client.offers().findById(UUID.randomUUID()).isEmpty());
    }

    @Test
    void nearbySearchSendsSortedTypeCodes() {
        UUID workerId = UUID.randomUUID();
        stub.respond("GET", "/v1/workers/nearby", 200, "[" + workerJson(workerId) + "]");

        List<GigWorker> workers = client.workers().findOnlineWithinRadius(TestData.LAGOS, 10.0,
                EnumSet.of(WorkerType.RIDER, WorkerType.DRIVER));

        assertEquals(1, workers.size());
        String query = stub.lastRequest().query;
        assertTrue(query.contains("types=driver,rider"), query);
        assertTrue(query.contains("radius_km=10.0"), query);
        assertTrue(query.contains("lat=6.5244"), query);
    }

    @Test
    void mapsTaskWithAddresses() {
        UUID taskId = UUID.randomUUID();
        stub.respond("GET", "/v1/tasks/" + taskId, 200, "{\"id\":\"" + taskId + "\",\"task_type\":\"delivery\","
                + "\"pickup\":{\"address\":\"12 Marina Rd\",\"lat\":6.45,\"lon\":3.39},"
                + "\"dropoff\":{\"address\":\"4 Allen Ave\",\"lat\":6.60,\"lon\":3.35},"
                + "\"total_weight\":4.5,\"collection_amount\":2500,\"status\":\"offered\"}");

        Task task = client.tasks().findById(taskId).orElseThrow();

        assertEquals(TaskStatus.OFFERED, task.getStatus());
        assertEquals(6.45, task.getEffectiveLocation().getLatitude());
        assertTrue(task.requiresCashCollection());
        assertNull(task.getAssignedWorkerId());
    }

    @Test
    void assignmentOutcomeFollowsStatusCode() throws IOException {
        UUID taskId = UUID.randomUUID();
        UUID workerId = UUID.randomUUID();
        String path = "/v1/tasks/" + taskId + "/assign";

        stub.respond("POST", path, 200, "");
        assertTrue(client.tasks().assignWorker(taskId, workerId));
        JsonNode body = mapper.readTree(stub.lastRequest().body);
        assertEquals(workerId.toString(), body.get("worker_id").asText());

        stub.respond("POST", path, 409, "{\"error\":\"task already assigned\"}");
        assertFalse(client.tasks().assignWorker(taskId, workerId));

        stub.respond("POST", path, 500, "");
        assertThrows(CollaboratorException.class, () -> client.tasks().assignWorker(taskId, workerId));
    }

    @Test
    void offerStatusUpdateIsConditional() throws IOException {
        UUID offerId = UUID.randomUUID();
        stub.respond("PATCH", "/v1/offers/" + offerId + "/status", 204, "");

        assertTrue(client.offers().updateStatus(offerId, OfferStatus.PENDING, OfferStatus.DECLINED, "too far"));

        StubHttpServer.Recorded request = stub.lastRequest();
        assertEquals("PATCH", request.method);
        JsonNode body = mapper.readTree(request.body);
        assertEquals("declined", body.get("status").asText());
        assertEquals("pending", body.get("expected_status").asText());
        assertEquals("too far", body.get("reason").asText());
    }

    @Test
    void createsOfferWithIsoTimestamps() throws IOException {
        stub.respond("POST", "/v1/offers", 201, "");
        TaskOffer offer = TestData.pendingOffer(UUID.randomUUID(), UUID.randomUUID(), NOW, 60)
                .baseEarning(new BigDecimal("1500"))
                .build();

        client.offers().create(offer);

        JsonNode body = mapper.readTree(stub.lastRequest().body);
        assertEquals(offer.getId().toString(), body.get("id").asText());
        assertEquals("pending", body.get("status").asText());
        assertEquals("2026-03-01T09:01:00Z", body.get("expires_at").asText());
    }

    @Test
    void listsPendingOffersOfTask() {
        UUID taskId = UUID.randomUUID();
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        stub.respond("GET", "/v1/tasks/" + taskId + "/offers", 200, "[" + offerJson(first, taskId, UUID.randomUUID())
                + "," + offerJson(second, taskId, UUID.randomUUID()) + "]");

        List<TaskOffer> offers = client.offers().findActiveForTask(taskId);

        assertEquals(2, offers.size());
        assertEquals("status=pending", stub.lastRequest().query);
        TaskOffer offer = offers.get(0);
        assertEquals(first, offer.getId());
        assertEquals(Instant.parse("2026-03-01T09:01:00Z"), offer.getExpiresAt());
        assertEquals(new BigDecimal("1500"), offer.getTotalEarning());
    }

    @Test
    void findsSingleOffer() {
        UUID offerId = UUID.randomUUID();
        UUID taskId = UUID.randomUUID();
        UUID workerId = UUID.randomUUID();
        stub.respond("GET", "/v1/offers/" + offerId, 200, offerJson(offerId, taskId, workerId));

        Optional<TaskOffer> offer = client.offers().findById(offerId);

        assertTrue(offer.isPresent());
        assertEquals(workerId, offer.get().getWorkerId());
        assertTrue(offer.get().isPending());
    }

    @Test
    void expireSweepReturnsCount() throws IOException {
        stub.respond("POST", "/v1/offers/expire", 200, "{\"expired\":3}");

        assertEquals(3, client.offers().expireStale(NOW));

        JsonNode body = mapper.readTree(stub.lastRequest().body);
        assertEquals("2026-03-01T09:00:00Z", body.get("now").asText());
    }

    @Test
    void serverErrorBecomesCollaboratorFailure() {
        UUID taskId = UUID.randomUUID();
        stub.respond("GET", "/v1/tasks/" + taskId, 503, "");

        CollaboratorException e = assertThrows(CollaboratorException.class,
                () -> client.tasks().findById(taskId));

        assertTrue(e.getMessage().contains("503"), e.getMessage());
    }

    @Test
    void unreachablePlatformBecomesCollaboratorFailure() {
        stub.close();

        assertThrows(CollaboratorException.class,
                () -> client.tasks().updateStatus(UUID.randomUUID(), TaskStatus.OFFERED));
    }
}
