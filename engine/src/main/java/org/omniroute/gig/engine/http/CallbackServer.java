package org.omniroute.gig.engine.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.omniroute.gig.engine.domain.model.AllocationResult;
import org.omniroute.gig.engine.domain.model.AllocationStrategy;
import org.omniroute.gig.engine.domain.model.GeoPoint;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.WorkerAvailability;
import org.omniroute.gig.engine.domain.model.WorkerState;
import org.omniroute.gig.engine.domain.service.AllocationException;
import org.omniroute.gig.engine.domain.service.AllocationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP server for allocation callbacks from the gig platform and worker apps.
 *
 * <pre>
 * GET  /health
 * POST /tasks/{taskId}/allocate?strategy=nearest|broadcast|ai_optimized
 * POST /offers/{offerId}/accept        {"worker_id"}
 * POST /offers/{offerId}/decline       {"worker_id", "reason"}
 * PUT  /workers/{workerId}/location    {"lat", "lon"}
 * PUT  /workers/{workerId}/availability {"availability"}
 * POST /workers/{workerId}/release     {"task_id"}
 * </pre>
 */
public final class CallbackServer {

    private static final Logger LOG = LoggerFactory.getLogger(CallbackServer.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final AllocationService allocationService;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public CallbackServer(int port, AllocationService allocationService) throws IOException {
        this.allocationService = Objects.requireNonNull(allocationService, "allocationService must not be null");

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(4);
        this.server.setExecutor(executor);

        registerHandlers();
        LOG.info("Callback server initialized on port {}", getPort());
    }

    private void registerHandlers() {
        server.createContext("/health", this::handleHealth);
        server.createContext("/tasks/", exchange -> dispatch(exchange, this::handleTask));
        server.createContext("/offers/", exchange -> dispatch(exchange, this::handleOffer));
        server.createContext("/workers/", exchange -> dispatch(exchange, this::handleWorker));
    }

    /**
     * Start the callback server.
     */
    public void start() {
        server.start();
        LOG.info("Callback server started");
    }

    /**
     * Stop the callback server.
     */
    public void stop() {
        server.stop(1);
        executor.shutdown();
        LOG.info("Callback server stopped");
    }

    /**
     * Port actually bound, useful when constructed with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Health check endpoint.
     * GET /health
     */
    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, "method not allowed");
            return;
        }
        sendResponse(exchange, 200, objectMapper.createObjectNode().put("status", "healthy"));
    }

    /**
     * POST /tasks/{taskId}/allocate
     */
    private void handleTask(HttpExchange exchange, String[] segments) throws IOException {
        if (segments.length != 3 || !"allocate".equals(segments[2])) {
            sendError(exchange, 404, "not found");
            return;
        }
        if (!"POST".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, "method not allowed");
            return;
        }

        UUID taskId = UUID.fromString(segments[1]);
        String strategyParam = queryParam(exchange, "strategy");
        AllocationStrategy strategy = strategyParam == null
                ? AllocationStrategy.NEAREST
                : AllocationStrategy.fromCode(strategyParam);

        LOG.info("Received allocation request for task {} ({})", taskId, strategy);
        AllocationResult result = allocationService.allocateTask(taskId, strategy);
        sendResponse(exchange, 200, toJson(result));
    }

    /**
     * POST /offers/{offerId}/accept, POST /offers/{offerId}/decline
     */
    private void handleOffer(HttpExchange exchange, String[] segments) throws IOException {
        if (segments.length != 3) {
            sendError(exchange, 404, "not found");
            return;
        }
        if (!"POST".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, "method not allowed");
            return;
        }

        UUID offerId = UUID.fromString(segments[1]);
        JsonNode body = readBody(exchange);
        UUID workerId = UUID.fromString(requiredText(body, "worker_id"));

        switch (segments[2]) {
            case "accept": {
                Task task = allocationService.acceptOffer(offerId, workerId);
                ObjectNode json = objectMapper.createObjectNode()
                        .put("status", "accepted")
                        .put("task_id", task.getId().toString())
                        .put("task_status", task.getStatus().getCode())
                        .put("assigned_worker_id", workerId.toString());
                if (task.getAcceptedAt() != null) {
                    json.put("accepted_at", task.getAcceptedAt().toString());
                }
                sendResponse(exchange, 200, json);
                break;
            }
            case "decline": {
                String reason = body.path("reason").isTextual() ? body.get("reason").asText() : null;
                allocationService.declineOffer(offerId, workerId, reason);
                sendResponse(exchange, 200, objectMapper.createObjectNode().put("status", "declined"));
                break;
            }
            default:
                sendError(exchange, 404, "not found");
        }
    }

    /**
     * PUT /workers/{id}/location, PUT /workers/{id}/availability, POST /workers/{id}/release
     */
    private void handleWorker(HttpExchange exchange, String[] segments) throws IOException {
        if (segments.length != 3) {
            sendError(exchange, 404, "not found");
            return;
        }

        UUID workerId = UUID.fromString(segments[1]);
        String method = exchange.getRequestMethod();

        switch (segments[2]) {
            case "location": {
                if (!"PUT".equals(method)) {
                    sendError(exchange, 405, "method not allowed");
                    return;
                }
                JsonNode body = readBody(exchange);
                GeoPoint location = new GeoPoint(requiredNumber(body, "lat"), requiredNumber(body, "lon"));
                allocationService.updateWorkerLocation(workerId, location);
                sendWorkerState(exchange, workerId);
                break;
            }
            case "availability": {
                if (!"PUT".equals(method)) {
                    sendError(exchange, 405, "method not allowed");
                    return;
                }
                JsonNode body = readBody(exchange);
                WorkerAvailability availability = WorkerAvailability.fromCode(requiredText(body, "availability"));
                allocationService.setWorkerAvailability(workerId, availability);
                sendWorkerState(exchange, workerId);
                break;
            }
            case "release": {
                if (!"POST".equals(method)) {
                    sendError(exchange, 405, "method not allowed");
                    return;
                }
                JsonNode body = readBody(exchange);
                allocationService.releaseWorkerTask(workerId, UUID.fromString(requiredText(body, "task_id")));
                sendWorkerState(exchange, workerId);
                break;
            }
            default:
                sendError(exchange, 404, "not found");
        }
    }

    @FunctionalInterface
    private interface RouteHandler {
        void handle(HttpExchange exchange, String[] segments) throws IOException;
    }

    /**
     * Split the path and map failures to status codes.
     */
    private void dispatch(HttpExchange exchange, RouteHandler handler) throws IOException {
        String[] segments = pathSegments(exchange.getRequestURI().getPath());
        try {
            handler.handle(exchange, segments);
        } catch (AllocationException e) {
            int status = statusFor(e.getReason());
            if (status >= 500) {
                LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            } else {
                LOG.info("Request {} {} rejected: {}", exchange.getRequestMethod(), exchange.getRequestURI(),
                        e.getMessage());
            }
            sendError(exchange, status, e.getReason().name().toLowerCase(Locale.ROOT), e.getMessage());
        } catch (IllegalArgumentException | JsonProcessingException e) {
            sendError(exchange, 400, "bad request", e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            sendError(exchange, 500, "internal error");
        }
    }

    static int statusFor(AllocationException.Reason reason) {
        switch (reason) {
            case NOT_FOUND:
                return 404;
            case INVALID_STATE:
                return 409;
            case UNAUTHORIZED:
                return 403;
            case EXPIRED:
                return 410;
            case COLLABORATOR_FAILURE:
                return 502;
            default:
                return 500;
        }
    }

    private static String[] pathSegments(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.split("/");
    }

    private static String queryParam(HttpExchange exchange, String name) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && name.equals(pair.substring(0, eq))) {
                return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private JsonNode readBody(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            byte[] bytes = in.readAllBytes();
            if (bytes.length == 0) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(bytes);
        }
    }

    private static String requiredText(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || !node.isTextual() || node.asText().isEmpty()) {
            throw new IllegalArgumentException("missing field: " + field);
        }
        return node.asText();
    }

    private static double requiredNumber(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || !node.isNumber()) {
            throw new IllegalArgumentException("missing field: " + field);
        }
        return node.asDouble();
    }

    private void sendWorkerState(HttpExchange exchange, UUID workerId) throws IOException {
        WorkerState state = allocationService.findWorkerState(workerId)
                .orElseThrow(() -> new AllocationException(AllocationException.Reason.NOT_FOUND,
                        "Worker state not found: " + workerId));
        ObjectNode json = objectMapper.createObjectNode()
                .put("worker_id", workerId.toString())
                .put("availability", state.getAvailability().getCode())
                .put("active_task_count", state.getActiveTaskCount());
        if (state.getLocation() != null) {
            json.put("lat", state.getLocation().getLatitude());
            json.put("lon", state.getLocation().getLongitude());
        }
        if (state.getCurrentTaskId() != null) {
            json.put("current_task_id", state.getCurrentTaskId().toString());
        }
        sendResponse(exchange, 200, json);
    }

    private ObjectNode toJson(AllocationResult result) {
        ObjectNode json = objectMapper.createObjectNode()
                .put("success", result.isSuccess())
                .put("task_id", result.getTaskId().toString())
                .put("strategy", result.getStrategy().getCode())
                .put("offers_created", result.getOffersCreated());
        if (result.getWorkerId() != null) {
            json.put("worker_id", result.getWorkerId().toString());
        }
        if (result.getOfferId() != null) {
            json.put("offer_id", result.getOfferId().toString());
        }
        json.set("offer_ids", objectMapper.valueToTree(result.getOfferIds()));
        json.set("candidate_worker_ids", objectMapper.valueToTree(result.getCandidateWorkerIds()));
        if (result.getEarning() != null) {
            json.put("total_earning", result.getEarning().getTotalEarning());
        }
        if (result.getFailureReason() != null) {
            json.put("failure_reason", result.getFailureReason().name().toLowerCase(Locale.ROOT));
        }
        if (result.getMessage() != null) {
            json.put("message", result.getMessage());
        }
        return json;
    }

    private void sendError(HttpExchange exchange, int statusCode, String error) throws IOException {
        sendResponse(exchange, statusCode, objectMapper.createObjectNode().put("error", error));
    }

    private void sendError(HttpExchange exchange, int statusCode, String error, String message) throws IOException {
        sendResponse(exchange, statusCode, objectMapper.createObjectNode()
                .put("error", error)
                .put("message", message));
    }

    /**
     * Send HTTP response.
     */
    private void sendResponse(HttpExchange exchange, int statusCode, JsonNode body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
