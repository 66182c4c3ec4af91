package org.omniroute.gig.engine.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.omniroute.gig.engine.domain.model.GeoPoint;
import org.omniroute.gig.engine.spi.CollaboratorException;
import org.omniroute.gig.engine.spi.GeoService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.http.Body;
import retrofit2.http.POST;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Geo service backed by the routing API.
 * Straight-line distance is computed locally; travel time and route geometry come from the API.
 */
public final class RoutingGeoService implements GeoService {

    private static final Logger LOG = LoggerFactory.getLogger(RoutingGeoService.class);

    private static final double EARTH_RADIUS_KM = 6371.0;
    private static final int MAX_CACHE_SIZE = 100;

    private final ObjectMapper objectMapper = ApiSupport.objectMapper();
    private final RoutingApi api;

    // Access-ordered LRU of routes keyed by endpoints and vehicle type
    private final Map<String, RouteInfo> routeCache =
            new LinkedHashMap<String, RouteInfo>(MAX_CACHE_SIZE, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, RouteInfo> eldest) {
                    return size() > MAX_CACHE_SIZE;
                }
            };

    public RoutingGeoService(String apiBaseUrl) {
        this(apiBaseUrl, ApiSupport.httpClient());
    }

    public RoutingGeoService(String apiBaseUrl, OkHttpClient client) {
        this.api = ApiSupport.create(apiBaseUrl, client, RoutingApi.class);
        LOG.info("Routing service initialized with API: {}", apiBaseUrl);
    }

    /**
     * Great-circle distance using the haversine formula.
     */
    @Override
    public double distanceKm(GeoPoint from, GeoPoint to) {
        double dLat = Math.toRadians(to.getLatitude() - from.getLatitude());
        double dLon = Math.toRadians(to.getLongitude() - from.getLongitude());
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(from.getLatitude())) * Math.cos(Math.toRadians(to.getLatitude()))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return EARTH_RADIUS_KM * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    @Override
    public int etaMinutes(GeoPoint from, GeoPoint to, String vehicleType) {
        RouteInfo route = calculateRoute(from, to, vehicleType);
        return (int) Math.ceil(route.durationSeconds / 60.0);
    }

    @Override
    public List<GeoPoint> drivingRoute(GeoPoint from, GeoPoint to) {
        RouteInfo route = calculateRoute(from, to, null);
        return parseGeoJsonCoordinates(route.geoJson);
    }

    /**
     * Clear the route cache.
     */
    public void clearCache() {
        synchronized (routeCache) {
            routeCache.clear();
        }
    }

    private RouteInfo calculateRoute(GeoPoint from, GeoPoint to, String vehicleType) {
        String cacheKey = String.format("%.5f,%.5f->%.5f,%.5f/%s", from.getLatitude(), from.getLongitude(),
                to.getLatitude(), to.getLongitude(), vehicleType);

        synchronized (routeCache) {
            RouteInfo cached = routeCache.get(cacheKey);
            if (cached != null) {
                LOG.debug("Route cache HIT: {}", cacheKey);
                return cached;
            }
        }

        CalculateRouteRequest request = new CalculateRouteRequest(from, to, vehicleType);
        CalculateRouteResponse body = ApiSupport.execute(api.calculateRoute(request), "POST /v1/routing/calculate");
        if (body == null || body.routeGeoJson == null || body.routeGeoJson.isEmpty()) {
            throw new CollaboratorException("No route found between " + from + " and " + to);
        }

        RouteInfo routeInfo = new RouteInfo(body.routeGeoJson, body.routeLengthMeters, body.estimatedDurationSeconds);
        synchronized (routeCache) {
            routeCache.put(cacheKey, routeInfo);
        }

        LOG.debug("Route success: {}m, {}s", String.format("%.0f", routeInfo.lengthMeters),
                String.format("%.0f", routeInfo.durationSeconds));
        return routeInfo;
    }

    /**
     * Parse GeoJSON LineString coordinates ({@code [lon, lat]} pairs) into points.
     */
    private List<GeoPoint> parseGeoJsonCoordinates(String geoJson) {
        JsonNode root;
        try {
            root = objectMapper.readTree(geoJson);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Malformed route geometry: " + e.getOriginalMessage(), e);
        }

        JsonNode coordinates = root.path("coordinates");
        if (!coordinates.isArray() && root.has("geometry")) {
            coordinates = root.path("geometry").path("coordinates");
        }

        List<GeoPoint> waypoints = new ArrayList<>();
        for (JsonNode pair : coordinates) {
            if (pair.size() >= 2) {
                waypoints.add(new GeoPoint(pair.get(1).asDouble(), pair.get(0).asDouble()));
            }
        }
        return waypoints;
    }

    /**
     * Route geometry and metrics.
     */
    private static final class RouteInfo {
        final String geoJson;
        final double lengthMeters;
        final double durationSeconds;

        RouteInfo(String geoJson, double lengthMeters, double durationSeconds) {
            this.geoJson = geoJson;
            this.lengthMeters = lengthMeters;
            this.durationSeconds = durationSeconds;
        }
    }

    interface RoutingApi {
        @POST("v1/routing/calculate")
        Call<CalculateRouteResponse> calculateRoute(@Body CalculateRouteRequest body);
    }

    static final class CalculateRouteRequest {
        @JsonProperty("from_lat")
        private final double fromLat;
        @JsonProperty("from_lon")
        private final double fromLon;
        @JsonProperty("to_lat")
        private final double toLat;
        @JsonProperty("to_lon")
        private final double toLon;
        @JsonProperty("vehicle_type")
        private final String vehicleType;

        CalculateRouteRequest(GeoPoint from, GeoPoint to, String vehicleType) {
            this.fromLat = from.getLatitude();
            this.fromLon = from.getLongitude();
            this.toLat = to.getLatitude();
            this.toLon = to.getLongitude();
            this.vehicleType = vehicleType;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class CalculateRouteResponse {
        @JsonProperty("route_geojson")
        private String routeGeoJson;
        @JsonProperty("route_length_meters")
        private double routeLengthMeters;
        @JsonProperty("estimated_duration_seconds")
        private double estimatedDurationSeconds;
    }
}
