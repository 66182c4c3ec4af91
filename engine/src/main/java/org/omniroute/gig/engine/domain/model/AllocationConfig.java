package org.omniroute.gig.engine.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable allocation tuning: offer timing, scoring weights and eligibility thresholds.
 */
public final class AllocationConfig {

    private static final Logger LOG = LoggerFactory.getLogger(AllocationConfig.class);

    private final Map<String, Double> values;

    // Offer keys
    public static final String OFFER_TIMEOUT_SECONDS = "offer_timeout_seconds";
    public static final String MAX_CONCURRENT_OFFERS = "max_concurrent_offers";

    // Weight keys
    public static final String WEIGHT_DISTANCE = "weight_distance";
    public static final String WEIGHT_RATING = "weight_rating";
    public static final String WEIGHT_EXPERIENCE = "weight_experience";
    public static final String WEIGHT_ACCEPTANCE_RATE = "weight_acceptance_rate";
    public static final String WEIGHT_ON_TIME_RATE = "weight_on_time_rate";
    public static final String WEIGHT_LOAD_BALANCE = "weight_load_balance";

    // Scoring profile for non-NEAREST strategies: 0 = configured weights, 1 = best rated, 2 = load balanced
    public static final String SCORING_PROFILE = "scoring_profile";
    public static final int PROFILE_CONFIGURED = 0;
    public static final int PROFILE_BEST_RATED = 1;
    public static final int PROFILE_LOAD_BALANCED = 2;

    // Constraint keys
    public static final String MAX_WORKER_DISTANCE_KM = "max_worker_distance_km";
    public static final String MIN_WORKER_RATING = "min_worker_rating";
    public static final String MAX_TASKS_PER_WORKER = "max_tasks_per_worker";
    public static final String HEAVY_LOAD_KG = "heavy_load_kg";
    public static final String MEDIUM_LOAD_KG = "medium_load_kg";

    // Feature flags (1 = on)
    public static final String ENABLE_AI_OPTIMIZATION = "enable_ai_optimization";

    private static final Map<String, Double> DEFAULTS;

    static {
        Map<String, Double> defaults = new HashMap<>();
        defaults.put(OFFER_TIMEOUT_SECONDS, 60.0);
        defaults.put(MAX_CONCURRENT_OFFERS, 5.0);
        defaults.put(WEIGHT_DISTANCE, 0.30);
        defaults.put(WEIGHT_RATING, 0.20);
        defaults.put(WEIGHT_EXPERIENCE, 0.10);
        defaults.put(WEIGHT_ACCEPTANCE_RATE, 0.15);
        defaults.put(WEIGHT_ON_TIME_RATE, 0.15);
        defaults.put(WEIGHT_LOAD_BALANCE, 0.10);
        defaults.put(SCORING_PROFILE, (double) PROFILE_CONFIGURED);
        defaults.put(MAX_WORKER_DISTANCE_KM, 10.0);
        defaults.put(MIN_WORKER_RATING, 3.5);
        defaults.put(MAX_TASKS_PER_WORKER, 3.0);
        defaults.put(HEAVY_LOAD_KG, 50.0);
        defaults.put(MEDIUM_LOAD_KG, 10.0);
        defaults.put(ENABLE_AI_OPTIMIZATION, 0.0);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private AllocationConfig(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
        validate();
    }

    /**
     * Creates an AllocationConfig from a map of key-value pairs. Missing keys fall back to defaults.
     */
    public static AllocationConfig fromMap(Map<String, Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        Map<String, Double> merged = new HashMap<>(DEFAULTS);
        merged.putAll(values);
        return new AllocationConfig(merged);
    }

    public static AllocationConfig defaults() {
        return new AllocationConfig(DEFAULTS);
    }

    /**
     * Reads overrides for every known key from a variable lookup.
     * Key {@code max_worker_distance_km} is looked up as {@code ALLOCATION_MAX_WORKER_DISTANCE_KM}.
     * Blank or unparseable values are ignored.
     */
    public static AllocationConfig fromLookup(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        Map<String, Double> overrides = new HashMap<>();
        for (String key : DEFAULTS.keySet()) {
            String raw = lookup.apply(envName(key));
            if (raw == null || raw.trim().isEmpty()) {
                continue;
            }
            String value = raw.trim();
            if (SCORING_PROFILE.equals(key) && profileCode(value) >= 0) {
                overrides.put(key, (double) profileCode(value));
            } else if ("true".equalsIgnoreCase(value)) {
                overrides.put(key, 1.0);
            } else if ("false".equalsIgnoreCase(value)) {
                overrides.put(key, 0.0);
            } else {
                try {
                    overrides.put(key, Double.parseDouble(value));
                } catch (NumberFormatException e) {
                    LOG.warn("Invalid number for {}: {}, using default: {}", envName(key), value, DEFAULTS.get(key));
                }
            }
        }
        return fromMap(overrides);
    }

    private static int profileCode(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "configured":
                return PROFILE_CONFIGURED;
            case "best_rated":
                return PROFILE_BEST_RATED;
            case "load_balanced":
                return PROFILE_LOAD_BALANCED;
            default:
                return -1;
        }
    }

    public static String envName(String key) {
        return "ALLOCATION_" + key.toUpperCase(Locale.ROOT);
    }

    private void validate() {
        if (getOfferTimeoutSeconds() < 1) {
            throw new IllegalArgumentException(OFFER_TIMEOUT_SECONDS + " must be at least 1");
        }
        if (getMaxConcurrentOffers() < 1) {
            throw new IllegalArgumentException(MAX_CONCURRENT_OFFERS + " must be at least 1");
        }
        if (getMaxWorkerDistanceKm() <= 0) {
            throw new IllegalArgumentException(MAX_WORKER_DISTANCE_KM + " must be positive");
        }
        int profile = getScoringProfile();
        if (profile < PROFILE_CONFIGURED || profile > PROFILE_LOAD_BALANCED) {
            throw new IllegalArgumentException(SCORING_PROFILE + " must be 0, 1 or 2");
        }
        if (getMaxTasksPerWorker() < 1) {
            throw new IllegalArgumentException(MAX_TASKS_PER_WORKER + " must be at least 1");
        }
    }

    /**
     * Gets a configuration value by key.
     */
    public double get(String key) {
        Double value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown config key: " + key);
        }
        return value;
    }

    public double getOrDefault(String key, double defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    public int getOfferTimeoutSeconds() {
        return (int) get(OFFER_TIMEOUT_SECONDS);
    }

    public int getMaxConcurrentOffers() {
        return (int) get(MAX_CONCURRENT_OFFERS);
    }

    /**
     * Weights assembled from the {@code weight_*} keys.
     */
    public ScoreWeights getDefaultWeights() {
        return new ScoreWeights(
                get(WEIGHT_DISTANCE),
                get(WEIGHT_RATING),
                get(WEIGHT_EXPERIENCE),
                get(WEIGHT_ACCEPTANCE_RATE),
                get(WEIGHT_ON_TIME_RATE),
                get(WEIGHT_LOAD_BALANCE));
    }

    public int getScoringProfile() {
        return (int) get(SCORING_PROFILE);
    }

    /**
     * Weights for strategies without a dedicated profile, as selected by {@link #SCORING_PROFILE}.
     */
    public ScoreWeights getScoringWeights() {
        switch (getScoringProfile()) {
            case PROFILE_BEST_RATED:
                return ScoreWeights.BEST_RATED;
            case PROFILE_LOAD_BALANCED:
                return ScoreWeights.LOAD_BALANCED;
            default:
                return getDefaultWeights();
        }
    }

    public double getMaxWorkerDistanceKm() {
        return get(MAX_WORKER_DISTANCE_KM);
    }

    public double getMinWorkerRating() {
        return get(MIN_WORKER_RATING);
    }

    public int getMaxTasksPerWorker() {
        return (int) get(MAX_TASKS_PER_WORKER);
    }

    public double getHeavyLoadKg() {
        return get(HEAVY_LOAD_KG);
    }

    public double getMediumLoadKg() {
        return get(MEDIUM_LOAD_KG);
    }

    public boolean isAiOptimizationEnabled() {
        return get(ENABLE_AI_OPTIMIZATION) >= 1.0;
    }

    @Override
    public String toString() {
        return "AllocationConfig" + values;
    }
}
