package org.omniroute.gig.engine.domain.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AllocationConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        AllocationConfig config = AllocationConfig.defaults();

        assertEquals(60, config.getOfferTimeoutSeconds());
        assertEquals(5, config.getMaxConcurrentOffers());
        assertEquals(10.0, config.getMaxWorkerDistanceKm());
        assertEquals(3.5, config.getMinWorkerRating());
        assertEquals(3, config.getMaxTasksPerWorker());
        assertEquals(50.0, config.getHeavyLoadKg());
        assertEquals(10.0, config.getMediumLoadKg());
        assertFalse(config.isAiOptimizationEnabled());
        assertEquals(1.0, config.getDefaultWeights().total(), 1e-9);
    }

    @Test
    void fromMapOverridesOnlyGivenKeys() {
        AllocationConfig config = AllocationConfig.fromMap(Map.of(
                AllocationConfig.OFFER_TIMEOUT_SECONDS, 90.0,
                AllocationConfig.ENABLE_AI_OPTIMIZATION, 1.0));

        assertEquals(90, config.getOfferTimeoutSeconds());
        assertTrue(config.isAiOptimizationEnabled());
        assertEquals(5, config.getMaxConcurrentOffers());
    }

    @Test
    void fromLookupReadsPrefixedVariables() {
        Map<String, String> env = new HashMap<>();
        env.put("ALLOCATION_MAX_WORKER_DISTANCE_KM", " 7.5 ");
        env.put("ALLOCATION_ENABLE_AI_OPTIMIZATION", "TRUE");
        env.put("ALLOCATION_MAX_CONCURRENT_OFFERS", "lots");
        env.put("ALLOCATION_MIN_WORKER_RATING", "");

        AllocationConfig config = AllocationConfig.fromLookup(env::get);

        assertEquals(7.5, config.getMaxWorkerDistanceKm());
        assertTrue(config.isAiOptimizationEnabled());
        assertEquals(5, config.getMaxConcurrentOffers());
        assertEquals(3.5, config.getMinWorkerRating());
    }

    @Test
    void falseDisablesFeatureFlag() {
        AllocationConfig config = AllocationConfig.fromLookup(
                Map.of("ALLOCATION_ENABLE_AI_OPTIMIZATION", "false")::get);

        assertFalse(config.isAiOptimizationEnabled());
    }

    @Test
    void rejectsUnusableLimits() {
        assertThrows(IllegalArgumentException.class,
                () -> AllocationConfig.fromMap(Map.of(AllocationConfig.OFFER_TIMEOUT_SECONDS, 0.0)));
        assertThrows(IllegalArgumentException.class,
                () -> AllocationConfig.fromMap(Map.of(AllocationConfig.MAX_CONCURRENT_OFFERS, 0.0)));
        assertThrows(IllegalArgumentException.class,
                () -> AllocationConfig.fromMap(Map.of(AllocationConfig.MAX_WORKER_DISTANCE_KM, -1.0)));
        assertThrows(IllegalArgumentException.class,
                () -> AllocationConfig.fromMap(Map.of(AllocationConfig.MAX_TASKS_PER_WORKER, 0.0)));
    }

    @Test
    void scoringProfileAcceptsNamesAndCodes() {
        assertSame(ScoreWeights.LOAD_BALANCED, AllocationConfig.fromLookup(
                Map.of("ALLOCATION_SCORING_PROFILE", "LOAD_BALANCED")::get).getScoringWeights());
        assertSame(ScoreWeights.BEST_RATED, AllocationConfig.fromLookup(
                Map.of("ALLOCATION_SCORING_PROFILE", "1")::get).getScoringWeights());
        assertEquals(0.30, AllocationConfig.defaults().getScoringWeights().getDistance(), 1e-9);
        assertThrows(IllegalArgumentException.class,
                () -> AllocationConfig.fromMap(Map.of(AllocationConfig.SCORING_PROFILE, 7.0)));
    }

    @Test
    void unknownKeyIsRejected() {
        AllocationConfig config = AllocationConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> config.get("surge_multiplier"));
        assertEquals(2.0, config.getOrDefault("surge_multiplier", 2.0));
    }

    @Test
    void envNameIsUpperCasedWithPrefix() {
        assertEquals("ALLOCATION_OFFER_TIMEOUT_SECONDS", AllocationConfig.envName("offer_timeout_seconds"));
    }
}
