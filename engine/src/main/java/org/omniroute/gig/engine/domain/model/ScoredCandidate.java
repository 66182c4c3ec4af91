package org.omniroute.gig.engine.domain.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable candidate with its computed suitability score.
 * Natural order is best first: higher score, then shorter distance, then lower worker id.
 */
public final class ScoredCandidate implements Comparable<ScoredCandidate> {

    public static final String DISTANCE = "distance";
    public static final String RATING = "rating";
    public static final String EXPERIENCE = "experience";
    public static final String ACCEPTANCE = "acceptance";
    public static final String ON_TIME = "on_time";
    public static final String LOAD_BALANCE = "load_balance";

    private static final Comparator<ScoredCandidate> RANKING = Comparator
            .comparingDouble(ScoredCandidate::getScore).reversed()
            .thenComparingDouble(ScoredCandidate::getDistanceKm)
            .thenComparing(sc -> sc.getWorkerId().toString());

    private final Candidate candidate;
    private final double score;
    private final Map<String, Double> breakdown;

    private ScoredCandidate(Builder builder) {
        this.candidate = Objects.requireNonNull(builder.candidate, "candidate must not be null");
        this.score = builder.score;
        this.breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(builder.breakdown));
    }

    public Candidate getCandidate() {
        return candidate;
    }

    public GigWorker getWorker() {
        return candidate.getWorker();
    }

    public UUID getWorkerId() {
        return candidate.getWorker().getId();
    }

    public double getDistanceKm() {
        return candidate.getDistanceKm();
    }

    public int getEtaMinutes() {
        return candidate.getEtaMinutes();
    }

    public EarningEstimate getEarning() {
        return candidate.getEarning();
    }

    public double getScore() {
        return score;
    }

    /**
     * Per-factor sub-scores keyed by {@link #DISTANCE}, {@link #RATING} and friends, each in [0,100].
     */
    public Map<String, Double> getBreakdown() {
        return breakdown;
    }

    @Override
    public int compareTo(ScoredCandidate other) {
        return RANKING.compare(this, other);
    }

    @Override
    public String toString() {
        return String.format("ScoredCandidate{worker=%s, score=%.2f, distance=%.2fkm, eta=%dmin}",
                getWorkerId(), score, getDistanceKm(), getEtaMinutes());
    }

    /**
     * Builder for ScoredCandidate.
     */
    public static final class Builder {
        private Candidate candidate;
        private double score;
        private final Map<String, Double> breakdown = new LinkedHashMap<>();

        public Builder candidate(Candidate candidate) {
            this.candidate = candidate;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder factor(String name, double value) {
            this.breakdown.put(name, value);
            return this;
        }

        public ScoredCandidate build() {
            return new ScoredCandidate(this);
        }
    }
}
