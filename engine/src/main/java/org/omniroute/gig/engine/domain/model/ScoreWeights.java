package org.omniroute.gig.engine.domain.model;

/**
 * Weights applied to the six normalized sub-scores.
 */
public final class ScoreWeights {

    /** Distance-led profile used by the NEAREST strategy. */
    public static final ScoreWeights NEAREST = new ScoreWeights(0.5, 0.2, 0.0, 0.15, 0.15, 0.0);

    /** Rating-led profile, selected with {@code scoring_profile = 1}. */
    public static final ScoreWeights BEST_RATED = new ScoreWeights(0.2, 0.4, 0.2, 0.1, 0.1, 0.0);

    /** Load-spreading profile, selected with {@code scoring_profile = 2}. */
    public static final ScoreWeights LOAD_BALANCED = new ScoreWeights(0.2, 0.2, 0.0, 0.1, 0.1, 0.4);

    private final double distance;
    private final double rating;
    private final double experience;
    private final double acceptance;
    private final double onTime;
    private final double loadBalance;

    public ScoreWeights(double distance, double rating, double experience,
                        double acceptance, double onTime, double loadBalance) {
        this.distance = distance;
        this.rating = rating;
        this.experience = experience;
        this.acceptance = acceptance;
        this.onTime = onTime;
        this.loadBalance = loadBalance;
    }

    public double getDistance() {
        return distance;
    }

    public double getRating() {
        return rating;
    }

    public double getExperience() {
        return experience;
    }

    public double getAcceptance() {
        return acceptance;
    }

    public double getOnTime() {
        return onTime;
    }

    public double getLoadBalance() {
        return loadBalance;
    }

    public double total() {
        return distance + rating + experience + acceptance + onTime + loadBalance;
    }

    @Override
    public String toString() {
        return String.format("ScoreWeights{distance=%.2f, rating=%.2f, experience=%.2f, acceptance=%.2f, "
                        + "onTime=%.2f, load=%.2f}",
                distance, rating, experience, acceptance, onTime, loadBalance);
    }
}
