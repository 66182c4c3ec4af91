package org.omniroute.gig.engine.domain.model;

import java.util.Objects;

/**
 * A worker that passed eligibility filtering, enriched with distance, ETA and earning.
 */
public final class Candidate {

    private final GigWorker worker;
    private final double distanceKm;
    private final int etaMinutes;
    private final EarningEstimate earning;
    private final int activeTaskCount;

    public Candidate(GigWorker worker, double distanceKm, int etaMinutes,
                     EarningEstimate earning, int activeTaskCount) {
        this.worker = Objects.requireNonNull(worker, "worker must not be null");
        this.distanceKm = distanceKm;
        this.etaMinutes = etaMinutes;
        this.earning = Objects.requireNonNull(earning, "earning must not be null");
        this.activeTaskCount = activeTaskCount;
    }

    public GigWorker getWorker() {
        return worker;
    }

    public double getDistanceKm() {
        return distanceKm;
    }

    public int getEtaMinutes() {
        return etaMinutes;
    }

    public EarningEstimate getEarning() {
        return earning;
    }

    public int getActiveTaskCount() {
        return activeTaskCount;
    }

    @Override
    public String toString() {
        return String.format("Candidate{worker=%s, distance=%.2fkm, eta=%dmin, active=%d}",
                worker.getId(), distanceKm, etaMinutes, activeTaskCount);
    }
}
