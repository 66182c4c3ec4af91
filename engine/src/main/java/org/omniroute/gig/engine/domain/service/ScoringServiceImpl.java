package org.omniroute.gig.engine.domain.service;

import org.omniroute.gig.engine.domain.model.AllocationConfig;
import org.omniroute.gig.engine.domain.model.AllocationStrategy;
import org.omniroute.gig.engine.domain.model.Candidate;
import org.omniroute.gig.engine.domain.model.GigWorker;
import org.omniroute.gig.engine.domain.model.ScoreWeights;
import org.omniroute.gig.engine.domain.model.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Implementation of ScoringService using multi-objective weighted scoring.
 *
 * Each sub-score is normalized to [0,100]:
 *   distance   = 100 * (1 - min(distance / max_distance, 1))
 *   rating     = rating * 20
 *   experience = min(100, ln(completed + 1) * 20)
 *   acceptance = acceptance_rate * 100
 *   on_time    = on_time_rate * 100
 *   load       = 100 * (1 - min(active_tasks / max_tasks, 1))
 * and the total is their weighted sum (higher = better).
 */
public final class ScoringServiceImpl implements ScoringService {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringServiceImpl.class);

    private final AllocationConfig config;

    public ScoringServiceImpl(AllocationConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public ScoredCandidate score(Candidate candidate, ScoreWeights weights) {
        GigWorker worker = candidate.getWorker();

        double distance = calculateDistanceScore(candidate);
        double rating = worker.getRating() * 20;
        double experience = Math.min(100, Math.log(worker.getCompletedTasks() + 1.0) * 20);
        double acceptance = worker.getAcceptanceRate() * 100;
        double onTime = worker.getOnTimeRate() * 100;
        double load = calculateLoadScore(candidate);

        double total = distance * weights.getDistance()
                + rating * weights.getRating()
                + experience * weights.getExperience()
                + acceptance * weights.getAcceptance()
                + onTime * weights.getOnTime()
                + load * weights.getLoadBalance();

        LOG.debug("Scored {}: distance={}, rating={}, load={}, total={}",
                worker.getId(),
                String.format("%.1f", distance),
                String.format("%.1f", rating),
                String.format("%.1f", load),
                String.format("%.2f", total));

        return new ScoredCandidate.Builder()
                .candidate(candidate)
                .score(total)
                .factor(ScoredCandidate.DISTANCE, distance)
                .factor(ScoredCandidate.RATING, rating)
                .factor(ScoredCandidate.EXPERIENCE, experience)
                .factor(ScoredCandidate.ACCEPTANCE, acceptance)
                .factor(ScoredCandidate.ON_TIME, onTime)
                .factor(ScoredCandidate.LOAD_BALANCE, load)
                .build();
    }

    @Override
    public List<ScoredCandidate> rank(List<Candidate> candidates, AllocationStrategy strategy) {
        ScoreWeights weights = weightsFor(strategy);
        return candidates.stream()
                .map(c -> score(c, weights))
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public ScoreWeights weightsFor(AllocationStrategy strategy) {
        if (strategy == AllocationStrategy.NEAREST) {
            return ScoreWeights.NEAREST;
        }
        return config.getScoringWeights();
    }

    /**
     * Closer is better; anything at or beyond the maximum distance scores zero.
     */
    private double calculateDistanceScore(Candidate candidate) {
        double ratio = candidate.getDistanceKm() / config.getMaxWorkerDistanceKm();
        return 100 * (1 - Math.min(ratio, 1));
    }

    /**
     * Fewer active tasks is better; a worker at or over the per-worker limit scores zero.
     */
    private double calculateLoadScore(Candidate candidate) {
        double ratio = (double) candidate.getActiveTaskCount() / config.getMaxTasksPerWorker();
        return 100 * (1 - Math.min(ratio, 1));
    }
}
