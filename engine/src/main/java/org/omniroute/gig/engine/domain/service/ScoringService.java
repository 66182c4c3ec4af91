package org.omniroute.gig.engine.domain.service;

import org.omniroute.gig.engine.domain.model.AllocationStrategy;
import org.omniroute.gig.engine.domain.model.Candidate;
import org.omniroute.gig.engine.domain.model.ScoreWeights;
import org.omniroute.gig.engine.domain.model.ScoredCandidate;

import java.util.List;

/**
 * Service for calculating suitability scores for candidates.
 */
public interface ScoringService {

    /**
     * Calculate score for a candidate.
     * Higher score = better candidate.
     *
     * @param candidate the candidate to score
     * @param weights   weights applied to the normalized sub-scores
     * @return scored candidate with computed score and breakdown
     */
    ScoredCandidate score(Candidate candidate, ScoreWeights weights);

    /**
     * Score every candidate with the weights of the strategy and sort best first.
     */
    List<ScoredCandidate> rank(List<Candidate> candidates, AllocationStrategy strategy);

    /**
     * Weights the given strategy ranks with.
     */
    ScoreWeights weightsFor(AllocationStrategy strategy);
}
