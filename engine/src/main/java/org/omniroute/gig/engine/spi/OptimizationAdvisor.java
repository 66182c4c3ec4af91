package org.omniroute.gig.engine.spi;

import org.omniroute.gig.engine.domain.model.ScoredCandidate;
import org.omniroute.gig.engine.domain.model.Task;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Extension point for model-driven worker selection.
 */
public interface OptimizationAdvisor {

    /**
     * @param task       the task being allocated
     * @param candidates ranked candidates, best first
     * @return the recommended worker id, or empty to keep the ranking
     */
    Optional<UUID> recommend(Task task, List<ScoredCandidate> candidates);
}
