package org.omniroute.gig.engine.domain.service;

import org.omniroute.gig.engine.domain.model.Candidate;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.WorkerType;

import java.util.List;
import java.util.Set;

/**
 * Service for finding workers able to take a task.
 */
public interface CandidateDiscoveryService {

    /**
     * Find eligible workers near the task, enriched with distance, ETA and earning.
     *
     * @param task the task to match
     * @return surviving candidates in repository order, possibly empty
     */
    List<Candidate> findCandidates(Task task);

    /**
     * Worker types capable of handling the task, based on its type and weight.
     */
    Set<WorkerType> requiredWorkerTypes(Task task);
}
