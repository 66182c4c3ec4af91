package org.omniroute.gig.engine.spi;

import org.omniroute.gig.engine.domain.model.EarningEstimate;
import org.omniroute.gig.engine.domain.model.GigWorker;
import org.omniroute.gig.engine.domain.model.Task;

/**
 * Pricing collaborator computing what a worker would earn for a task.
 */
public interface EarningCalculator {

    EarningEstimate calculate(Task task, GigWorker worker, double distanceKm);
}
