package org.omniroute.gig.engine.domain.service;

import org.omniroute.gig.engine.domain.model.AllocationResult;
import org.omniroute.gig.engine.domain.model.AllocationStrategy;

import java.util.UUID;

/**
 * Entry point that runs the allocation algorithm for one task.
 */
@FunctionalInterface
public interface TaskAllocator {

    AllocationResult allocateTask(UUID taskId, AllocationStrategy strategy);
}
