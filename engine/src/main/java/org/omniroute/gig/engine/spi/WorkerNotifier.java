package org.omniroute.gig.engine.spi;

import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.TaskOffer;

import java.util.UUID;

/**
 * Push channel to worker devices.
 */
public interface WorkerNotifier {

    void sendTaskOffer(UUID workerId, TaskOffer offer, Task task);

    void sendTaskUpdate(UUID workerId, Task task, String message);
}
