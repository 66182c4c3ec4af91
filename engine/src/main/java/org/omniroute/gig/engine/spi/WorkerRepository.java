package org.omniroute.gig.engine.spi;

import org.omniroute.gig.engine.domain.model.GeoPoint;
import org.omniroute.gig.engine.domain.model.GigWorker;
import org.omniroute.gig.engine.domain.model.WorkerType;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Read access to worker profiles.
 */
public interface WorkerRepository {

    Optional<GigWorker> findById(UUID workerId);

    /**
     * Online workers of the given types whose last known position is within the radius.
     *
     * @param center    search center
     * @param radiusKm  search radius in kilometers
     * @param types     accepted worker types
     * @return matching workers, possibly empty
     */
    List<GigWorker> findOnlineWithinRadius(GeoPoint center, double radiusKm, Set<WorkerType> types);
}
