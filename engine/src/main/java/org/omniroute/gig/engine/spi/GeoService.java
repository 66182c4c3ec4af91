package org.omniroute.gig.engine.spi;

import org.omniroute.gig.engine.domain.model.GeoPoint;

import java.util.List;

/**
 * Geographic calculations.
 */
public interface GeoService {

    /**
     * @return distance in kilometers
     */
    double distanceKm(GeoPoint from, GeoPoint to);

    /**
     * @return estimated travel time in minutes
     * @throws CollaboratorException if no estimate can be produced
     */
    int etaMinutes(GeoPoint from, GeoPoint to, String vehicleType);

    /**
     * @return waypoints of the driving route, empty when no route exists
     */
    List<GeoPoint> drivingRoute(GeoPoint from, GeoPoint to);
}
