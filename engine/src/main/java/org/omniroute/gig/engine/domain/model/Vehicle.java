package org.omniroute.gig.engine.domain.model;

/**
 * Vehicle registered to a worker.
 */
public final class Vehicle {

    private final String type;
    private final double capacityKg;

    public Vehicle(String type, double capacityKg) {
        this.type = type;
        this.capacityKg = capacityKg;
    }

    public String getType() {
        return type;
    }

    public double getCapacityKg() {
        return capacityKg;
    }

    @Override
    public String toString() {
        return "Vehicle{type='" + type + "', capacityKg=" + capacityKg + '}';
    }
}
