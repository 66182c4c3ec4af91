package org.omniroute.gig.engine.domain.model;

import java.util.Objects;

/**
 * A pickup or dropoff address with its resolved coordinates.
 */
public final class Address {

    private final String line;
    private final GeoPoint location;

    public Address(String line, GeoPoint location) {
        this.line = line;
        this.location = Objects.requireNonNull(location, "location must not be null");
    }

    public String getLine() {
        return line;
    }

    public GeoPoint getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return "Address{line='" + line + "', location=" + location + '}';
    }
}
