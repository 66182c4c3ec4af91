package org.omniroute.gig.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.omniroute.gig.engine.domain.model.Address;
import org.omniroute.gig.engine.domain.model.GeoPoint;

/**
 * DTO for a street address with coordinates.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AddressDto {

    @JsonProperty("address")
    private String line;

    @JsonProperty("lat")
    private double latitude;

    @JsonProperty("lon")
    private double longitude;

    public AddressDto() {
    }

    public AddressDto(String line, double latitude, double longitude) {
        this.line = line;
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public Address toDomain() {
        return new Address(line, new GeoPoint(latitude, longitude));
    }

    public static AddressDto from(Address address) {
        if (address == null) {
            return null;
        }
        GeoPoint location = address.getLocation();
        return new AddressDto(address.getLine(), location.getLatitude(), location.getLongitude());
    }

    public String getLine() {
        return line;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }
}
