package org.disasterops.network;

import lombok.Value;

import java.util.Objects;

/**
 * Immutable geographic point of the relief network.
 */
@Value
public class Location {
    String id;
    String name;
    double latitude;
    double longitude;
    LocationType type;

    public Location(String id, String name, double latitude, double longitude, LocationType type) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("location id must be non-blank");
        }
        if (!Double.isFinite(latitude) || latitude < -90.0d || latitude > 90.0d) {
            throw new IllegalArgumentException("latitude out of range for " + id + ": " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0d || longitude > 180.0d) {
            throw new IllegalArgumentException("longitude out of range for " + id + ": " + longitude);
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.latitude = latitude;
        this.longitude = longitude;
        this.type = Objects.requireNonNull(type, "type");
    }

    /**
     * Convenience factory for a location whose display name equals its id.
     */
    public static Location of(String id, double latitude, double longitude, LocationType type) {
        return new Location(id, id, latitude, longitude, type);
    }
}
