package com.marketsim.geo;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketsim.error.ValidationException;

/**
 * Immutable WGS84 coordinate in degrees.
 */
public record GeoPoint(
    @JsonProperty("latitude") double latitude,
    @JsonProperty("longitude") double longitude
) {
    public GeoPoint {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new ValidationException("Latitude must be between -90 and 90, got: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new ValidationException("Longitude must be between -180 and 180, got: " + longitude);
        }
    }

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    public double distanceKmTo(GeoPoint other) {
        return GeoMath.distanceKm(this, other);
    }
}
