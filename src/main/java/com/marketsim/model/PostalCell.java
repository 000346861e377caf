package com.marketsim.model;

import com.marketsim.geo.GeoPoint;

import static com.marketsim.error.ValidationException.require;

/**
 * One postal code area of a market: centroid, demand weight ({@code str_tam}) and optional area.
 *
 * <p>Searches inside a cell are spread over a disk around the centroid. When the area is
 * known the disk has the same area; otherwise it falls back to {@link #DEFAULT_RADIUS_KM}.
 */
public record PostalCell(
    String postalCode,
    String marketId,
    GeoPoint centroid,
    double demandWeight,
    Double areaKm2
) {
    public static final double DEFAULT_RADIUS_KM = 1.0;

    public PostalCell {
        require(postalCode != null && !postalCode.isBlank(), "Postal code must not be blank");
        require(centroid != null, "Postal code " + postalCode + " has no centroid");
        require(Double.isFinite(demandWeight) && demandWeight >= 0,
            "STR TAM cannot be negative for postal code " + postalCode + ", got: " + demandWeight);
        require(areaKm2 == null || (Double.isFinite(areaKm2) && areaKm2 > 0),
            "Area must be positive for postal code " + postalCode + ", got: " + areaKm2);
    }

    public PostalCell(String postalCode, String marketId, GeoPoint centroid, double demandWeight) {
        this(postalCode, marketId, centroid, demandWeight, null);
    }

    public double samplingRadiusKm() {
        return areaKm2 != null ? Math.sqrt(areaKm2 / Math.PI) : DEFAULT_RADIUS_KM;
    }

    public double effectiveAreaKm2() {
        return areaKm2 != null ? areaKm2 : Math.PI * DEFAULT_RADIUS_KM * DEFAULT_RADIUS_KM;
    }
}
