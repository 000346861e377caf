package com.marketsim.model;

import com.marketsim.geo.GeoPoint;

/**
 * A search location drawn from a market. {@code postalCode} is null for location-based markets.
 */
public record SampledPoint(GeoPoint point, String postalCode) {}
