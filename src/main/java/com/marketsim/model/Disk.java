package com.marketsim.model;

import com.marketsim.geo.GeoPoint;

/**
 * Circular piece of a market's footprint.
 */
public record Disk(String label, GeoPoint center, double radiusKm) {}
