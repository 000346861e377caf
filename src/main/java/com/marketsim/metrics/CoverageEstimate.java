package com.marketsim.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Grid-sampled share of a market reachable by at least one eligible provider.
 *
 * @param resolution H3 resolution actually used, after any coarsening
 */
public record CoverageEstimate(
    @JsonProperty("resolution") int resolution,
    @JsonProperty("sample_points") int samplePoints,
    @JsonProperty("covered_points") int coveredPoints
) {
    @JsonProperty("coverage_ratio")
    public double ratio() {
        return samplePoints == 0 ? 0.0 : (double) coveredPoints / samplePoints;
    }
}
