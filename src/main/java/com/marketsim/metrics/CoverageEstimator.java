package com.marketsim.metrics;

import com.marketsim.geo.GeoPoint;
import com.marketsim.geo.H3Grid;
import com.marketsim.model.Market;
import com.marketsim.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.marketsim.error.ValidationException.require;

/**
 * Approximates area coverage by testing eligibility at H3 cell centroids across the market.
 *
 * <p>Exact union-of-circles area is not computed; accuracy improves with finer resolution.
 * Uses no randomness, so the estimate is a pure function of market, providers and settings.
 */
public class CoverageEstimator {

    private static final Logger log = LoggerFactory.getLogger(CoverageEstimator.class);

    static final long MAX_SAMPLE_POINTS = 50_000;

    private final ProviderRegistry registry;
    private final double searchRadiusKm;
    private final int resolution;

    public CoverageEstimator(ProviderRegistry registry, double searchRadiusKm, int resolution) {
        require(resolution >= 0 && resolution <= 15,
            "coverage_grid_resolution must be in [0, 15], got: " + resolution);
        this.registry = registry;
        this.searchRadiusKm = searchRadiusKm;
        this.resolution = resolution;
    }

    public CoverageEstimate estimate(Market market) {
        int res = effectiveResolution(market.totalAreaKm2());
        var points = market.gridSamplePoints(res);

        int covered = 0;
        for (GeoPoint point : points) {
            if (!registry.eligibleProviders(point, searchRadiusKm).isEmpty()) {
                covered++;
            }
        }

        var estimate = new CoverageEstimate(res, points.size(), covered);
        log.info("Grid coverage for market {}: {}/{} points at resolution {} ({})",
            market.marketId(), covered, points.size(), res, String.format("%.3f", estimate.ratio()));
        return estimate;
    }

    /**
     * Coarsens the configured resolution until the expected grid size is manageable.
     */
    int effectiveResolution(double areaKm2) {
        int res = resolution;
        while (res > 0 && H3Grid.expectedCellCount(areaKm2, res) > MAX_SAMPLE_POINTS) {
            res--;
        }
        if (res != resolution) {
            log.info("Coverage grid coarsened from resolution {} to {} for {} km2",
                resolution, res, String.format("%.1f", areaKm2));
        }
        return res;
    }
}
