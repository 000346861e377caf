package com.marketsim.simulation;

import com.marketsim.engine.SearchOutcome;
import com.marketsim.metrics.CoverageEstimate;
import com.marketsim.metrics.MarketMetrics;
import com.marketsim.model.Market;

import java.util.List;

/**
 * Final, read-only output of a simulation run.
 *
 * @param metrics pooled over every completed search of every supply iteration
 * @param connectionRateVariance population variance of per-iteration connection rates, 0 for one iteration
 * @param gridCoverage coverage estimated on a spatial grid, independent of the sampled searches
 * @param partial true when the run was stopped before every search completed
 */
public record SimulationResult(
    SimulationConfig config,
    Market market,
    RunState state,
    List<SupplyIterationResult> iterations,
    MarketMetrics metrics,
    double connectionRateVariance,
    CoverageEstimate gridCoverage,
    int requestedSupplyIterations,
    boolean partial
) {
    public SimulationResult {
        iterations = List.copyOf(iterations);
    }

    public int completedSupplyIterations() {
        return iterations.size();
    }

    public long completedSearches() {
        return iterations.stream().mapToLong(SupplyIterationResult::completedSearches).sum();
    }

    /**
     * Every outcome, grouped by supply iteration and ordered by search index within each.
     */
    public List<SearchOutcome> allOutcomes() {
        return iterations.stream().flatMap(it -> it.outcomes().stream()).toList();
    }

    public double connectionRateStdDev() {
        return Math.sqrt(connectionRateVariance);
    }
}
