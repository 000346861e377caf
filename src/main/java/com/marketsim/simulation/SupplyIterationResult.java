package com.marketsim.simulation;

import com.marketsim.engine.SearchOutcome;
import com.marketsim.metrics.MarketMetrics;

import java.util.List;

/**
 * One independently seeded pass of {@code search_iterations} searches.
 *
 * @param outcomes in search index order; shorter than requested when the run was stopped
 */
public record SupplyIterationResult(
    int index,
    long seed,
    int requestedSearches,
    List<SearchOutcome> outcomes,
    MarketMetrics metrics
) {
    public SupplyIterationResult {
        outcomes = List.copyOf(outcomes);
    }

    public int completedSearches() {
        return outcomes.size();
    }

    public boolean partial() {
        return outcomes.size() < requestedSearches;
    }

    public double connectionRate() {
        return metrics.connectionRate();
    }
}
