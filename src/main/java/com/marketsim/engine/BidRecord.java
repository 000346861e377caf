package com.marketsim.engine;

/**
 * A provider that bid on a search.
 *
 * @param connectionProbability NaN when an earlier bidder already took the connection
 */
public record BidRecord(
    String providerId,
    double distanceKm,
    double score,
    double bidProbability,
    double connectionProbability,
    boolean converted
) {
    public boolean connectionEvaluated() {
        return !Double.isNaN(connectionProbability);
    }
}
