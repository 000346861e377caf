package com.marketsim.engine;

import com.marketsim.geo.GeoPoint;
import com.marketsim.registry.Candidate;

import java.util.List;

/**
 * Everything that happened to one simulated search.
 *
 * @param postalCode cell the point was drawn from, null for location-based markets
 * @param candidates eligible providers, nearest first
 * @param bids bidders in distance order
 * @param connectedProviderId null when no bid converted
 * @param connectionDistanceKm NaN when not connected
 * @param connectionProbability realized probability of the converting bid, NaN when not connected
 * @param connectedScore NaN when not connected
 */
public record SearchOutcome(
    int searchIndex,
    GeoPoint point,
    String postalCode,
    List<Candidate> candidates,
    List<BidRecord> bids,
    String connectedProviderId,
    double connectionDistanceKm,
    double connectionProbability,
    double connectedScore,
    List<IterationAnomaly> anomalies
) {
    public SearchOutcome {
        candidates = List.copyOf(candidates);
        bids = List.copyOf(bids);
        anomalies = List.copyOf(anomalies);
    }

    static SearchOutcome noCandidates(int searchIndex, GeoPoint point, String postalCode) {
        return new SearchOutcome(searchIndex, point, postalCode, List.of(), List.of(),
            null, Double.NaN, Double.NaN, Double.NaN, List.of());
    }

    public int eligibleCount() {
        return candidates.size();
    }

    public int bidCount() {
        return bids.size();
    }

    public boolean hasEligibleProvider() {
        return !candidates.isEmpty();
    }

    public boolean connected() {
        return connectedProviderId != null;
    }

    public int anomalyCount() {
        return anomalies.size();
    }
}
