package com.marketsim.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Summary of a batch of searches over one market.
 *
 * <p>Rates with an empty denominator are reported as 0. Raw distributions are ordered by
 * search index and left out of the JSON form.
 */
public record MarketMetrics(
    @JsonProperty("market_id") String marketId,
    @JsonProperty("market_type") String marketType,
    @JsonProperty("market_area_km2") double marketAreaKm2,

    @JsonProperty("total_searches") long totalSearches,
    @JsonProperty("searches_with_eligible") long searchesWithEligible,
    @JsonProperty("total_offers") long totalOffers,
    @JsonProperty("total_bids") long totalBids,
    @JsonProperty("total_connections") long totalConnections,

    @JsonProperty("connection_rate") double connectionRate,
    @JsonProperty("coverage_ratio") double coverageRatio,
    @JsonProperty("search_density") double searchDensity,
    @JsonProperty("connection_density") double connectionDensity,

    @JsonProperty("avg_bids_per_search") double avgBidsPerSearch,
    @JsonProperty("median_bids_per_search") double medianBidsPerSearch,
    @JsonProperty("pct_searches_with_bids") double pctSearchesWithBids,
    @JsonProperty("bid_rate_per_offer") double bidRatePerOffer,
    @JsonProperty("connections_per_bid") double connectionsPerBid,
    @JsonProperty("unique_providers_offered") int uniqueProvidersOffered,
    @JsonProperty("anomaly_count") long anomalyCount,

    @JsonProperty("offers_per_search") DistributionSummary offersPerSearch,
    @JsonProperty("offer_distance_km") DistributionSummary offerDistance,
    @JsonProperty("bid_distance_km") DistributionSummary bidDistance,
    @JsonProperty("connection_distance_km") DistributionSummary connectionDistance,
    @JsonProperty("offer_score") DistributionSummary offerScore,
    @JsonProperty("bid_score") DistributionSummary bidScore,
    @JsonProperty("connection_score") DistributionSummary connectionScore,

    @JsonIgnore List<Double> connectionDistances,
    @JsonIgnore List<Double> connectionScores
) {
    public MarketMetrics {
        connectionDistances = List.copyOf(connectionDistances);
        connectionScores = List.copyOf(connectionScores);
    }
}
