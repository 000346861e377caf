package com.marketsim.io;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.marketsim.engine.BidRecord;
import com.marketsim.engine.SearchOutcome;

import java.util.stream.Collectors;

/**
 * One line of {@code search_results.csv}. Missing values are written as empty cells.
 */
@JsonPropertyOrder({
    "supply_iteration", "search_index", "latitude", "longitude", "postal_code",
    "eligible_count", "bid_count", "bidder_ids", "connected_id",
    "connection_distance_km", "connected_score", "connection_probability", "anomaly_count"
})
record SearchResultRow(
    @JsonProperty("supply_iteration") int supplyIteration,
    @JsonProperty("search_index") int searchIndex,
    @JsonProperty("latitude") double latitude,
    @JsonProperty("longitude") double longitude,
    @JsonProperty("postal_code") String postalCode,
    @JsonProperty("eligible_count") int eligibleCount,
    @JsonProperty("bid_count") int bidCount,
    @JsonProperty("bidder_ids") String bidderIds,
    @JsonProperty("connected_id") String connectedId,
    @JsonProperty("connection_distance_km") Double connectionDistanceKm,
    @JsonProperty("connected_score") Double connectedScore,
    @JsonProperty("connection_probability") Double connectionProbability,
    @JsonProperty("anomaly_count") int anomalyCount
) {
    static SearchResultRow of(int supplyIteration, SearchOutcome outcome) {
        return new SearchResultRow(
            supplyIteration,
            outcome.searchIndex(),
            outcome.point().latitude(),
            outcome.point().longitude(),
            outcome.postalCode(),
            outcome.eligibleCount(),
            outcome.bidCount(),
            outcome.bids().stream().map(BidRecord::providerId).collect(Collectors.joining(";")),
            outcome.connectedProviderId(),
            outcome.connected() ? outcome.connectionDistanceKm() : null,
            outcome.connected() ? outcome.connectedScore() : null,
            outcome.connected() ? outcome.connectionProbability() : null,
            outcome.anomalyCount()
        );
    }
}
