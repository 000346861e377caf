package com.marketsim.metrics;

import com.marketsim.engine.BidRecord;
import com.marketsim.engine.SearchOutcome;
import com.marketsim.model.Market;
import com.marketsim.registry.Candidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Streaming accumulator of search outcomes.
 *
 * <p>Counters add, sets union and samples concatenate, so {@link #merge} is associative and
 * commutative. Samples carry an ordering key of (supply iteration, search index) and are
 * sorted on that key in {@link #summarize}, which keeps the ordered distributions independent
 * of merge order. Not thread-safe: use one aggregator per thread and merge.
 */
public class MetricsAggregator {

    private final int supplyIteration;

    private long totalSearches;
    private long searchesWithEligible;
    private long searchesWithBids;
    private long totalOffers;
    private long totalBids;
    private long totalConnections;
    private long anomalyCount;

    private final Set<String> providersOffered = new HashSet<>();

    private final List<Sample> offersPerSearch = new ArrayList<>();
    private final List<Sample> bidsPerSearch = new ArrayList<>();
    private final List<Sample> offerDistances = new ArrayList<>();
    private final List<Sample> offerScores = new ArrayList<>();
    private final List<Sample> bidDistances = new ArrayList<>();
    private final List<Sample> bidScores = new ArrayList<>();
    private final List<Sample> connectionDistances = new ArrayList<>();
    private final List<Sample> connectionScores = new ArrayList<>();

    public MetricsAggregator() {
        this(0);
    }

    public MetricsAggregator(int supplyIteration) {
        this.supplyIteration = supplyIteration;
    }

    public MetricsAggregator add(SearchOutcome outcome) {
        long key = orderKey(outcome.searchIndex());

        totalSearches++;
        anomalyCount += outcome.anomalyCount();
        offersPerSearch.add(new Sample(key, outcome.eligibleCount()));
        bidsPerSearch.add(new Sample(key, outcome.bidCount()));

        if (outcome.hasEligibleProvider()) {
            searchesWithEligible++;
            totalOffers += outcome.eligibleCount();
            for (Candidate candidate : outcome.candidates()) {
                providersOffered.add(candidate.providerId());
                offerDistances.add(new Sample(key, candidate.distanceKm()));
                offerScores.add(new Sample(key, candidate.provider().score()));
            }
        }

        if (outcome.bidCount() > 0) {
            searchesWithBids++;
            totalBids += outcome.bidCount();
            for (BidRecord bid : outcome.bids()) {
                bidDistances.add(new Sample(key, bid.distanceKm()));
                bidScores.add(new Sample(key, bid.score()));
            }
        }

        if (outcome.connected()) {
            totalConnections++;
            connectionDistances.add(new Sample(key, outcome.connectionDistanceKm()));
            connectionScores.add(new Sample(key, outcome.connectedScore()));
        }
        return this;
    }

    public MetricsAggregator addAll(Iterable<SearchOutcome> outcomes) {
        for (var outcome : outcomes) {
            add(outcome);
        }
        return this;
    }

    /**
     * Folds {@code other} into this aggregator. {@code other} is left unchanged.
     */
    public MetricsAggregator merge(MetricsAggregator other) {
        totalSearches += other.totalSearches;
        searchesWithEligible += other.searchesWithEligible;
        searchesWithBids += other.searchesWithBids;
        totalOffers += other.totalOffers;
        totalBids += other.totalBids;
        totalConnections += other.totalConnections;
        anomalyCount += other.anomalyCount;
        providersOffered.addAll(other.providersOffered);
        offersPerSearch.addAll(other.offersPerSearch);
        bidsPerSearch.addAll(other.bidsPerSearch);
        offerDistances.addAll(other.offerDistances);
        offerScores.addAll(other.offerScores);
        bidDistances.addAll(other.bidDistances);
        bidScores.addAll(other.bidScores);
        connectionDistances.addAll(other.connectionDistances);
        connectionScores.addAll(other.connectionScores);
        return this;
    }

    public long totalSearches() {
        return totalSearches;
    }

    public long totalConnections() {
        return totalConnections;
    }

    public double connectionRate() {
        return ratio(totalConnections, totalSearches);
    }

    public MarketMetrics summarize(Market market) {
        double area = market.totalAreaKm2();
        var bidsPerSearchValues = ordered(bidsPerSearch);

        return new MarketMetrics(
            market.marketId(),
            market.kind().label(),
            area,
            totalSearches,
            searchesWithEligible,
            totalOffers,
            totalBids,
            totalConnections,
            ratio(totalConnections, totalSearches),
            ratio(searchesWithEligible, totalSearches),
            area > 0 ? totalSearches / area : 0.0,
            area > 0 ? totalConnections / area : 0.0,
            ratio(totalBids, totalSearches),
            bidsPerSearchValues.isEmpty() ? 0.0 : DistributionSummary.of(bidsPerSearchValues).median(),
            100.0 * ratio(searchesWithBids, totalSearches),
            ratio(totalBids, totalOffers),
            ratio(totalConnections, totalBids),
            providersOffered.size(),
            anomalyCount,
            DistributionSummary.of(ordered(offersPerSearch)),
            DistributionSummary.of(ordered(offerDistances)),
            DistributionSummary.of(ordered(bidDistances)),
            DistributionSummary.of(ordered(connectionDistances)),
            DistributionSummary.of(ordered(offerScores)),
            DistributionSummary.of(ordered(bidScores)),
            DistributionSummary.of(ordered(connectionScores)),
            ordered(connectionDistances),
            ordered(connectionScores)
        );
    }

    private long orderKey(int searchIndex) {
        return ((long) supplyIteration << 32) | (searchIndex & 0xFFFFFFFFL);
    }

    private static List<Double> ordered(List<Sample> samples) {
        // stable sort keeps per-candidate order within a search
        return samples.stream()
            .sorted(Comparator.comparingLong(Sample::key))
            .map(Sample::value)
            .toList();
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }

    private record Sample(long key, double value) {}
}
