package com.marketsim.engine;

import com.marketsim.model.Market;
import com.marketsim.model.SampledPoint;
import com.marketsim.registry.Candidate;
import com.marketsim.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.marketsim.error.ValidationException.require;

/**
 * Runs one search at a time: eligibility, bids, then first-acceptor connection.
 *
 * <p>Stateless between calls. All variability comes from the {@link Random} passed in, and
 * draws happen in a fixed order: one per candidate for the bid, then one per bidder until the
 * first connection succeeds.
 */
public class MatchingEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);

    private final ProviderRegistry registry;
    private final ProbabilityModel model;
    private final double searchRadiusKm;

    public MatchingEngine(ProviderRegistry registry, ProbabilityModel model, double searchRadiusKm) {
        require(registry != null, "Provider registry is required");
        require(model != null, "Probability model is required");
        require(Double.isFinite(searchRadiusKm) && searchRadiusKm > 0,
            "search_radius_km must be positive, got: " + searchRadiusKm);
        this.registry = registry;
        this.model = model;
        this.searchRadiusKm = searchRadiusKm;
    }

    /**
     * Samples a point from {@code market} and matches it.
     */
    public SearchOutcome simulateSearch(Market market, int searchIndex, Random rng) {
        return match(searchIndex, market.sampleSearchPoint(rng), rng);
    }

    public SearchOutcome match(int searchIndex, SampledPoint sampled, Random rng) {
        List<Candidate> candidates = registry.eligibleProviders(sampled.point(), searchRadiusKm);
        if (candidates.isEmpty()) {
            log.debug("Search {} at {} has no eligible providers", searchIndex, sampled.point());
            return SearchOutcome.noCandidates(searchIndex, sampled.point(), sampled.postalCode());
        }

        var anomalies = new ArrayList<IterationAnomaly>();

        var bidders = new ArrayList<Candidate>();
        var bidProbabilities = new ArrayList<Double>();
        for (var candidate : candidates) {
            double u = rng.nextDouble();
            double raw = model.rawBidProbability(candidate.provider(), candidate.distanceKm());
            double p = checked(raw, searchIndex, candidate, IterationAnomaly.Stage.BID, anomalies);
            if (u < p) {
                bidders.add(candidate);
                bidProbabilities.add(p);
            }
        }

        var bids = new ArrayList<BidRecord>(bidders.size());
        Candidate winner = null;
        double winnerProbability = Double.NaN;
        for (int i = 0; i < bidders.size(); i++) {
            var bidder = bidders.get(i);
            var provider = bidder.provider();
            if (winner != null) {
                bids.add(new BidRecord(provider.id(), bidder.distanceKm(), provider.score(),
                    bidProbabilities.get(i), Double.NaN, false));
                continue;
            }
            double u = rng.nextDouble();
            double raw = model.rawConnectionProbability(provider, bidder.distanceKm());
            double p = checked(raw, searchIndex, bidder, IterationAnomaly.Stage.CONNECTION, anomalies);
            boolean converted = u < p;
            bids.add(new BidRecord(provider.id(), bidder.distanceKm(), provider.score(),
                bidProbabilities.get(i), p, converted));
            if (converted) {
                winner = bidder;
                winnerProbability = p;
            }
        }

        if (winner == null) {
            log.debug("Search {}: {} eligible, {} bids, no connection", searchIndex, candidates.size(), bids.size());
            return new SearchOutcome(searchIndex, sampled.point(), sampled.postalCode(), candidates, bids,
                null, Double.NaN, Double.NaN, Double.NaN, anomalies);
        }

        log.debug("Search {}: {} eligible, {} bids, connected to {} at {} km",
            searchIndex, candidates.size(), bids.size(), winner.providerId(),
            String.format("%.2f", winner.distanceKm()));
        return new SearchOutcome(searchIndex, sampled.point(), sampled.postalCode(), candidates, bids,
            winner.providerId(), winner.distanceKm(), winnerProbability, winner.provider().score(), anomalies);
    }

    private static double checked(double raw, int searchIndex, Candidate candidate,
                                  IterationAnomaly.Stage stage, List<IterationAnomaly> anomalies) {
        if (ProbabilityModel.isAnomalous(raw)) {
            var anomaly = new IterationAnomaly(searchIndex, candidate.providerId(), stage, raw);
            anomalies.add(anomaly);
            log.warn("Clamping anomalous {} probability {} for provider {} in search {}",
                stage, raw, candidate.providerId(), searchIndex);
        }
        return ProbabilityModel.clamp(raw);
    }

    public double searchRadiusKm() {
        return searchRadiusKm;
    }
}
