package com.marketsim.engine;

import com.marketsim.model.Provider;

import static com.marketsim.error.ValidationException.require;

/**
 * Unclamped bid and connection probabilities for a provider at a given distance.
 * Both decay exponentially with distance and scale with quality; only bids see capacity.
 */
public final class ProbabilityModel {

    private final double baseBidProbability;
    private final double baseConnectionProbability;
    private final double distanceDecayFactor;
    private final QualityAdjustment quality;
    private final CapacityAdjustment capacity;

    public ProbabilityModel(double baseBidProbability,
                            double baseConnectionProbability,
                            double distanceDecayFactor,
                            QualityAdjustment quality,
                            CapacityAdjustment capacity) {
        require(baseBidProbability >= 0 && baseBidProbability <= 1,
            "cleaner_base_bid_probability must be in [0, 1], got: " + baseBidProbability);
        require(baseConnectionProbability >= 0 && baseConnectionProbability <= 1,
            "connection_base_probability must be in [0, 1], got: " + baseConnectionProbability);
        require(Double.isFinite(distanceDecayFactor) && distanceDecayFactor >= 0,
            "distance_decay_factor must be non-negative, got: " + distanceDecayFactor);
        require(quality != null, "Quality adjustment is required");
        require(capacity != null, "Capacity adjustment is required");
        this.baseBidProbability = baseBidProbability;
        this.baseConnectionProbability = baseConnectionProbability;
        this.distanceDecayFactor = distanceDecayFactor;
        this.quality = quality;
        this.capacity = capacity;
    }

    public double rawBidProbability(Provider provider, double distanceKm) {
        return baseBidProbability
            * decay(distanceKm)
            * quality.factor(provider.score())
            * capacity.factor(provider);
    }

    public double rawConnectionProbability(Provider provider, double distanceKm) {
        return baseConnectionProbability
            * decay(distanceKm)
            * quality.factor(provider.score());
    }

    private double decay(double distanceKm) {
        return Math.exp(-distanceDecayFactor * distanceKm);
    }

    /**
     * Clamps into [0, 1]. NaN maps to 0.
     */
    public static double clamp(double value) {
        if (Double.isNaN(value) || value < 0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }

    public static boolean isAnomalous(double value) {
        return Double.isNaN(value) || value < 0;
    }
}
