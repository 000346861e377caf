package com.marketsim.engine;

import static com.marketsim.error.ValidationException.require;

/**
 * Multiplier applied to bid and connection probabilities based on a provider's quality score.
 * Implementations must be pure and non-decreasing in {@code score}.
 */
@FunctionalInterface
public interface QualityAdjustment {

    double factor(double score);

    QualityAdjustment NEUTRAL = score -> 1.0;

    /**
     * {@code 1 + weight * (score - 0.5)}: neutral at 0.5, ranges over {@code [1 - w/2, 1 + w/2]}.
     * Weights of 2 or more would zero out (or invert) the lowest scores, so they are rejected.
     */
    static QualityAdjustment linear(double weight) {
        require(Double.isFinite(weight) && weight >= 0 && weight < 2,
            "quality_weight must be in [0, 2), got: " + weight);
        return score -> 1.0 + weight * (score - 0.5);
    }

    /**
     * {@code 2 / (1 + exp(-k * (score - 0.5)))}: neutral at 0.5, bounded in (0, 2).
     */
    static QualityAdjustment sigmoid(double steepness) {
        require(Double.isFinite(steepness) && steepness >= 0,
            "Sigmoid steepness must be non-negative, got: " + steepness);
        return score -> 2.0 / (1.0 + Math.exp(-steepness * (score - 0.5)));
    }
}
