package com.marketsim.registry;

import com.marketsim.model.Provider;

import java.util.Comparator;

/**
 * An eligible provider together with its distance to the search point.
 */
public record Candidate(Provider provider, double distanceKm) {

    /**
     * Nearest first; equal distances fall back to provider id so ordering is stable across runs.
     */
    public static final Comparator<Candidate> BY_DISTANCE_THEN_ID =
        Comparator.comparingDouble(Candidate::distanceKm)
                  .thenComparing(c -> c.provider().id());

    public String providerId() {
        return provider.id();
    }
}
