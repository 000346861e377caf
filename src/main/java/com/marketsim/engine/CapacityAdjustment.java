package com.marketsim.engine;

import com.marketsim.model.Provider;

import static com.marketsim.error.ValidationException.require;

/**
 * Multiplier on the bid probability that shrinks as a provider fills up.
 */
@FunctionalInterface
public interface CapacityAdjustment {

    double factor(Provider provider);

    CapacityAdjustment NONE = provider -> 1.0;

    /**
     * {@code max(floor, 1 - active / (teamSize * maxPerMember))}. Never reaches zero, so a
     * fully booked provider can still bid occasionally.
     */
    static CapacityAdjustment linearWithFloor(int maxConnectionsPerMember, double floor) {
        require(maxConnectionsPerMember > 0,
            "max_connections_per_member must be positive, got: " + maxConnectionsPerMember);
        require(Double.isFinite(floor) && floor > 0 && floor <= 1,
            "min_capacity_factor must be in (0, 1], got: " + floor);
        return provider -> {
            double capacity = (double) provider.teamSize() * maxConnectionsPerMember;
            double utilization = provider.activeConnections() / capacity;
            return Math.max(floor, 1.0 - utilization);
        };
    }
}
