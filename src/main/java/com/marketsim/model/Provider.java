package com.marketsim.model;

import com.marketsim.geo.GeoMath;
import com.marketsim.geo.GeoPoint;

import static com.marketsim.error.ValidationException.require;

/**
 * A cleaner as seen by the simulation: where they are, how far they travel,
 * whether they take new work, and how loaded they are.
 *
 * <p>Snapshot semantics: capacity fields feed the probability model and are never
 * updated while a run is in progress.
 */
public record Provider(
    String id,
    GeoPoint location,
    String postalCode,
    double serviceRadiusKm,
    boolean biddingActive,
    boolean assignmentActive,
    double score,
    int teamSize,
    int activeConnections
) {
    public Provider {
        require(id != null && !id.isBlank(), "Contractor id must not be blank");
        require(location != null, "Cleaner " + id + " has no location");
        require(Double.isFinite(serviceRadiusKm) && serviceRadiusKm > 0,
            "Service radius must be positive for cleaner " + id + ", got: " + serviceRadiusKm);
        require(Double.isFinite(score) && score >= 0 && score <= 1,
            "Cleaner score must be between 0 and 1 for cleaner " + id + ", got: " + score);
        require(teamSize >= 1, "Team size must be at least 1 for cleaner " + id + ", got: " + teamSize);
        require(activeConnections >= 0,
            "Active connections cannot be negative for cleaner " + id + ", got: " + activeConnections);
    }

    public double distanceKmTo(GeoPoint point) {
        return GeoMath.distanceKm(location, point);
    }

    public boolean reaches(GeoPoint point) {
        return distanceKmTo(point) <= serviceRadiusKm;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Defaults mirror the loader's defaults for optional columns.
     */
    public static final class Builder {
        private final String id;
        private GeoPoint location;
        private String postalCode;
        private double serviceRadiusKm = 10.0;
        private boolean biddingActive = true;
        private boolean assignmentActive = true;
        private double score = 0.5;
        private int teamSize = 1;
        private int activeConnections = 0;

        private Builder(String id) {
            this.id = id;
        }

        public Builder location(double latitude, double longitude) {
            this.location = new GeoPoint(latitude, longitude);
            return this;
        }

        public Builder location(GeoPoint location) {
            this.location = location;
            return this;
        }

        public Builder postalCode(String postalCode) {
            this.postalCode = postalCode;
            return this;
        }

        public Builder serviceRadiusKm(double serviceRadiusKm) {
            this.serviceRadiusKm = serviceRadiusKm;
            return this;
        }

        public Builder biddingActive(boolean biddingActive) {
            this.biddingActive = biddingActive;
            return this;
        }

        public Builder assignmentActive(boolean assignmentActive) {
            this.assignmentActive = assignmentActive;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder teamSize(int teamSize) {
            this.teamSize = teamSize;
            return this;
        }

        public Builder activeConnections(int activeConnections) {
            this.activeConnections = activeConnections;
            return this;
        }

        public Provider build() {
            return new Provider(id, location, postalCode, serviceRadiusKm, biddingActive,
                assignmentActive, score, teamSize, activeConnections);
        }
    }
}
