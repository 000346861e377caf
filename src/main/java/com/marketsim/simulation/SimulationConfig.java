package com.marketsim.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketsim.engine.CapacityAdjustment;
import com.marketsim.engine.ProbabilityModel;
import com.marketsim.engine.QualityAdjustment;

import static com.marketsim.error.ValidationException.require;

/**
 * Parameters of one simulation run. Serialized as snake_case JSON.
 */
public record SimulationConfig(
    @JsonProperty("search_iterations") int searchIterations,
    @JsonProperty("supply_configuration_iterations") int supplyConfigurationIterations,
    @JsonProperty("random_seed") long randomSeed,
    @JsonProperty("cleaner_base_bid_probability") double cleanerBaseBidProbability,
    @JsonProperty("connection_base_probability") double connectionBaseProbability,
    @JsonProperty("distance_decay_factor") double distanceDecayFactor,
    @JsonProperty("search_radius_km") double searchRadiusKm,
    @JsonProperty("max_connections_per_member") int maxConnectionsPerMember,
    @JsonProperty("min_capacity_factor") double minCapacityFactor,
    @JsonProperty("quality_weight") double qualityWeight,
    @JsonProperty("parallelism") int parallelism,
    @JsonProperty("coverage_grid_resolution") int coverageGridResolution
) {
    public static final int DEFAULT_SEARCH_ITERATIONS = 100;
    public static final int DEFAULT_SUPPLY_ITERATIONS = 1;
    public static final long DEFAULT_RANDOM_SEED = 42L;
    public static final double DEFAULT_BASE_BID_PROBABILITY = 0.14;
    public static final double DEFAULT_CONNECTION_PROBABILITY = 0.4;
    public static final double DEFAULT_DISTANCE_DECAY = 0.2;
    public static final double DEFAULT_SEARCH_RADIUS_KM = 10.0;
    public static final int DEFAULT_MAX_CONNECTIONS_PER_MEMBER = 10;
    public static final double DEFAULT_MIN_CAPACITY_FACTOR = 0.1;
    public static final double DEFAULT_QUALITY_WEIGHT = 1.0;
    public static final int DEFAULT_PARALLELISM = 1;
    public static final int DEFAULT_COVERAGE_RESOLUTION = 8;

    public SimulationConfig {
        require(searchIterations > 0, "search_iterations must be positive, got: " + searchIterations);
        require(supplyConfigurationIterations > 0,
            "supply_configuration_iterations must be positive, got: " + supplyConfigurationIterations);
        require(cleanerBaseBidProbability >= 0 && cleanerBaseBidProbability <= 1,
            "cleaner_base_bid_probability must be between 0 and 1, got: " + cleanerBaseBidProbability);
        require(connectionBaseProbability >= 0 && connectionBaseProbability <= 1,
            "connection_base_probability must be between 0 and 1, got: " + connectionBaseProbability);
        require(Double.isFinite(distanceDecayFactor) && distanceDecayFactor >= 0,
            "distance_decay_factor must be non-negative, got: " + distanceDecayFactor);
        require(Double.isFinite(searchRadiusKm) && searchRadiusKm > 0,
            "search_radius_km must be positive, got: " + searchRadiusKm);
        require(maxConnectionsPerMember > 0,
            "max_connections_per_member must be positive, got: " + maxConnectionsPerMember);
        require(minCapacityFactor > 0 && minCapacityFactor <= 1,
            "min_capacity_factor must be in (0, 1], got: " + minCapacityFactor);
        require(qualityWeight >= 0 && qualityWeight < 2,
            "quality_weight must be in [0, 2), got: " + qualityWeight);
        require(parallelism > 0, "parallelism must be positive, got: " + parallelism);
        require(coverageGridResolution >= 0 && coverageGridResolution <= 15,
            "coverage_grid_resolution must be in [0, 15], got: " + coverageGridResolution);
    }

    public static SimulationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .searchIterations(searchIterations)
            .supplyConfigurationIterations(supplyConfigurationIterations)
            .randomSeed(randomSeed)
            .cleanerBaseBidProbability(cleanerBaseBidProbability)
            .connectionBaseProbability(connectionBaseProbability)
            .distanceDecayFactor(distanceDecayFactor)
            .searchRadiusKm(searchRadiusKm)
            .maxConnectionsPerMember(maxConnectionsPerMember)
            .minCapacityFactor(minCapacityFactor)
            .qualityWeight(qualityWeight)
            .parallelism(parallelism)
            .coverageGridResolution(coverageGridResolution);
    }

    public long totalSearches() {
        return (long) searchIterations * supplyConfigurationIterations;
    }

    public QualityAdjustment qualityAdjustment() {
        return QualityAdjustment.linear(qualityWeight);
    }

    public CapacityAdjustment capacityAdjustment() {
        return CapacityAdjustment.linearWithFloor(maxConnectionsPerMember, minCapacityFactor);
    }

    public ProbabilityModel probabilityModel(QualityAdjustment quality, CapacityAdjustment capacity) {
        return new ProbabilityModel(cleanerBaseBidProbability, connectionBaseProbability,
            distanceDecayFactor, quality, capacity);
    }

    public static final class Builder {
        private int searchIterations = DEFAULT_SEARCH_ITERATIONS;
        private int supplyConfigurationIterations = DEFAULT_SUPPLY_ITERATIONS;
        private long randomSeed = DEFAULT_RANDOM_SEED;
        private double cleanerBaseBidProbability = DEFAULT_BASE_BID_PROBABILITY;
        private double connectionBaseProbability = DEFAULT_CONNECTION_PROBABILITY;
        private double distanceDecayFactor = DEFAULT_DISTANCE_DECAY;
        private double searchRadiusKm = DEFAULT_SEARCH_RADIUS_KM;
        private int maxConnectionsPerMember = DEFAULT_MAX_CONNECTIONS_PER_MEMBER;
        private double minCapacityFactor = DEFAULT_MIN_CAPACITY_FACTOR;
        private double qualityWeight = DEFAULT_QUALITY_WEIGHT;
        private int parallelism = DEFAULT_PARALLELISM;
        private int coverageGridResolution = DEFAULT_COVERAGE_RESOLUTION;

        private Builder() {}

        public Builder searchIterations(int value) { this.searchIterations = value; return this; }
        public Builder supplyConfigurationIterations(int value) { this.supplyConfigurationIterations = value; return this; }
        public Builder randomSeed(long value) { this.randomSeed = value; return this; }
        public Builder cleanerBaseBidProbability(double value) { this.cleanerBaseBidProbability = value; return this; }
        public Builder connectionBaseProbability(double value) { this.connectionBaseProbability = value; return this; }
        public Builder distanceDecayFactor(double value) { this.distanceDecayFactor = value; return this; }
        public Builder searchRadiusKm(double value) { this.searchRadiusKm = value; return this; }
        public Builder maxConnectionsPerMember(int value) { this.maxConnectionsPerMember = value; return this; }
        public Builder minCapacityFactor(double value) { this.minCapacityFactor = value; return this; }
        public Builder qualityWeight(double value) { this.qualityWeight = value; return this; }
        public Builder parallelism(int value) { this.parallelism = value; return this; }
        public Builder coverageGridResolution(int value) { this.coverageGridResolution = value; return this; }

        public SimulationConfig build() {
            return new SimulationConfig(searchIterations, supplyConfigurationIterations, randomSeed,
                cleanerBaseBidProbability, connectionBaseProbability, distanceDecayFactor, searchRadiusKm,
                maxConnectionsPerMember, minCapacityFactor, qualityWeight, parallelism, coverageGridResolution);
        }
    }
}
