package com.marketsim.simulation;

import com.marketsim.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulationConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        var config = SimulationConfig.defaults();
        assertEquals(100, config.searchIterations());
        assertEquals(1, config.supplyConfigurationIterations());
        assertEquals(42L, config.randomSeed());
        assertEquals(0.14, config.cleanerBaseBidProbability());
        assertEquals(0.4, config.connectionBaseProbability());
        assertEquals(0.2, config.distanceDecayFactor());
        assertEquals(10.0, config.searchRadiusKm());
        assertEquals(1, config.parallelism());
        assertEquals(8, config.coverageGridResolution());
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(ValidationException.class, () -> SimulationConfig.builder().searchIterations(0).build());
        assertThrows(ValidationException.class, () -> SimulationConfig.builder().supplyConfigurationIterations(-1).build());
        assertThrows(ValidationException.class, () -> SimulationConfig.builder().cleanerBaseBidProbability(1.1).build());
        assertThrows(ValidationException.class, () -> SimulationConfig.builder().connectionBaseProbability(-0.1).build());
        assertThrows(ValidationException.class, () -> SimulationConfig.builder().distanceDecayFactor(-1).build());
        assertThrows(ValidationException.class, () -> SimulationConfig.builder().searchRadiusKm(0).build());
        assertThrows(ValidationException.class, () -> SimulationConfig.builder().minCapacityFactor(0).build());
        assertThrows(ValidationException.class, () -> SimulationConfig.builder().qualityWeight(2).build());
        assertThrows(ValidationException.class, () -> SimulationConfig.builder().parallelism(0).build());
        assertThrows(ValidationException.class, () -> SimulationConfig.builder().coverageGridResolution(16).build());
    }

    @Test
    void toBuilderRoundTrips() {
        var config = SimulationConfig.builder().searchIterations(7).randomSeed(-3).qualityWeight(0.5).build();
        assertEquals(config, config.toBuilder().build());
        assertEquals(9, config.toBuilder().searchIterations(9).build().searchIterations());
    }

    @Test
    void totalSearchesMultipliesIterations() {
        var config = SimulationConfig.builder().searchIterations(50).supplyConfigurationIterations(4).build();
        assertEquals(200, config.totalSearches());
    }
}
