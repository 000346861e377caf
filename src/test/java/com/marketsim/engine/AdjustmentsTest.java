package com.marketsim.engine;

import com.marketsim.error.ValidationException;
import com.marketsim.model.Provider;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdjustmentsTest {

    private static Provider loaded(int teamSize, int active) {
        return Provider.builder("C-1").location(40.75, -73.99).teamSize(teamSize).activeConnections(active).build();
    }

    @Test
    void linearQuality_isNeutralAtMidpoint() {
        assertEquals(1.0, QualityAdjustment.linear(1.0).factor(0.5), 1e-12);
    }

    @Test
    void linearQuality_spansHalfWeightEitherSide() {
        var q = QualityAdjustment.linear(1.0);
        assertEquals(0.5, q.factor(0.0), 1e-12);
        assertEquals(1.4, q.factor(0.9), 1e-12);
        assertEquals(1.5, q.factor(1.0), 1e-12);
    }

    @Test
    void linearQuality_isMonotonic() {
        var q = QualityAdjustment.linear(1.5);
        double previous = q.factor(0);
        for (double s = 0.05; s <= 1.0; s += 0.05) {
            assertTrue(q.factor(s) >= previous);
            previous = q.factor(s);
        }
    }

    @Test
    void linearQuality_zeroWeightIsNeutral() {
        assertEquals(1.0, QualityAdjustment.linear(0).factor(0.1), 1e-12);
    }

    @Test
    void linearQuality_rejectsWeightsThatCanZeroOut() {
        assertThrows(ValidationException.class, () -> QualityAdjustment.linear(2.0));
        assertThrows(ValidationException.class, () -> QualityAdjustment.linear(-0.1));
    }

    @Test
    void sigmoidQuality_isBoundedAndCentered() {
        var q = QualityAdjustment.sigmoid(8);
        assertEquals(1.0, q.factor(0.5), 1e-12);
        assertTrue(q.factor(0.0) > 0 && q.factor(0.0) < 1);
        assertTrue(q.factor(1.0) > 1 && q.factor(1.0) < 2);
    }

    @Test
    void capacity_fullWhenIdle() {
        assertEquals(1.0, CapacityAdjustment.linearWithFloor(10, 0.1).factor(loaded(2, 0)), 1e-12);
    }

    @Test
    void capacity_scalesWithUtilization() {
        // team of 2 at 10 per member: 15 of 20 slots used
        assertEquals(0.25, CapacityAdjustment.linearWithFloor(10, 0.1).factor(loaded(2, 15)), 1e-12);
    }

    @Test
    void capacity_neverDropsBelowFloor() {
        var capacity = CapacityAdjustment.linearWithFloor(10, 0.1);
        assertEquals(0.1, capacity.factor(loaded(1, 10)), 1e-12);
        assertEquals(0.1, capacity.factor(loaded(1, 50)), 1e-12);
    }

    @Test
    void capacity_rejectsInvalidParameters() {
        assertThrows(ValidationException.class, () -> CapacityAdjustment.linearWithFloor(0, 0.1));
        assertThrows(ValidationException.class, () -> CapacityAdjustment.linearWithFloor(10, 0));
        assertThrows(ValidationException.class, () -> CapacityAdjustment.linearWithFloor(10, 1.5));
    }

    @Test
    void probabilityModel_appliesDecayQualityAndCapacity() {
        var model = new ProbabilityModel(0.5, 0.8, 0.2,
            QualityAdjustment.linear(1.0), CapacityAdjustment.linearWithFloor(10, 0.1));
        var provider = Provider.builder("C-1").location(40.75, -73.99).score(0.9).teamSize(1).activeConnections(5).build();

        double decay = Math.exp(-0.2 * 3.0);
        assertEquals(0.5 * decay * 1.4 * 0.5, model.rawBidProbability(provider, 3.0), 1e-12);
        assertEquals(0.8 * decay * 1.4, model.rawConnectionProbability(provider, 3.0), 1e-12);
    }

    @Test
    void clamp_mapsIntoUnitInterval() {
        assertEquals(0.0, ProbabilityModel.clamp(-0.3));
        assertEquals(0.0, ProbabilityModel.clamp(Double.NaN));
        assertEquals(1.0, ProbabilityModel.clamp(1.7));
        assertEquals(0.42, ProbabilityModel.clamp(0.42));
        assertTrue(ProbabilityModel.isAnomalous(-0.01));
        assertTrue(ProbabilityModel.isAnomalous(Double.NaN));
        assertFalse(ProbabilityModel.isAnomalous(1.7));
    }
}
