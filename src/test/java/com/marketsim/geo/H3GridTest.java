package com.marketsim.geo;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class H3GridTest {

    private static final GeoPoint MIDTOWN = GeoPoint.of(40.75, -73.99);

    @Test
    void cellOfReturnsNonZero() {
        assertNotEquals(0L, H3Grid.cellOf(MIDTOWN, 6));
    }

    @Test
    void centroidIsCloseToOriginalPoint() {
        long cell = H3Grid.cellOf(MIDTOWN, 9);
        // resolution 9 cells are ~0.2 km across
        assertTrue(GeoMath.distanceKm(MIDTOWN, H3Grid.centroid(cell)) < 0.5);
    }

    @Test
    void ringsCoveringReachEveryPointWithinRadius() {
        int res = 6;
        long origin = H3Grid.cellOf(MIDTOWN, res);
        double radius = 25.0;
        int rings = H3Grid.ringsCovering(radius, H3Grid.centroidSpacingKm(origin));
        var disk = new HashSet<>(H3Grid.disk(origin, rings));

        var rng = new Random(5);
        for (int i = 0; i < 2_000; i++) {
            var p = GeoMath.randomPointInCircle(MIDTOWN, radius, rng);
            assertTrue(disk.contains(H3Grid.cellOf(p, res)), "point " + p + " escaped the ring cover");
        }
    }

    @Test
    void ringsCoveringIsAtLeastOne() {
        assertEquals(1, H3Grid.ringsCovering(0, 5));
        assertTrue(H3Grid.ringsCovering(1, 5) >= 1);
    }

    @Test
    void cellsWithinKeepsCentroidsInsideRadius() {
        var cells = H3Grid.cellsWithin(MIDTOWN, 3.0, 8);
        assertFalse(cells.isEmpty());
        for (long cell : cells) {
            assertTrue(GeoMath.distanceKm(MIDTOWN, H3Grid.centroid(cell)) <= 3.0);
        }
    }

    @Test
    void expectedCellCountGrowsWithResolution() {
        assertTrue(H3Grid.expectedCellCount(100, 9) > H3Grid.expectedCellCount(100, 8));
    }
}
