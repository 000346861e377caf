package com.marketsim.geo;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GeoMathTest {

    private static final GeoPoint NYC = GeoPoint.of(40.7128, -74.0060);
    private static final GeoPoint LA = GeoPoint.of(34.0522, -118.2437);
    private static final GeoPoint CHICAGO = GeoPoint.of(41.8781, -87.6298);

    @Test
    void distance_isZeroForSamePoint() {
        assertEquals(0.0, GeoMath.distanceKm(NYC, NYC), 1e-9);
    }

    @Test
    void distance_isSymmetric() {
        assertEquals(GeoMath.distanceKm(NYC, LA), GeoMath.distanceKm(LA, NYC), 1e-9);
    }

    @Test
    void distance_nycToLaIsAbout3936Km() {
        assertEquals(3936, GeoMath.distanceKm(NYC, LA), 10);
    }

    @Test
    void distance_satisfiesTriangleInequality() {
        double direct = GeoMath.distanceKm(NYC, LA);
        double viaChicago = GeoMath.distanceKm(NYC, CHICAGO) + GeoMath.distanceKm(CHICAGO, LA);
        assertTrue(direct <= viaChicago + 1e-9);
    }

    @Test
    void distance_antipodalPointsDoNotProduceNaN() {
        double d = GeoMath.distanceKm(GeoPoint.of(0, 0), GeoPoint.of(0, 180));
        assertEquals(Math.PI * GeoMath.EARTH_RADIUS_KM, d, 1e-6);
    }

    @Test
    void destination_travelsRequestedDistance() {
        for (double bearing = 0; bearing < 360; bearing += 45) {
            var end = GeoMath.destination(NYC, bearing, 7.5);
            assertEquals(7.5, GeoMath.distanceKm(NYC, end), 1e-6, "bearing " + bearing);
        }
    }

    @Test
    void destination_wrapsAcrossAntimeridian() {
        var start = GeoPoint.of(0, 179.99);
        var end = GeoMath.destination(start, 90, 10);
        assertTrue(end.longitude() < 0, "expected wrap to negative longitude, got " + end.longitude());
        assertEquals(10, GeoMath.distanceKm(start, end), 1e-6);
    }

    @Test
    void randomPointInCircle_staysInsideRadius() {
        var rng = new Random(7);
        for (int i = 0; i < 2_000; i++) {
            var p = GeoMath.randomPointInCircle(NYC, 5.0, rng);
            assertTrue(GeoMath.distanceKm(NYC, p) <= 5.0 + 1e-9);
        }
    }

    @Test
    void randomPointInCircle_isUniformByArea() {
        // inner disk of half the radius holds a quarter of the area
        var rng = new Random(11);
        int n = 20_000;
        int inner = 0;
        for (int i = 0; i < n; i++) {
            if (GeoMath.distanceKm(NYC, GeoMath.randomPointInCircle(NYC, 10.0, rng)) <= 5.0) {
                inner++;
            }
        }
        assertEquals(0.25, (double) inner / n, 0.02);
    }

    @Test
    void randomPointInCircle_isReproducibleForSameSeed() {
        var a = GeoMath.randomPointInCircle(NYC, 3.0, new Random(99));
        var b = GeoMath.randomPointInCircle(NYC, 3.0, new Random(99));
        assertEquals(a, b);
    }

    @Test
    void randomPointInCircle_zeroRadiusReturnsCenter() {
        assertEquals(NYC, GeoMath.randomPointInCircle(NYC, 0, new Random(1)));
    }

    @Test
    void weightedIndex_neverPicksZeroWeight() {
        double[] cumulative = {0.0, 5.0, 5.0, 10.0};
        var rng = new Random(3);
        int[] counts = new int[4];
        for (int i = 0; i < 10_000; i++) {
            counts[GeoMath.weightedIndex(cumulative, rng)]++;
        }
        assertEquals(0, counts[0]);
        assertEquals(0, counts[2]);
        assertEquals(0.5, counts[1] / 10_000.0, 0.03);
    }

    @Test
    void normalizeLongitude_keepsRange() {
        assertEquals(-179.0, GeoMath.normalizeLongitude(181.0), 1e-9);
        assertEquals(179.0, GeoMath.normalizeLongitude(-181.0), 1e-9);
        assertEquals(180.0, GeoMath.normalizeLongitude(180.0), 1e-9);
        assertEquals(12.5, GeoMath.normalizeLongitude(12.5), 1e-9);
    }
}
