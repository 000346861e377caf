package com.marketsim.geo;

import java.util.Random;

/**
 * Great-circle math on a spherical Earth.
 *
 * All randomized helpers take the generator as an argument; nothing here keeps
 * random state of its own, so callers control reproducibility through the seed.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoMath() {}

    /**
     * Haversine distance in kilometers.
     */
    public static double distanceKm(GeoPoint a, GeoPoint b) {
        double lat1 = Math.toRadians(a.latitude());
        double lat2 = Math.toRadians(b.latitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(b.longitude() - a.longitude());

        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
                   Math.cos(lat1) * Math.cos(lat2) *
                   Math.sin(dLon / 2) * Math.sin(dLon / 2);

        // clamp: rounding can push h a hair above 1 for antipodal points
        double c = 2 * Math.atan2(Math.sqrt(Math.min(1.0, h)), Math.sqrt(Math.max(0.0, 1 - h)));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Point reached by travelling {@code distanceKm} from {@code start} along the given bearing.
     */
    public static GeoPoint destination(GeoPoint start, double bearingDegrees, double distanceKm) {
        double angularDistance = distanceKm / EARTH_RADIUS_KM;
        double bearing = Math.toRadians(bearingDegrees);

        double lat1 = Math.toRadians(start.latitude());
        double lon1 = Math.toRadians(start.longitude());

        double lat2 = Math.asin(
            Math.sin(lat1) * Math.cos(angularDistance) +
            Math.cos(lat1) * Math.sin(angularDistance) * Math.cos(bearing)
        );

        double lon2 = lon1 + Math.atan2(
            Math.sin(bearing) * Math.sin(angularDistance) * Math.cos(lat1),
            Math.cos(angularDistance) - Math.sin(lat1) * Math.sin(lat2)
        );

        double lat = Math.max(-90.0, Math.min(90.0, Math.toDegrees(lat2)));
        return new GeoPoint(lat, normalizeLongitude(Math.toDegrees(lon2)));
    }

    /**
     * Uniform-by-area point inside a circle. Draws exactly two numbers from {@code rng}:
     * first the radial fraction, then the angle.
     */
    public static GeoPoint randomPointInCircle(GeoPoint center, double radiusKm, Random rng) {
        if (radiusKm <= 0) {
            return center;
        }
        double r = radiusKm * Math.sqrt(rng.nextDouble());
        double theta = 360.0 * rng.nextDouble();
        return destination(center, theta, r);
    }

    /**
     * Picks an index with probability proportional to its weight. One draw from {@code rng}.
     * Zero-weight entries are never selected as long as the total is positive.
     *
     * @param cumulativeWeights running sums of non-negative weights, last entry is the total
     */
    public static int weightedIndex(double[] cumulativeWeights, Random rng) {
        double total = cumulativeWeights[cumulativeWeights.length - 1];
        double target = rng.nextDouble() * total;

        int lo = 0;
        int hi = cumulativeWeights.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (cumulativeWeights[mid] > target) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    static double normalizeLongitude(double lon) {
        double normalized = ((lon + 540.0) % 360.0) - 180.0;
        if (normalized == -180.0 && lon > 0) {
            return 180.0;
        }
        return normalized;
    }
}
