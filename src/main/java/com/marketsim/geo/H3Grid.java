package com.marketsim.geo;

import com.uber.h3core.AreaUnit;
import com.uber.h3core.H3Core;
import com.uber.h3core.util.LatLng;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Thin helper over H3 for radius queries.
 *
 * H3 answers "which cells are within k rings", not "which cells are within r km", so
 * the ring count is derived from the measured centroid spacing with a safety margin.
 * Callers always re-check exact haversine distance on whatever the rings return.
 */
public final class H3Grid {

    // H3Core is thread-safe, one instance per JVM is enough
    public static final H3Core H3;

    // centroid spacing is not uniform across a k-ring; under-estimating it only costs extra cells
    private static final double SPACING_MARGIN = 0.75;

    static {
        try {
            H3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private H3Grid() {}

    public static long cellOf(GeoPoint point, int resolution) {
        return H3.latLngToCell(point.latitude(), point.longitude(), resolution);
    }

    public static GeoPoint centroid(long cell) {
        LatLng latLng = H3.cellToLatLng(cell);
        return new GeoPoint(latLng.lat, GeoMath.normalizeLongitude(latLng.lng));
    }

    /**
     * Smallest distance between the centroid of {@code cell} and the centroids of its neighbours.
     */
    public static double centroidSpacingKm(long cell) {
        GeoPoint origin = centroid(cell);
        double min = Double.MAX_VALUE;
        for (long neighbour : H3.gridDisk(cell, 1)) {
            if (neighbour == cell) {
                continue;
            }
            min = Math.min(min, GeoMath.distanceKm(origin, centroid(neighbour)));
        }
        return min;
    }

    /**
     * Number of rings around a cell that is guaranteed to contain every point within
     * {@code radiusKm} of any point inside the cell.
     */
    public static int ringsCovering(double radiusKm, double spacingKm) {
        if (radiusKm <= 0) {
            return 1;
        }
        return (int) Math.ceil(radiusKm / (spacingKm * SPACING_MARGIN)) + 1;
    }

    public static List<Long> disk(long cell, int rings) {
        return H3.gridDisk(cell, rings);
    }

    /**
     * Cells whose centroid lies within {@code radiusKm} of {@code center}.
     */
    public static List<Long> cellsWithin(GeoPoint center, double radiusKm, int resolution) {
        long origin = cellOf(center, resolution);
        int rings = ringsCovering(radiusKm, centroidSpacingKm(origin));

        var result = new ArrayList<Long>();
        for (long cell : H3.gridDisk(origin, rings)) {
            if (GeoMath.distanceKm(center, centroid(cell)) <= radiusKm) {
                result.add(cell);
            }
        }
        return result;
    }

    public static double averageCellAreaKm2(int resolution) {
        return H3.getHexagonAreaAvg(resolution, AreaUnit.km2);
    }

    /**
     * Rough number of cells needed to tile {@code areaKm2} at {@code resolution}.
     */
    public static long expectedCellCount(double areaKm2, int resolution) {
        return (long) Math.ceil(areaKm2 / averageCellAreaKm2(resolution));
    }
}
