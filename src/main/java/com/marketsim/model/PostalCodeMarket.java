package com.marketsim.model;

import com.marketsim.geo.GeoMath;
import com.marketsim.geo.GeoPoint;
import com.marketsim.geo.H3Grid;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Random;

import static com.marketsim.error.ValidationException.require;

/**
 * Market made of postal code cells. Searches land in a cell with probability proportional
 * to its demand weight, then uniformly inside that cell's sampling disk.
 */
public record PostalCodeMarket(String marketId, List<PostalCell> cells) implements Market {

    public PostalCodeMarket {
        require(marketId != null && !marketId.isBlank(), "Market id must not be blank");
        require(cells != null && !cells.isEmpty(), "Market " + marketId + " has no postal codes");
        cells = List.copyOf(cells);

        var seen = new HashSet<String>();
        double total = 0;
        for (var cell : cells) {
            require(seen.add(cell.postalCode()),
                "Duplicate postal code " + cell.postalCode() + " in market " + marketId);
            total += cell.demandWeight();
        }
        require(total > 0, "Market " + marketId + " has zero total STR TAM");
    }

    @Override
    public MarketKind kind() {
        return MarketKind.POSTAL_CODE;
    }

    @Override
    public SampledPoint sampleSearchPoint(Random rng) {
        return randomPointInCells(cells, rng);
    }

    /**
     * Picks a cell by demand weight (one draw), then a uniform point in its sampling disk
     * (two draws).
     */
    public static SampledPoint randomPointInCells(List<PostalCell> cells, Random rng) {
        PostalCell cell = cells.get(GeoMath.weightedIndex(cumulativeWeights(cells), rng));
        GeoPoint point = GeoMath.randomPointInCircle(cell.centroid(), cell.samplingRadiusKm(), rng);
        return new SampledPoint(point, cell.postalCode());
    }

    @Override
    public boolean contains(GeoPoint point) {
        for (var cell : cells) {
            if (GeoMath.distanceKm(cell.centroid(), point) <= cell.samplingRadiusKm()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean admits(Provider provider) {
        if (provider.postalCode() == null) {
            return contains(provider.location());
        }
        for (var cell : cells) {
            if (cell.postalCode().equals(provider.postalCode())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public double totalAreaKm2() {
        return cells.stream().mapToDouble(PostalCell::effectiveAreaKm2).sum();
    }

    @Override
    public OptionalDouble totalDemandWeight() {
        return OptionalDouble.of(cells.stream().mapToDouble(PostalCell::demandWeight).sum());
    }

    /**
     * Union of the grid points inside each cell's sampling disk. A cell too small to hold
     * any grid centroid is represented by its own centroid.
     */
    @Override
    public List<GeoPoint> gridSamplePoints(int resolution) {
        var cellIds = new LinkedHashSet<Long>();
        var points = new ArrayList<GeoPoint>();
        for (var cell : cells) {
            var within = H3Grid.cellsWithin(cell.centroid(), cell.samplingRadiusKm(), resolution);
            if (within.isEmpty()) {
                points.add(cell.centroid());
            }
            for (long id : within) {
                if (cellIds.add(id)) {
                    points.add(H3Grid.centroid(id));
                }
            }
        }
        return points;
    }

    @Override
    public List<Disk> disks() {
        return cells.stream()
            .map(cell -> new Disk(cell.postalCode(), cell.centroid(), cell.samplingRadiusKm()))
            .toList();
    }

    /**
     * Demand-weighted mean of the cell centroids.
     */
    @Override
    public GeoPoint centroid() {
        double total = totalDemandWeight().getAsDouble();
        double lat = 0;
        double lon = 0;
        for (var cell : cells) {
            lat += cell.centroid().latitude() * cell.demandWeight() / total;
            lon += cell.centroid().longitude() * cell.demandWeight() / total;
        }
        return new GeoPoint(lat, lon);
    }

    public double demandShare(PostalCell cell) {
        return cell.demandWeight() / totalDemandWeight().getAsDouble();
    }

    private static double[] cumulativeWeights(List<PostalCell> cells) {
        var cumulative = new double[cells.size()];
        double running = 0;
        for (int i = 0; i < cells.size(); i++) {
            running += cells.get(i).demandWeight();
            cumulative[i] = running;
        }
        return cumulative;
    }
}
