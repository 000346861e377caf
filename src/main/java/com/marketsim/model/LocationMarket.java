package com.marketsim.model;

import com.marketsim.geo.GeoMath;
import com.marketsim.geo.GeoPoint;
import com.marketsim.geo.H3Grid;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Random;

import static com.marketsim.error.ValidationException.require;

/**
 * Circular market: every point within {@code radiusKm} of {@code center}.
 */
public record LocationMarket(String marketId, GeoPoint center, double radiusKm) implements Market {

    public LocationMarket {
        require(marketId != null && !marketId.isBlank(), "Market id must not be blank");
        require(center != null, "Market " + marketId + " has no center");
        require(Double.isFinite(radiusKm) && radiusKm > 0,
            "radius_km must be positive for market " + marketId + ", got: " + radiusKm);
    }

    @Override
    public MarketKind kind() {
        return MarketKind.LOCATION;
    }

    @Override
    public SampledPoint sampleSearchPoint(Random rng) {
        return new SampledPoint(GeoMath.randomPointInCircle(center, radiusKm, rng), null);
    }

    @Override
    public boolean contains(GeoPoint point) {
        return GeoMath.distanceKm(center, point) <= radiusKm;
    }

    @Override
    public boolean admits(Provider provider) {
        return contains(provider.location());
    }

    @Override
    public double totalAreaKm2() {
        return Math.PI * radiusKm * radiusKm;
    }

    @Override
    public OptionalDouble totalDemandWeight() {
        return OptionalDouble.empty();
    }

    @Override
    public List<GeoPoint> gridSamplePoints(int resolution) {
        var points = new ArrayList<GeoPoint>();
        for (long cell : H3Grid.cellsWithin(center, radiusKm, resolution)) {
            points.add(H3Grid.centroid(cell));
        }
        if (points.isEmpty()) {
            points.add(center);
        }
        return points;
    }

    @Override
    public List<Disk> disks() {
        return List.of(new Disk(marketId, center, radiusKm));
    }

    @Override
    public GeoPoint centroid() {
        return center;
    }
}
