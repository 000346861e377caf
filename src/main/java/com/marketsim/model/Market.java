package com.marketsim.model;

import com.marketsim.geo.GeoPoint;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Random;

/**
 * Geographic area searches are generated in.
 *
 * <p>Two shapes exist: a union of postal code cells, or a circle. Both are immutable
 * once built and are shared read-only by every search of a run.
 */
public sealed interface Market permits PostalCodeMarket, LocationMarket {

    String marketId();

    MarketKind kind();

    /**
     * Draws a search location. Consumes the generator in a fixed order per market kind.
     */
    SampledPoint sampleSearchPoint(Random rng);

    boolean contains(GeoPoint point);

    /**
     * Whether a cleaner belongs to this market's supply: its postal code is one of the
     * market's cells, or for a circle (or a cleaner without a postal code) its home
     * location lies inside the market.
     */
    boolean admits(Provider provider);

    double totalAreaKm2();

    /**
     * Sum of postal code demand weights. Empty for location-based markets, which carry no
     * demand weighting.
     */
    OptionalDouble totalDemandWeight();

    /**
     * H3 cell centroids at {@code resolution} that fall inside the market, in a stable order.
     * Never empty: a market smaller than one cell contributes its own anchor point(s).
     */
    List<GeoPoint> gridSamplePoints(int resolution);

    /**
     * The circles making up the market's footprint: one for a location market, one per cell
     * otherwise.
     */
    List<Disk> disks();

    /**
     * Representative center, used for map framing and coverage sampling.
     */
    GeoPoint centroid();
}
