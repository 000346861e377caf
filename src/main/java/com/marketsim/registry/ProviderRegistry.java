package com.marketsim.registry;

import com.marketsim.error.ValidationException;
import com.marketsim.geo.GeoPoint;
import com.marketsim.geo.H3Grid;
import com.marketsim.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Read-only set of providers with a spatial lookup.
 *
 * <p>Providers are bucketed by their H3 cell. A query walks the rings that can hold a
 * provider within reach, then applies the exact per-provider test: the provider must be
 * bidding, its own service radius must reach the search point, and it must lie inside the
 * search's radius cap.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    static final int H3_RESOLUTION = 6; // ~36 km² hexagons

    private final List<Provider> providers;
    private final Map<Long, List<Provider>> byCell;
    private final double maxServiceRadiusKm;
    private final double minCellSpacingKm;

    public ProviderRegistry(Collection<Provider> providers) {
        var ordered = new ArrayList<Provider>(providers.size());
        var ids = new HashSet<String>();
        var cells = new HashMap<Long, List<Provider>>();
        double maxRadius = 0;

        for (var provider : providers) {
            if (!ids.add(provider.id())) {
                throw new ValidationException("Duplicate contractor id: " + provider.id());
            }
            ordered.add(provider);
            cells.computeIfAbsent(H3Grid.cellOf(provider.location(), H3_RESOLUTION), k -> new ArrayList<>())
                 .add(provider);
            maxRadius = Math.max(maxRadius, provider.serviceRadiusKm());
        }

        double spacing = Double.MAX_VALUE;
        for (long cell : cells.keySet()) {
            spacing = Math.min(spacing, H3Grid.centroidSpacingKm(cell));
        }

        this.providers = List.copyOf(ordered);
        this.byCell = Map.copyOf(cells);
        this.maxServiceRadiusKm = maxRadius;
        this.minCellSpacingKm = spacing;

        log.info("ProviderRegistry indexed {} providers across {} H3 cells (resolution {})",
            this.providers.size(), byCell.size(), H3_RESOLUTION);
    }

    /**
     * Providers able to serve a search at {@code point}, nearest first (ties by id).
     *
     * @param searchRadiusKm how far the search is willing to look, independent of provider radii
     * @return empty when nobody qualifies
     */
    public List<Candidate> eligibleProviders(GeoPoint point, double searchRadiusKm) {
        if (!(searchRadiusKm > 0)) {
            throw new ValidationException("Search radius must be positive, got: " + searchRadiusKm);
        }
        if (providers.isEmpty()) {
            return List.of();
        }

        double reach = Math.min(searchRadiusKm, maxServiceRadiusKm);
        int rings = H3Grid.ringsCovering(reach, minCellSpacingKm);
        long origin = H3Grid.cellOf(point, H3_RESOLUTION);

        var result = new ArrayList<Candidate>();
        if (ringCellCount(rings) >= byCell.size()) {
            // fewer occupied buckets than ring cells: scanning everyone is cheaper
            for (var provider : providers) {
                collect(provider, point, searchRadiusKm, result);
            }
        } else {
            for (long cell : H3Grid.disk(origin, rings)) {
                var bucket = byCell.get(cell);
                if (bucket == null) {
                    continue;
                }
                for (var provider : bucket) {
                    collect(provider, point, searchRadiusKm, result);
                }
            }
        }

        result.sort(Candidate.BY_DISTANCE_THEN_ID);
        return result;
    }

    private static void collect(Provider provider, GeoPoint point, double searchRadiusKm, List<Candidate> out) {
        if (!provider.biddingActive()) {
            return;
        }
        double distance = provider.distanceKmTo(point);
        if (distance <= provider.serviceRadiusKm() && distance <= searchRadiusKm) {
            out.add(new Candidate(provider, distance));
        }
    }

    private static long ringCellCount(int rings) {
        return 3L * rings * (rings + 1) + 1;
    }

    public List<Provider> all() {
        return providers;
    }

    public int size() {
        return providers.size();
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }

    public long activeCount() {
        return providers.stream().filter(Provider::biddingActive).count();
    }

    public long assignmentActiveCount() {
        return providers.stream().filter(Provider::assignmentActive).count();
    }

    public double maxServiceRadiusKm() {
        return maxServiceRadiusKm;
    }

    public double averageActiveServiceRadiusKm() {
        return providers.stream()
            .filter(Provider::biddingActive)
            .mapToDouble(Provider::serviceRadiusKm)
            .average()
            .orElse(0.0);
    }
}
