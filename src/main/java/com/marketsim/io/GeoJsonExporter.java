package com.marketsim.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.marketsim.geo.GeoMath;
import com.marketsim.geo.GeoPoint;
import com.marketsim.model.Disk;
import com.marketsim.model.Provider;
import com.marketsim.registry.ProviderRegistry;
import com.marketsim.simulation.SimulationResult;

import java.util.HashMap;
import java.util.Map;

/**
 * Renders a run as a GeoJSON FeatureCollection: market footprint, providers, searches and
 * connection lines. Each feature carries a {@code layer} property for styling.
 */
public class GeoJsonExporter {

    private static final int CIRCLE_VERTICES = 48;

    public String export(SimulationResult result, ProviderRegistry registry) {
        var mapper = Json.MAPPER;
        ObjectNode root = mapper.createObjectNode();
        root.put("type", "FeatureCollection");
        ArrayNode features = root.putArray("features");

        for (Disk disk : result.market().disks()) {
            var props = feature(features, circle(disk.center(), disk.radiusKm()), "market");
            props.put("label", disk.label());
            props.put("radius_km", disk.radiusKm());
        }

        Map<String, Provider> byId = new HashMap<>();
        for (var provider : registry.all()) {
            byId.put(provider.id(), provider);
            var props = feature(features, point(provider.location()), "provider");
            props.put("contractor_id", provider.id());
            props.put("service_radius_km", provider.serviceRadiusKm());
            props.put("bidding_active", provider.biddingActive());
            props.put("cleaner_score", provider.score());
        }

        for (var iteration : result.iterations()) {
            for (var outcome : iteration.outcomes()) {
                var props = feature(features, point(outcome.point()), "search");
                props.put("supply_iteration", iteration.index());
                props.put("search_index", outcome.searchIndex());
                props.put("eligible_count", outcome.eligibleCount());
                props.put("bid_count", outcome.bidCount());
                props.put("connected", outcome.connected());

                if (outcome.connected()) {
                    var provider = byId.get(outcome.connectedProviderId());
                    var line = line(outcome.point(), provider.location());
                    var connection = feature(features, line, "connection");
                    connection.put("contractor_id", provider.id());
                    connection.put("distance_km", outcome.connectionDistanceKm());
                }
            }
        }

        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("GeoJSON is not serializable", e);
        }
    }

    private static ObjectNode feature(ArrayNode features, ObjectNode geometry, String layer) {
        var feature = features.addObject();
        feature.put("type", "Feature");
        feature.set("geometry", geometry);
        var props = feature.putObject("properties");
        props.put("layer", layer);
        return props;
    }

    private static ObjectNode point(GeoPoint p) {
        var geometry = Json.MAPPER.createObjectNode();
        geometry.put("type", "Point");
        position(geometry.putArray("coordinates"), p);
        return geometry;
    }

    private static ObjectNode line(GeoPoint from, GeoPoint to) {
        var geometry = Json.MAPPER.createObjectNode();
        geometry.put("type", "LineString");
        var coordinates = geometry.putArray("coordinates");
        position(coordinates.addArray(), from);
        position(coordinates.addArray(), to);
        return geometry;
    }

    private static ObjectNode circle(GeoPoint center, double radiusKm) {
        var geometry = Json.MAPPER.createObjectNode();
        geometry.put("type", "Polygon");
        var ring = geometry.putArray("coordinates").addArray();
        for (int i = 0; i <= CIRCLE_VERTICES; i++) {
            // closing vertex repeats the first
            double bearing = 360.0 * (i % CIRCLE_VERTICES) / CIRCLE_VERTICES;
            position(ring.addArray(), GeoMath.destination(center, bearing, radiusKm));
        }
        return geometry;
    }

    // GeoJSON positions are [longitude, latitude]
    private static void position(ArrayNode array, GeoPoint p) {
        array.add(p.longitude());
        array.add(p.latitude());
    }
}
