package com.marketsim.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.marketsim.error.ValidationException;
import com.marketsim.model.LocationMarket;
import com.marketsim.model.Market;
import com.marketsim.simulation.SimulationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Resolves a {@link SimulationConfig} from three layers, later ones winning:
 * built-in defaults, an optional JSON file, then command-line overrides.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    // market identity saved alongside the config; ignored when a saved file is loaded back
    static final Set<String> MARKET_KEYS = Set.of("type", "market_id", "center_lat", "center_lon", "market_radius_km");

    private ConfigLoader() {}

    /**
     * @param configFile JSON object with snake_case keys, or null
     * @param overrides snake_case key to raw value; blank values are ignored
     */
    public static SimulationConfig load(Path configFile, Map<String, String> overrides) {
        ObjectNode merged = Json.MAPPER.valueToTree(SimulationConfig.defaults());

        if (configFile != null) {
            var fromFile = readObject(configFile);
            fromFile.remove(MARKET_KEYS);
            merged.setAll(fromFile);
            log.info("Loaded configuration from {}", configFile);
        }

        overrides.forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                merged.put(key, value.trim());
            }
        });

        return bind(merged);
    }

    public static SimulationConfig fromJson(String json) {
        try {
            JsonNode node = Json.MAPPER.readTree(json);
            if (!node.isObject()) {
                throw new ValidationException("Configuration must be a JSON object");
            }
            ObjectNode merged = Json.MAPPER.valueToTree(SimulationConfig.defaults());
            merged.setAll(((ObjectNode) node).remove(MARKET_KEYS));
            return bind(merged);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed configuration JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static String toJson(SimulationConfig config) {
        return write(Json.MAPPER.valueToTree(config));
    }

    /**
     * The config plus the market it ran against, as saved next to the results. Two runs
     * share this text only if they share both.
     */
    public static String toJson(SimulationConfig config, Market market) {
        ObjectNode node = Json.MAPPER.createObjectNode();
        node.put("type", market.kind().label());
        node.put("market_id", market.marketId());
        if (market instanceof LocationMarket location) {
            node.put("center_lat", location.center().latitude());
            node.put("center_lon", location.center().longitude());
            node.put("market_radius_km", location.radiusKm());
        }
        node.setAll((ObjectNode) Json.MAPPER.valueToTree(config));
        return write(node);
    }

    private static String write(JsonNode node) {
        try {
            return Json.MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Config is not serializable", e);
        }
    }

    private static ObjectNode readObject(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ValidationException("Config file not found: " + file);
        }
        try {
            JsonNode node = Json.MAPPER.readTree(file.toFile());
            if (node == null || !node.isObject()) {
                throw new ValidationException("Config file " + file + " must contain a JSON object");
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed config file " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config file " + file, e);
        }
    }

    private static SimulationConfig bind(ObjectNode node) {
        try {
            return Json.MAPPER.treeToValue(node, SimulationConfig.class);
        } catch (UnrecognizedPropertyException e) {
            throw new ValidationException("Unknown configuration key: " + e.getPropertyName(), e);
        } catch (ValueInstantiationException e) {
            // constructor validation failures arrive wrapped
            if (e.getCause() instanceof ValidationException validation) {
                throw validation;
            }
            throw new ValidationException("Invalid configuration: " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
    }
}
