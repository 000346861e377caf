package com.marketsim.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.marketsim.registry.ProviderRegistry;
import com.marketsim.simulation.SimulationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HexFormat;

/**
 * Writes a finished run into its own directory under the output base:
 * config, summary statistics, per-search rows and a GeoJSON map.
 */
public class ResultWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);

    public static final String CONFIG_FILE = "simulation_config.json";
    public static final String SUMMARY_FILE = "summary_stats.json";
    public static final String SEARCH_RESULTS_FILE = "search_results.csv";
    public static final String MAP_FILE = "market_map.geojson";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final CsvMapper csvMapper = new CsvMapper();

    private final Path outputBase;
    private final Clock clock;
    private final GeoJsonExporter geoJsonExporter = new GeoJsonExporter();

    public ResultWriter(Path outputBase) {
        this(outputBase, Clock.systemDefaultZone());
    }

    public ResultWriter(Path outputBase, Clock clock) {
        this.outputBase = outputBase;
        this.clock = clock;
    }

    /**
     * @return the directory the files were written to
     */
    public Path write(SimulationResult result, ProviderRegistry registry) {
        String configJson = ConfigLoader.toJson(result.config(), result.market());
        Path dir = outputBase.resolve(directoryName(result.market().kind().label(), configJson));
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(CONFIG_FILE), configJson, StandardCharsets.UTF_8);
            Files.writeString(dir.resolve(SUMMARY_FILE), summaryJson(result, registry), StandardCharsets.UTF_8);
            writeSearchResults(result, dir.resolve(SEARCH_RESULTS_FILE));
            Files.writeString(dir.resolve(MAP_FILE), geoJsonExporter.export(result, registry), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write results to " + dir, e);
        }
        log.info("Results written to {}", dir);
        return dir;
    }

    String directoryName(String marketType, String configJson) {
        return marketType + "_" + simulationId(configJson) + "_" + LocalDateTime.now(clock).format(TIMESTAMP);
    }

    /**
     * First 8 hex characters of the MD5 of the saved config JSON, market identity included.
     */
    public static String simulationId(String configJson) {
        try {
            var digest = MessageDigest.getInstance("MD5").digest(configJson.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /**
     * Summary statistics as JSON. Contains nothing time-dependent, so equal runs produce
     * identical text.
     */
    public String summaryJson(SimulationResult result, ProviderRegistry registry) {
        var mapper = Json.MAPPER;
        ObjectNode root = mapper.createObjectNode();
        root.put("simulation_id", simulationId(ConfigLoader.toJson(result.config(), result.market())));
        root.put("state", result.state().name());
        root.put("partial", result.partial());

        var market = root.putObject("market");
        market.put("market_id", result.market().marketId());
        market.put("market_type", result.market().kind().label());
        market.put("area_km2", result.market().totalAreaKm2());
        result.market().totalDemandWeight().ifPresent(w -> market.put("total_demand_weight", w));
        market.put("num_cleaners", registry.size());
        market.put("num_active_cleaners", registry.activeCount());
        market.put("num_assignment_active_cleaners", registry.assignmentActiveCount());
        market.put("avg_service_radius_km", registry.averageActiveServiceRadiusKm());

        root.set("config", mapper.valueToTree(result.config()));
        root.put("requested_supply_iterations", result.requestedSupplyIterations());
        root.put("completed_supply_iterations", result.completedSupplyIterations());
        root.put("completed_searches", result.completedSearches());
        root.put("connection_rate_variance", result.connectionRateVariance());
        root.put("connection_rate_std", result.connectionRateStdDev());
        root.set("grid_coverage", mapper.valueToTree(result.gridCoverage()));
        root.set("metrics", mapper.valueToTree(result.metrics()));

        var iterations = root.putArray("supply_iterations");
        for (var iteration : result.iterations()) {
            var node = iterations.addObject();
            node.put("index", iteration.index());
            node.put("seed", iteration.seed());
            node.put("completed_searches", iteration.completedSearches());
            node.put("total_connections", iteration.metrics().totalConnections());
            node.put("connection_rate", iteration.metrics().connectionRate());
            node.put("coverage_ratio", iteration.metrics().coverageRatio());
        }

        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Summary is not serializable", e);
        }
    }

    private void writeSearchResults(SimulationResult result, Path file) throws IOException {
        var rows = new ArrayList<SearchResultRow>();
        for (var iteration : result.iterations()) {
            for (var outcome : iteration.outcomes()) {
                rows.add(SearchResultRow.of(iteration.index(), outcome));
            }
        }
        var schema = csvMapper.schemaFor(SearchResultRow.class).withHeader();
        csvMapper.writer(schema).writeValue(file.toFile(), rows);
    }
}
