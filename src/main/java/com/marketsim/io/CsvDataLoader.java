package com.marketsim.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.marketsim.error.ValidationException;
import com.marketsim.geo.GeoPoint;
import com.marketsim.model.Market;
import com.marketsim.model.PostalCell;
import com.marketsim.model.PostalCodeMarket;
import com.marketsim.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads {@code geo_mapping.csv} and {@code cleaners.csv} from a data directory.
 *
 * <p>Rows are read as header-keyed maps and converted field by field, so a bad value is
 * reported with its file, line and column instead of a generic binding error.
 */
public class CsvDataLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvDataLoader.class);

    public static final String GEO_MAPPING_FILE = "geo_mapping.csv";
    public static final String CLEANERS_FILE = "cleaners.csv";

    private static final CsvMapper csvMapper = new CsvMapper();
    private static final CsvSchema HEADER_SCHEMA = CsvSchema.emptySchema().withHeader();

    private final Path dataDirectory;

    public CsvDataLoader(Path dataDirectory) {
        this.dataDirectory = dataDirectory;
    }

    public List<PostalCell> loadPostalCells() {
        var file = dataDirectory.resolve(GEO_MAPPING_FILE);
        var cells = new ArrayList<PostalCell>();
        for (var row : readRows(file)) {
            cells.add(row.convert(() -> new PostalCell(
                row.required("postal_code"),
                row.required("market"),
                new GeoPoint(row.requiredDouble("latitude"), row.requiredDouble("longitude")),
                row.requiredDouble("str_tam"),
                row.optionalDouble("area")
            )));
        }
        log.info("Loaded {} postal codes from {}", cells.size(), file);
        return cells;
    }

    /**
     * Builds the market made of every postal code tagged with {@code marketId}.
     *
     * @throws ValidationException when no row belongs to that market
     */
    public PostalCodeMarket loadPostalCodeMarket(String marketId) {
        var all = loadPostalCells();
        var inMarket = all.stream().filter(cell -> marketId.equals(cell.marketId())).toList();
        if (inMarket.isEmpty()) {
            Set<String> known = new TreeSet<>();
            all.forEach(cell -> known.add(cell.marketId()));
            throw new ValidationException("No postal codes found for market " + marketId + ", known markets: " + known);
        }
        log.info("Market {} has {} postal codes", marketId, inMarket.size());
        return new PostalCodeMarket(marketId, inMarket);
    }

    public List<Provider> loadProviders() {
        var file = dataDirectory.resolve(CLEANERS_FILE);
        var providers = new ArrayList<Provider>();
        for (var row : readRows(file)) {
            providers.add(row.convert(() -> {
                // older extracts carry a single "active" flag instead of the bidding/assignment pair
                Boolean legacyActive = row.optionalBoolean("active");
                Boolean bidding = row.optionalBoolean("bidding_active");
                if (bidding == null) {
                    bidding = legacyActive != null ? legacyActive : Boolean.TRUE;
                }
                Boolean assignment = row.optionalBoolean("assignment_active");

                var builder = Provider.builder(row.required("contractor_id"))
                    .location(row.requiredDouble("latitude"), row.requiredDouble("longitude"))
                    .postalCode(row.optional("postal_code"))
                    .biddingActive(bidding)
                    .assignmentActive(assignment != null ? assignment : bidding);

                Double score = row.optionalDouble("cleaner_score");
                if (score != null) {
                    builder.score(score);
                }
                Double radius = row.optionalDouble("service_radius");
                if (radius != null) {
                    builder.serviceRadiusKm(radius);
                }
                Integer teamSize = row.optionalInt("team_size");
                if (teamSize != null) {
                    builder.teamSize(teamSize);
                }
                Integer active = row.optionalInt("active_connections");
                if (active != null) {
                    builder.activeConnections(active);
                }
                return builder.build();
            }));
        }
        log.info("Loaded {} cleaners from {}", providers.size(), file);
        return providers;
    }

    /**
     * Cleaners that belong to {@code market}. Rows for other markets are skipped and counted
     * in the log; an empty result is left for the runner to reject.
     */
    public List<Provider> loadProviders(Market market) {
        var all = loadProviders();
        var inMarket = all.stream().filter(market::admits).toList();
        int skipped = all.size() - inMarket.size();
        if (skipped > 0) {
            log.warn("Skipped {} of {} cleaners outside market {}", skipped, all.size(), market.marketId());
        }
        log.info("Market {} has {} cleaners", market.marketId(), inMarket.size());
        return inMarket;
    }

    private static List<Row> readRows(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ValidationException("Input file not found: " + file);
        }
        var rows = new ArrayList<Row>();
        try (MappingIterator<Map<String, String>> it = csvMapper
                .readerFor(Map.class)
                .with(HEADER_SCHEMA)
                .readValues(file.toFile())) {
            int line = 1;
            while (it.hasNextValue()) {
                line++;
                rows.add(new Row(file.getFileName().toString(), line, it.nextValue()));
            }
        } catch (JsonProcessingException e) {
            var location = e.getLocation();
            throw new ValidationException(file.getFileName() + " line "
                + (location != null ? location.getLineNr() : "?") + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        return rows;
    }

    /**
     * One CSV record with typed, location-aware accessors.
     */
    record Row(String file, int line, Map<String, String> values) {

        interface Conversion<T> {
            T apply();
        }

        <T> T convert(Conversion<T> conversion) {
            try {
                return conversion.apply();
            } catch (ValidationException e) {
                if (e.getMessage().startsWith(where())) {
                    throw e;
                }
                throw new ValidationException(where() + ": " + e.getMessage(), e);
            }
        }

        String optional(String column) {
            String value = values.get(column);
            if (value == null) {
                return null;
            }
            value = value.trim();
            return value.isEmpty() ? null : value;
        }

        String required(String column) {
            String value = optional(column);
            if (value == null) {
                throw new ValidationException(where() + ": missing required column '" + column + "'");
            }
            return value;
        }

        double requiredDouble(String column) {
            return parseDouble(column, required(column));
        }

        Double optionalDouble(String column) {
            String value = optional(column);
            return value == null ? null : parseDouble(column, value);
        }

        Integer optionalInt(String column) {
            String value = optional(column);
            if (value == null) {
                return null;
            }
            double parsed = parseDouble(column, value);
            if (parsed != Math.rint(parsed) || Math.abs(parsed) > Integer.MAX_VALUE) {
                throw new ValidationException(where() + ": column '" + column + "' must be an integer, got: " + value);
            }
            return (int) parsed;
        }

        Boolean optionalBoolean(String column) {
            String value = optional(column);
            if (value == null) {
                return null;
            }
            switch (value.toLowerCase()) {
                case "true", "t", "yes", "y", "1", "1.0":
                    return Boolean.TRUE;
                case "false", "f", "no", "n", "0", "0.0":
                    return Boolean.FALSE;
                default:
                    throw new ValidationException(where() + ": column '" + column + "' must be a boolean, got: " + value);
            }
        }

        private double parseDouble(String column, String value) {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new ValidationException(where() + ": column '" + column + "' must be numeric, got: " + value, e);
            }
        }

        private String where() {
            return file + " line " + line;
        }
    }
}
