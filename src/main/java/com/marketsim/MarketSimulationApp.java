package com.marketsim;

import com.marketsim.error.SimulationException;
import com.marketsim.error.ValidationException;
import com.marketsim.geo.GeoPoint;
import com.marketsim.io.ConfigLoader;
import com.marketsim.io.CsvDataLoader;
import com.marketsim.io.ResultWriter;
import com.marketsim.model.LocationMarket;
import com.marketsim.model.Market;
import com.marketsim.model.MarketKind;
import com.marketsim.registry.ProviderRegistry;
import com.marketsim.simulation.SimulationConfig;
import com.marketsim.simulation.SimulationRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;

/**
 * Command-line entry point: load inputs, run one simulation, write the results.
 *
 * <pre>
 * --type postal_code --data-dir data --market-id NYC
 * --type location --data-dir data --market-id downtown --center-lat 40.75 --center-lon -73.99 --market-radius 5
 * </pre>
 */
public class MarketSimulationApp {

    private static final Logger log = LoggerFactory.getLogger(MarketSimulationApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (hasFlag(args, "--help") || hasFlag(args, "-h")) {
            out.println(usage());
            return EXIT_OK;
        }

        Market market;
        CsvDataLoader loader;
        SimulationConfig config;
        Path outputBase;
        try {
            var type = MarketKind.fromLabel(requiredArg(args, "--type"));
            var dataDir = Path.of(requiredArg(args, "--data-dir"));
            var marketId = requiredArg(args, "--market-id");
            outputBase = Path.of(parseArg(args, "--output-base", "simulation_results"));

            var overrides = new LinkedHashMap<String, String>();
            overrides.put("search_iterations", parseArg(args, "--search-iterations", null));
            overrides.put("supply_configuration_iterations", parseArg(args, "--supply-iterations", null));
            overrides.put("random_seed", parseArg(args, "--random-seed", null));
            overrides.put("search_radius_km", parseArg(args, "--search-radius", null));
            overrides.put("parallelism", parseArg(args, "--parallelism", null));
            String configFile = parseArg(args, "--config", null);
            config = ConfigLoader.load(configFile == null ? null : Path.of(configFile), overrides);

            loader = new CsvDataLoader(dataDir);
            if (type == MarketKind.LOCATION) {
                var center = new GeoPoint(
                    parseDouble(requiredArg(args, "--center-lat"), "--center-lat"),
                    parseDouble(requiredArg(args, "--center-lon"), "--center-lon"));
                market = new LocationMarket(marketId, center,
                    parseDouble(requiredArg(args, "--market-radius"), "--market-radius"));
            } else {
                market = loader.loadPostalCodeMarket(marketId);
            }
        } catch (IllegalArgumentException | ValidationException e) {
            err.println("Error: " + e.getMessage());
            err.println(usage());
            return EXIT_USAGE;
        } catch (RuntimeException e) {
            log.error("Failed to load inputs", e);
            err.println("Failed to load inputs: " + e.getMessage());
            return EXIT_FAILED;
        }

        try {
            var registry = new ProviderRegistry(loader.loadProviders(market));
            var runner = new SimulationRunner(market, registry, config);
            var result = runner.run();
            var dir = new ResultWriter(outputBase).write(result, registry);

            var metrics = result.metrics();
            out.printf("Simulation complete for market %s (%s)%n", market.marketId(), market.kind().label());
            out.printf("  searches:          %d%n", metrics.totalSearches());
            out.printf("  connection rate:   %.3f%n", metrics.connectionRate());
            out.printf("  coverage (search): %.3f%n", metrics.coverageRatio());
            out.printf("  coverage (grid):   %.3f%n", result.gridCoverage().ratio());
            out.printf("  avg bids/search:   %.3f%n", metrics.avgBidsPerSearch());
            out.printf("  search density:    %.3f per km2%n", metrics.searchDensity());
            out.printf("Results saved to: %s%n", dir);
            return EXIT_OK;
        } catch (SimulationException e) {
            log.error("Simulation failed", e);
            err.println("Simulation failed: " + e.getMessage());
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            log.error("Unexpected failure", e);
            err.println("Unexpected failure: " + e);
            return EXIT_FAILED;
        }
    }

    static String parseArg(String[] args, String flag, String defaultValue) {
        String prefix = flag + "=";
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals(flag) && i + 1 < args.length) {
                return args[i + 1];
            }
            if (args[i].startsWith(prefix)) {
                return args[i].substring(prefix.length());
            }
        }
        return defaultValue;
    }

    private static String requiredArg(String[] args, String flag) {
        String value = parseArg(args, flag, null);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required argument " + flag);
        }
        return value;
    }

    private static boolean hasFlag(String[] args, String flag) {
        for (var arg : args) {
            if (arg.equals(flag)) {
                return true;
            }
        }
        return false;
    }

    private static double parseDouble(String value, String flag) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " must be a number, got: " + value);
        }
    }

    static String usage() {
        return """
            Usage: market-sim --type postal_code|location --data-dir DIR --market-id ID [options]

              --config FILE             JSON config (snake_case keys), overridden by flags below
              --search-iterations N     searches per supply iteration (default 100)
              --supply-iterations N     independently seeded repeats (default 1)
              --random-seed N           master seed (default 42)
              --search-radius KM        how far a search looks for cleaners (default 10)
              --parallelism N           threads for supply iterations (default 1)
              --center-lat DEG          location markets only
              --center-lon DEG          location markets only
              --market-radius KM        location markets only
              --output-base DIR         where result directories are created (default simulation_results)
            """;
    }
}
