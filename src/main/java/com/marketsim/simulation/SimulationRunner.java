package com.marketsim.simulation;

import com.marketsim.engine.CapacityAdjustment;
import com.marketsim.engine.MatchingEngine;
import com.marketsim.engine.QualityAdjustment;
import com.marketsim.engine.SearchOutcome;
import com.marketsim.error.EmptyMarketException;
import com.marketsim.error.SimulationException;
import com.marketsim.error.ValidationException;
import com.marketsim.metrics.CoverageEstimator;
import com.marketsim.metrics.MetricsAggregator;
import com.marketsim.model.Market;
import com.marketsim.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a single simulation run through {@code CONFIGURED -> RUNNING -> COMPLETED | FAILED}.
 *
 * <p>Each supply iteration owns a {@link Random} seeded from the master seed and its index,
 * and runs its searches sequentially on that one stream. Iterations may run on a pool of
 * {@code parallelism} threads; results are assembled by index so output does not depend on
 * the thread count.
 *
 * <p>{@link #requestStop()} and {@link #completedSearches()} are safe to call from any thread
 * while {@link #run()} is in progress.
 */
public class SimulationRunner {

    private static final Logger log = LoggerFactory.getLogger(SimulationRunner.class);

    private final Market market;
    private final ProviderRegistry registry;
    private final SimulationConfig config;
    private final QualityAdjustment quality;
    private final CapacityAdjustment capacity;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicInteger completedSearches = new AtomicInteger();
    private volatile RunState state = RunState.CONFIGURED;
    private volatile boolean stopRequested = false;
    private volatile Throwable failureCause;

    public SimulationRunner(Market market, ProviderRegistry registry, SimulationConfig config) {
        this(market, registry, config, config.qualityAdjustment(), config.capacityAdjustment());
    }

    public SimulationRunner(Market market, ProviderRegistry registry, SimulationConfig config,
                            QualityAdjustment quality, CapacityAdjustment capacity) {
        this.market = market;
        this.registry = registry;
        this.config = config;
        this.quality = quality;
        this.capacity = capacity;
    }

    /**
     * Executes the run. May be called once.
     *
     * @throws SimulationException after moving to {@link RunState#FAILED}
     * @throws IllegalStateException on a second call
     */
    public SimulationResult run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Simulation runner already used, state: " + state);
        }

        try {
            validate();
            state = RunState.RUNNING;
            log.info("Starting simulation on market {} ({}): {} providers, {} searches x {} supply iterations, seed={}",
                market.marketId(), market.kind().label(), registry.size(),
                config.searchIterations(), config.supplyConfigurationIterations(), config.randomSeed());

            var engine = new MatchingEngine(registry, config.probabilityModel(quality, capacity), config.searchRadiusKm());
            var iterations = runSupplyIterations(engine);
            var result = assemble(iterations);

            state = RunState.COMPLETED;
            log.info("Simulation finished: {} searches, connection rate {}{}",
                result.completedSearches(), String.format("%.4f", result.metrics().connectionRate()),
                result.partial() ? " (stopped early)" : "");
            return result;
        } catch (RuntimeException e) {
            failureCause = e;
            state = RunState.FAILED;
            log.error("Simulation on market {} failed: {}", market == null ? null : market.marketId(), e.getMessage());
            throw e;
        }
    }

    private void validate() {
        if (market == null) {
            throw new ValidationException("Market is required");
        }
        if (registry == null) {
            throw new ValidationException("Provider registry is required");
        }
        if (config == null) {
            throw new ValidationException("Simulation config is required");
        }
        if (quality == null || capacity == null) {
            throw new ValidationException("Quality and capacity adjustments are required");
        }
        if (registry.isEmpty()) {
            throw new EmptyMarketException("No cleaners available for market " + market.marketId());
        }
        if (!(market.totalAreaKm2() > 0)) {
            throw new EmptyMarketException("Market " + market.marketId() + " has zero area");
        }
    }

    private List<SupplyIterationResult> runSupplyIterations(MatchingEngine engine) {
        int count = config.supplyConfigurationIterations();
        long[] seeds = SeedGenerator.deterministicSeeds(config.randomSeed(), count);
        int threads = Math.min(config.parallelism(), count);

        var results = new ArrayList<SupplyIterationResult>(count);
        if (threads == 1) {
            for (int i = 0; i < count && !stopRequested; i++) {
                results.add(runSupplyIteration(engine, i, seeds[i]));
            }
            return results;
        }

        var counter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            var thread = new Thread(r, "supply-iteration-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        try {
            var futures = new ArrayList<Future<SupplyIterationResult>>(count);
            for (int i = 0; i < count; i++) {
                final int index = i;
                futures.add(executor.submit(() -> stopRequested ? null : runSupplyIteration(engine, index, seeds[index])));
            }
            for (var future : futures) {
                var result = future.get();
                if (result != null) {
                    results.add(result);
                }
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SimulationException("Interrupted while waiting for supply iterations", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new SimulationException("Supply iteration failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private SupplyIterationResult runSupplyIteration(MatchingEngine engine, int index, long seed) {
        log.info("Supply iteration {} started (seed={})", index, seed);
        var rng = new Random(seed);
        var aggregator = new MetricsAggregator(index);
        var outcomes = new ArrayList<SearchOutcome>(config.searchIterations());

        for (int search = 0; search < config.searchIterations(); search++) {
            if (stopRequested) {
                log.info("Supply iteration {} stopped after {} searches", index, search);
                break;
            }
            var outcome = engine.simulateSearch(market, search, rng);
            outcomes.add(outcome);
            aggregator.add(outcome);
            completedSearches.incrementAndGet();
        }

        var metrics = aggregator.summarize(market);
        log.info("Supply iteration {} finished: {} searches, {} connections, rate {}",
            index, outcomes.size(), metrics.totalConnections(), String.format("%.4f", metrics.connectionRate()));
        return new SupplyIterationResult(index, seed, config.searchIterations(), outcomes, metrics);
    }

    private SimulationResult assemble(List<SupplyIterationResult> iterations) {
        var pooled = new MetricsAggregator();
        for (var iteration : iterations) {
            pooled.merge(new MetricsAggregator(iteration.index()).addAll(iteration.outcomes()));
        }

        var coverage = new CoverageEstimator(registry, config.searchRadiusKm(), config.coverageGridResolution())
            .estimate(market);

        boolean partial = iterations.size() < config.supplyConfigurationIterations()
            || iterations.stream().anyMatch(SupplyIterationResult::partial);

        return new SimulationResult(
            config,
            market,
            RunState.COMPLETED,
            iterations,
            pooled.summarize(market),
            connectionRateVariance(iterations),
            coverage,
            config.supplyConfigurationIterations(),
            partial
        );
    }

    static double connectionRateVariance(List<SupplyIterationResult> iterations) {
        if (iterations.size() < 2) {
            return 0.0;
        }
        double mean = iterations.stream().mapToDouble(SupplyIterationResult::connectionRate).average().orElse(0.0);
        double sumSquares = 0;
        for (var iteration : iterations) {
            double diff = iteration.connectionRate() - mean;
            sumSquares += diff * diff;
        }
        return sumSquares / iterations.size();
    }

    /**
     * Asks the run to stop after the search currently in progress. The run still completes
     * with a partial result.
     */
    public void requestStop() {
        if (!stopRequested) {
            stopRequested = true;
            log.info("Stop requested after {} searches", completedSearches.get());
        }
    }

    public boolean stopRequested() {
        return stopRequested;
    }

    public int completedSearches() {
        return completedSearches.get();
    }

    public RunState state() {
        return state;
    }

    public Throwable failureCause() {
        return failureCause;
    }
}
