package com.marketsim.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Collection;

/**
 * Five-number summary plus mean. Percentiles interpolate linearly between closest ranks.
 * An empty sample has count 0 and NaN everywhere else.
 */
public record DistributionSummary(
    @JsonProperty("count") long count,
    @JsonProperty("mean") double mean,
    @JsonProperty("min") double min,
    @JsonProperty("p25") double p25,
    @JsonProperty("median") double median,
    @JsonProperty("p75") double p75,
    @JsonProperty("max") double max
) {
    public static final DistributionSummary EMPTY =
        new DistributionSummary(0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);

    public static DistributionSummary of(Collection<Double> values) {
        return of(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    public static DistributionSummary of(double[] values) {
        if (values.length == 0) {
            return EMPTY;
        }
        var sorted = values.clone();
        Arrays.sort(sorted);
        double sum = 0;
        for (double v : sorted) {
            sum += v;
        }
        return new DistributionSummary(
            sorted.length,
            sum / sorted.length,
            sorted[0],
            percentile(sorted, 0.25),
            percentile(sorted, 0.50),
            percentile(sorted, 0.75),
            sorted[sorted.length - 1]
        );
    }

    /**
     * @param sorted ascending, non-empty
     * @param q quantile in [0, 1]
     */
    public static double percentile(double[] sorted, double q) {
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }
}
