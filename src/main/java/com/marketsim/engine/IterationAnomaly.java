package com.marketsim.engine;

/**
 * A probability that came out NaN or negative before clamping. Recorded and counted, never fatal.
 */
public record IterationAnomaly(int searchIndex, String providerId, Stage stage, double rawValue) {

    public enum Stage { BID, CONNECTION }
}
