package com.marketsim.error;

/**
 * Base type for fatal simulation failures.
 * Anything extending this aborts a run before or instead of producing a result.
 */
public class SimulationException extends RuntimeException {

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
