package com.marketsim.error;

/**
 * The market has no providers or no area, so a simulation cannot say anything useful.
 */
public class EmptyMarketException extends SimulationException {

    public EmptyMarketException(String message) {
        super(message);
    }
}
