package com.marketsim.error;

/**
 * Malformed or out-of-range market, provider, config or input field.
 * Raised at construction time, never from inside the per-search loop.
 */
public class ValidationException extends SimulationException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new ValidationException(message);
        }
    }
}
