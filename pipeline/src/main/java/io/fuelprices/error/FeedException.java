package io.fuelprices.error;

/**
 * Base failure of a feed fetch or parse. Aborts the current refresh iteration.
 */
public class FeedException extends Exception {
    public FeedException(String message) {
        super(message);
    }

    public FeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
