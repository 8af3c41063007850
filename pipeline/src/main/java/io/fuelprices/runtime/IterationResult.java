package io.fuelprices.runtime;

/**
 * Outcome of one refresh iteration. {@code failedAt} is null when every stage completed.
 */
public record IterationResult(
        long iteration,
        Stage failedAt,
        int pricesParsed,
        int stationsLoaded,
        int emitted,
        Exception error
) {
    public enum Stage {
        FETCH_PRICES,
        FETCH_STATIONS,
        JOIN_AND_EMIT
    }

    public boolean success() {
        return failedAt == null;
    }

    static IterationResult completed(long iteration, int prices, int stations, int emitted) {
        return new IterationResult(iteration, null, prices, stations, emitted, null);
    }

    static IterationResult failed(long iteration, Stage stage, int prices, int stations, Exception error) {
        return new IterationResult(iteration, stage, prices, stations, 0, error);
    }
}
