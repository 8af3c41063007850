package io.fuelprices.core;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * One observation of a fuel price at a station, as published in the price feed.
 */
public record PriceRecord(long stationId, String fuelType, double price, boolean selfService, ZonedDateTime observedAt) {
    public PriceRecord {
        Objects.requireNonNull(fuelType, "fuelType is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
    }

    /** Composite identity used by the record cache: station id and unix seconds of the observation. */
    public String cacheKey() {
        return stationId + "-" + observedAt.toEpochSecond();
    }
}
