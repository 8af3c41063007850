package io.fuelprices.core;

import java.util.Objects;

/**
 * Station category as published by the registry. Kept open: values the registry may add later
 * pass through unchanged.
 */
public record StationType(String value) {
    public static final StationType ROADSIDE = new StationType("Stradale");
    public static final StationType MOTORWAY = new StationType("Autostradale");

    public StationType {
        Objects.requireNonNull(value, "value is required");
    }

    public static StationType of(String value) {
        if (ROADSIDE.value.equals(value)) return ROADSIDE;
        if (MOTORWAY.value.equals(value)) return MOTORWAY;
        return new StationType(value);
    }

    public boolean isKnown() {
        return this.equals(ROADSIDE) || this.equals(MOTORWAY);
    }

    @Override
    public String toString() {
        return value;
    }
}
