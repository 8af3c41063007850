package io.fuelprices.core;

/**
 * Registry entry for a fuel station. Coordinates are kept as the raw feed strings.
 */
public record Station(
        long id,
        String operator,
        String brand,
        StationType type,
        String name,
        String address,
        String municipality,
        String province,
        String latitude,
        String longitude
) {}
