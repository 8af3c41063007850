package io.fuelprices.core;

import java.util.List;
import java.util.Objects;

/**
 * A price record enriched with station metadata. Metadata fields are empty strings when the
 * station is not in the registry.
 */
public record JoinedPrice(
        PriceRecord price,
        String name,
        String type,
        String municipality,
        String province,
        String brand
) {
    public JoinedPrice {
        Objects.requireNonNull(price, "price is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(municipality, "municipality is required");
        Objects.requireNonNull(province, "province is required");
        Objects.requireNonNull(brand, "brand is required");
    }

    public static JoinedPrice unmatched(PriceRecord price) {
        return new JoinedPrice(price, "", "", "", "", "");
    }

    public static JoinedPrice of(PriceRecord price, Station station) {
        return new JoinedPrice(price,
                station.name(),
                station.type().value(),
                station.municipality(),
                station.province(),
                station.brand());
    }

    /** Label values in gauge order: station_id, fuel_type, self_service, name, type, municipality, province, brand. */
    public List<String> labelValues() {
        return List.of(
                Long.toString(price.stationId()),
                price.fuelType(),
                Boolean.toString(price.selfService()),
                name,
                type,
                municipality,
                province,
                brand);
    }
}
