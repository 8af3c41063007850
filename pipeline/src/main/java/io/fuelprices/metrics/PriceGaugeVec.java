package io.fuelprices.metrics;

import com.codahale.metrics.DefaultSettableGauge;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import io.fuelprices.core.BatchSink;
import io.fuelprices.core.JoinedPrice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gauge family holding the latest observed price per label set. Setting a label set again
 * overwrites its value; nothing accumulates.
 */
public class PriceGaugeVec implements BatchSink<JoinedPrice> {
    public static final String NAME = "osservatorio_carburanti_price";
    public static final String HELP = "Fuel prices from Osservatorio Carburanti from MISE";
    public static final List<String> LABELS = List.of(
            "station_id", "fuel_type", "self_service", "name", "type", "municipality", "province", "brand");

    private final Map<List<String>, DefaultSettableGauge<Double>> children = new ConcurrentHashMap<>();

    /** Registers the family in the registry. Fails if a metric with the same name already exists. */
    public void register(MetricRegistry registry) {
        registry.register(MetricRegistry.name(NAME, "series"), (Gauge<Integer>) this::size);
    }

    public void set(List<String> labelValues, double value) {
        if (labelValues.size() != LABELS.size()) {
            throw new IllegalArgumentException("expected " + LABELS.size() + " label values, got " + labelValues.size());
        }
        children.computeIfAbsent(List.copyOf(labelValues), k -> new DefaultSettableGauge<>()).setValue(value);
    }

    @Override
    public void accept(JoinedPrice item) {
        set(item.labelValues(), item.price().price());
    }

    @Override
    public void acceptBatch(List<JoinedPrice> items) {
        for (JoinedPrice item : items) {
            accept(item);
        }
    }

    /** Current values keyed by label values, in no particular order. */
    public Map<List<String>, Double> samples() {
        Map<List<String>, Double> out = new LinkedHashMap<>();
        children.forEach((labels, gauge) -> out.put(labels, gauge.getValue()));
        return out;
    }

    public int size() {
        return children.size();
    }
}
