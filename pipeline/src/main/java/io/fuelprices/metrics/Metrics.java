package io.fuelprices.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Timer timer(String name) { return registry.timer(name); }
    @SuppressWarnings("rawtypes")
    public <T extends Gauge> T gauge(String name, MetricRegistry.MetricSupplier<T> supplier) { return registry.gauge(name, supplier); }
}
