package io.fuelprices.exporter;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import io.fuelprices.metrics.PriceGaugeVec;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Renders the price gauge family and the registry's counters, numeric gauges and timers in the
 * Prometheus text exposition format (version 0.0.4).
 */
final class PrometheusTextFormat {
    static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private PrometheusTextFormat() {}

    static String render(PriceGaugeVec prices, MetricRegistry registry) {
        StringBuilder sb = new StringBuilder();
        sb.append("# HELP ").append(PriceGaugeVec.NAME).append(' ').append(PriceGaugeVec.HELP).append('\n');
        sb.append("# TYPE ").append(PriceGaugeVec.NAME).append(" gauge\n");
        for (Map.Entry<List<String>, Double> e : prices.samples().entrySet()) {
            if (e.getValue() == null) continue;
            sb.append(PriceGaugeVec.NAME).append('{');
            List<String> values = e.getKey();
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) sb.append(',');
                sb.append(PriceGaugeVec.LABELS.get(i)).append("=\"").append(escape(values.get(i))).append('"');
            }
            sb.append("} ").append(number(e.getValue())).append('\n');
        }

        for (Map.Entry<String, Counter> e : registry.getCounters().entrySet()) {
            String name = sanitize(e.getKey()) + "_total";
            sb.append("# TYPE ").append(name).append(" counter\n");
            sb.append(name).append(' ').append(e.getValue().getCount()).append('\n');
        }
        for (@SuppressWarnings("rawtypes") Map.Entry<String, Gauge> e : registry.getGauges().entrySet()) {
            Object v = e.getValue().getValue();
            if (!(v instanceof Number n)) continue;
            String name = sanitize(e.getKey());
            sb.append("# TYPE ").append(name).append(" gauge\n");
            sb.append(name).append(' ').append(number(n.doubleValue())).append('\n');
        }
        for (Map.Entry<String, Timer> e : registry.getTimers().entrySet()) {
            String name = sanitize(e.getKey()) + "_seconds";
            Timer t = e.getValue();
            sb.append("# TYPE ").append(name).append(" summary\n");
            sb.append(name).append("{quantile=\"0.5\"} ").append(number(seconds(t.getSnapshot().getMedian()))).append('\n');
            sb.append(name).append("{quantile=\"0.99\"} ").append(number(seconds(t.getSnapshot().get99thPercentile()))).append('\n');
            sb.append(name).append("_count ").append(t.getCount()).append('\n');
        }
        return sb.toString();
    }

    static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_:]", "_");
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    private static double seconds(double nanos) {
        return nanos / TimeUnit.SECONDS.toNanos(1);
    }

    private static String number(double v) {
        if (Double.isNaN(v)) return "NaN";
        if (Double.isInfinite(v)) return v > 0 ? "+Inf" : "-Inf";
        return Double.toString(v);
    }
}
