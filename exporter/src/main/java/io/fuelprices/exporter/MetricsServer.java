package io.fuelprices.exporter;

import com.codahale.metrics.MetricRegistry;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.fuelprices.metrics.PriceGaugeVec;
import io.fuelprices.runtime.IterationResult;
import io.fuelprices.runtime.RefreshScheduler;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Serves the exposed metrics and a small JSON status page. Requests run on their own pool and
 * never wait on the refresh loop.
 */
public class MetricsServer implements AutoCloseable {
    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final PriceGaugeVec prices;
    private final MetricRegistry registry;
    private final RefreshScheduler scheduler;

    public MetricsServer(InetSocketAddress address, String metricsPath, PriceGaugeVec prices,
                         MetricRegistry registry, RefreshScheduler scheduler) throws IOException {
        this.prices = prices;
        this.registry = registry;
        this.scheduler = scheduler;
        this.server = HttpServer.create(address, 0);
        server.createContext(metricsPath, new MetricsHandler());
        server.createContext("/status", new StatusHandler());
        server.setExecutor(executor);
    }

    public void start() { server.start(); }

    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) { os.write(bytes); }
    }

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(405, -1); return;
            }
            respond(exchange, 200, PrometheusTextFormat.CONTENT_TYPE, PrometheusTextFormat.render(prices, registry));
        }
    }

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            IterationResult last = scheduler.lastResult();
            StringBuilder sb = new StringBuilder();
            sb.append('{')
                    .append("\"running\":").append(scheduler.isRunning()).append(',')
                    .append("\"iterations\":").append(scheduler.iterations()).append(',')
                    .append("\"intervalSeconds\":").append(scheduler.interval().toSeconds()).append(',')
                    .append("\"series\":").append(prices.size());
            if (last != null) {
                sb.append(',').append("\"lastIteration\":{")
                        .append("\"success\":").append(last.success()).append(',')
                        .append("\"failedAt\":").append(last.failedAt() == null ? "null" : "\"" + last.failedAt() + "\"").append(',')
                        .append("\"prices\":").append(last.pricesParsed()).append(',')
                        .append("\"stations\":").append(last.stationsLoaded()).append(',')
                        .append("\"emitted\":").append(last.emitted())
                        .append('}');
            }
            sb.append('}');
            respond(exchange, 200, "application/json", sb.toString());
        }
    }
}
