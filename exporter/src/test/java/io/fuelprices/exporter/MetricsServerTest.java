package io.fuelprices.exporter;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.fuelprices.cache.RecordCache;
import io.fuelprices.config.CollectorConfig;
import io.fuelprices.metrics.PriceGaugeVec;
import io.fuelprices.runtime.IterationResult;
import io.fuelprices.runtime.RefreshScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class MetricsServerTest {
    private static final String PRICES = String.join("\n",
            "Estrazione del 2024-03-05",
            "idImpianto;descCarburante;prezzo;isSelf;dtComu",
            "101;benzina;1.899;true;5/3/2024 8:00:00",
            "");
    private static final String STATIONS = String.join("\n",
            "idImpianto;Gestore;Bandiera;Tipo Impianto;Nome Impianto;Indirizzo;Comune;Provincia;Latitudine;Longitudine",
            "101;ROSSI SRL;Agip Eni;Stradale;ENI ROSSI;VIA ROMA 1;MILANO;MI;45.46;9.19",
            "");

    FeedServer feeds;
    MetricsServer http;

    @AfterEach
    void tearDown() {
        if (http != null) http.close();
        if (feeds != null) feeds.close();
    }

    private Injector injector(String stationsPath) {
        CollectorConfig cfg = CollectorConfig.fromEnv()
                .withFeeds(feeds.uri("/prices.csv"), feeds.uri(stationsPath))
                .withListen("127.0.0.1:0")
                .withMetricsPath("/metrics");
        return Guice.createInjector(new ExporterModule(cfg));
    }

    private static HttpResponse<String> get(int port, String path) throws Exception {
        HttpClient client = HttpClient.newHttpClient();
        return client.send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void serves_joined_prices_after_an_iteration() throws Exception {
        feeds = new FeedServer().serve("/prices.csv", 200, PRICES).serve("/stations.csv", 200, STATIONS);
        Injector injector = injector("/stations.csv");
        injector.getInstance(PriceGaugeVec.class).register(injector.getInstance(MetricRegistry.class));
        RefreshScheduler scheduler = injector.getInstance(RefreshScheduler.class);
        http = injector.getInstance(MetricsServer.class);
        http.start();

        IterationResult result = scheduler.runOnce();
        assertTrue(result.success(), () -> String.valueOf(result.error()));

        HttpResponse<String> metrics = get(http.port(), "/metrics");
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
        assertTrue(metrics.body().contains("osservatorio_carburanti_price{station_id=\"101\",fuel_type=\"benzina\",self_service=\"true\","
                + "name=\"ENI ROSSI\",type=\"Stradale\",municipality=\"MILANO\",province=\"MI\",brand=\"Agip Eni\"} 1.899"));
        assertTrue(metrics.body().contains("cache_entries 1.0"));

        HttpResponse<String> status = get(http.port(), "/status");
        assertEquals(200, status.statusCode());
        assertTrue(status.body().contains("\"iterations\":1"));
        assertTrue(status.body().contains("\"success\":true"));
    }

    @Test
    void failed_station_fetch_leaves_metrics_stale_and_cache_filled() throws Exception {
        feeds = new FeedServer().serve("/prices.csv", 200, PRICES).serve("/broken.csv", 500, "");
        Injector injector = injector("/broken.csv");
        RefreshScheduler scheduler = injector.getInstance(RefreshScheduler.class);
        http = injector.getInstance(MetricsServer.class);
        http.start();

        IterationResult result = scheduler.runOnce();
        assertEquals(IterationResult.Stage.FETCH_STATIONS, result.failedAt());
        assertEquals(0, injector.getInstance(PriceGaugeVec.class).size());

        RecordCache cache = injector.getInstance(RecordCache.class);
        String key = "101-" + ZonedDateTime.of(2024, 3, 5, 8, 0, 0, 0, ZoneId.of("Europe/Rome")).toEpochSecond();
        assertEquals(1, cache.get(key).orElseThrow().size());

        HttpResponse<String> status = get(http.port(), "/status");
        assertTrue(status.body().contains("\"failedAt\":\"FETCH_STATIONS\""));
    }

    @Test
    void unknown_path_is_not_found() throws Exception {
        feeds = new FeedServer();
        http = injector("/stations.csv").getInstance(MetricsServer.class);
        http.start();
        assertEquals(404, get(http.port(), "/nothing").statusCode());
        assertEquals(405, HttpClient.newHttpClient().send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + http.port() + "/metrics"))
                .POST(HttpRequest.BodyPublishers.noBody()).build(), HttpResponse.BodyHandlers.ofString()).statusCode());
        assertEquals(Duration.ofHours(6), injector("/stations.csv").getInstance(CollectorConfig.class).interval());
    }
}
