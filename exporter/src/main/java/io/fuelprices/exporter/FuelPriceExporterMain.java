package io.fuelprices.exporter;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.fuelprices.config.CollectorConfig;
import io.fuelprices.config.Durations;
import io.fuelprices.metrics.PriceGaugeVec;
import io.fuelprices.runtime.RefreshScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.net.URI;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.Callable;

/**
 * Harvests the fuel price and station feeds on an interval and exposes the joined prices as a
 * gauge over HTTP.
 */
@CommandLine.Command(name = "fuel-price-exporter", mixinStandardHelpOptions = true,
        description = "Export Osservatorio Carburanti fuel prices as metrics")
public final class FuelPriceExporterMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(FuelPriceExporterMain.class);

    @CommandLine.Option(names = {"-p", "--path"}, description = "HTTP path where to expose metrics to")
    String path;

    @CommandLine.Option(names = {"-l", "--listen"}, description = "Address to listen to, host:port or :port")
    String listen;

    @CommandLine.Option(names = {"-i", "--interval"}, converter = DurationConverter.class,
            description = "Interval between data updates, e.g. 6h, 30m or PT6H")
    Duration interval;

    @CommandLine.Option(names = "--cache-ttl", converter = DurationConverter.class, description = "Age after which cached price records are treated as absent")
    Duration cacheTtl;

    @CommandLine.Option(names = "--prices-url", description = "Price feed URL")
    URI pricesUrl;

    @CommandLine.Option(names = "--stations-url", description = "Station registry feed URL")
    URI stationsUrl;

    @CommandLine.Option(names = "--source-zone", description = "Time zone of the feed timestamps")
    ZoneId sourceZone;

    public static void main(String[] args) {
        int code = new CommandLine(new FuelPriceExporterMain()).execute(args);
        if (code != 0) System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        CollectorConfig cfg = config(CollectorConfig.fromEnv());
        Injector injector = Guice.createInjector(new ExporterModule(cfg));

        PriceGaugeVec gauge = injector.getInstance(PriceGaugeVec.class);
        try {
            gauge.register(injector.getInstance(MetricRegistry.class));
        } catch (IllegalArgumentException e) {
            log.error("Failed to register '{}' gauge: {}", PriceGaugeVec.NAME, e.getMessage());
            return 1;
        }

        RefreshScheduler scheduler = injector.getInstance(RefreshScheduler.class);
        try (MetricsServer server = injector.getInstance(MetricsServer.class)) {
            scheduler.start();
            server.start();
            log.info("Starting server on {}, metrics at {}", cfg.listen(), cfg.metricsPath());
            Runtime.getRuntime().addShutdownHook(new Thread(scheduler::close, "shutdown"));
            Thread.currentThread().join();
        }
        return 0;
    }

    CollectorConfig config(CollectorConfig base) {
        CollectorConfig cfg = base;
        if (path != null) cfg = cfg.withMetricsPath(path);
        if (listen != null) cfg = cfg.withListen(listen);
        if (interval != null) cfg = cfg.withInterval(interval);
        if (cacheTtl != null) cfg = cfg.withCacheTtl(cacheTtl);
        if (sourceZone != null) cfg = cfg.withSourceZone(sourceZone);
        if (pricesUrl != null || stationsUrl != null) {
            cfg = cfg.withFeeds(pricesUrl != null ? pricesUrl : cfg.pricesUrl(), stationsUrl != null ? stationsUrl : cfg.stationsUrl());
        }
        return cfg;
    }

    static final class DurationConverter implements CommandLine.ITypeConverter<Duration> {
        @Override
        public Duration convert(String value) {
            return Durations.parse(value);
        }
    }
}
