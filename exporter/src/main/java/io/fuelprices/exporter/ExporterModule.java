package io.fuelprices.exporter;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import io.fuelprices.cache.RecordCache;
import io.fuelprices.config.CollectorConfig;
import io.fuelprices.core.FeedSource;
import io.fuelprices.metrics.Metrics;
import io.fuelprices.metrics.PriceGaugeVec;
import io.fuelprices.parse.PriceFeedParser;
import io.fuelprices.parse.StationFeedParser;
import io.fuelprices.runtime.RefreshScheduler;

import java.io.IOException;
import java.net.http.HttpClient;

public class ExporterModule extends AbstractModule {
    private final CollectorConfig config;

    public ExporterModule(CollectorConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(CollectorConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton HttpClient httpClient() {
        return HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build();
    }

    @Provides @Singleton RecordCache recordCache(Metrics metrics) {
        RecordCache cache = new RecordCache(config.cacheTtl());
        metrics.gauge("cache.entries", () -> (Gauge<Integer>) cache::size);
        return cache;
    }

    @Provides @Singleton PriceGaugeVec priceGauge() { return new PriceGaugeVec(); }

    @Provides @Singleton @Named("prices") FeedSource pricesSource(HttpClient http) { return new HttpFeedSource("prices", config.pricesUrl(), http); }
    @Provides @Singleton @Named("stations") FeedSource stationsSource(HttpClient http) { return new HttpFeedSource("stations", config.stationsUrl(), http); }

    @Provides @Singleton PriceFeedParser priceParser(RecordCache cache, MetricRegistry registry) { return new PriceFeedParser(cache, config.sourceZone(), registry); }

    @Provides @Singleton StationFeedParser stationParser(MetricRegistry registry) { return new StationFeedParser(registry); }

    @Provides @Singleton RefreshScheduler scheduler(@Named("prices") FeedSource prices, @Named("stations") FeedSource stations,
                                                    PriceFeedParser priceParser, StationFeedParser stationParser,
                                                    PriceGaugeVec sink, Metrics metrics) {
        return new RefreshScheduler(prices, stations, priceParser, stationParser, sink, config.interval(), metrics);
    }

    @Provides @Singleton MetricsServer metricsServer(PriceGaugeVec prices, MetricRegistry registry, RefreshScheduler scheduler) throws IOException {
        return new MetricsServer(config.listenAddress(), config.metricsPath(), prices, registry, scheduler);
    }
}
