package io.fuelprices.runtime;

import com.codahale.metrics.Timer;
import io.fuelprices.core.BatchSink;
import io.fuelprices.core.FeedSource;
import io.fuelprices.core.JoinedPrice;
import io.fuelprices.core.PriceRecord;
import io.fuelprices.core.Sink;
import io.fuelprices.core.Station;
import io.fuelprices.metrics.Metrics;
import io.fuelprices.parse.PriceFeedParser;
import io.fuelprices.parse.StationFeedParser;
import io.fuelprices.runtime.IterationResult.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the refresh loop on a single background thread: fetch and cache prices, fetch stations,
 * join, hand the joined prices to the sink, then sleep for the interval. A failing stage abandons
 * the rest of its iteration; nothing thrown by an iteration ends the loop.
 */
public class RefreshScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final FeedSource prices;
    private final FeedSource stations;
    private final PriceFeedParser priceParser;
    private final StationFeedParser stationParser;
    private final Sink<JoinedPrice> sink;
    private final Duration interval;
    private final Metrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong iterations = new AtomicLong(0);
    private volatile IterationResult lastResult;
    private volatile Thread loopThread;

    private final Timer pricesTimer;
    private final Timer stationsTimer;

    public RefreshScheduler(FeedSource prices,
                            FeedSource stations,
                            PriceFeedParser priceParser,
                            StationFeedParser stationParser,
                            Sink<JoinedPrice> sink,
                            Duration interval,
                            Metrics metrics) {
        this.prices = Objects.requireNonNull(prices);
        this.stations = Objects.requireNonNull(stations);
        this.priceParser = Objects.requireNonNull(priceParser);
        this.stationParser = Objects.requireNonNull(stationParser);
        this.sink = Objects.requireNonNull(sink);
        this.interval = Objects.requireNonNull(interval);
        this.metrics = Objects.requireNonNull(metrics);
        this.pricesTimer = metrics.timer("refresh.prices.time");
        this.stationsTimer = metrics.timer("refresh.stations.time");
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        Thread t = new Thread(this::loop, "refresh-loop");
        t.setDaemon(true);
        loopThread = t;
        t.start();
    }

    public void stop() {
        running.set(false);
        Thread t = loopThread;
        if (t != null) {
            t.interrupt();
            try { t.join(5000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
        }
    }

    public boolean isRunning() { return running.get(); }
    public long iterations() { return iterations.get(); }
    public IterationResult lastResult() { return lastResult; }
    public Duration interval() { return interval; }

    private void loop() {
        while (running.get()) {
            try {
                runOnce();
            } catch (RuntimeException e) {
                log.error("Refresh iteration failed unexpectedly", e);
            }
            log.info("Sleeping for {}", interval);
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        running.set(false);
    }

    /** Runs a single iteration on the calling thread. */
    public IterationResult runOnce() {
        long n = iterations.incrementAndGet();
        metrics.counter("refresh.iterations").inc();
        IterationResult result = iterate(n);
        lastResult = result;
        if (result.success()) {
            log.info("Iteration {} emitted {} prices ({} stations)", n, result.emitted(), result.stationsLoaded());
        } else {
            metrics.counter("refresh.failures." + result.failedAt().name().toLowerCase(Locale.ROOT)).inc();
            log.warn("Iteration {} failed at {}: {}", n, result.failedAt(), result.error().getMessage(), result.error());
        }
        return result;
    }

    private IterationResult iterate(long n) {
        List<PriceRecord> records;
        try (Timer.Context ignored = pricesTimer.time(); InputStream in = prices.open()) {
            records = priceParser.parse(in);
        } catch (Exception e) {
            return IterationResult.failed(n, Stage.FETCH_PRICES, 0, 0, e);
        }

        Map<Long, Station> table;
        try (Timer.Context ignored = stationsTimer.time(); InputStream in = stations.open()) {
            table = stationParser.parse(in);
        } catch (Exception e) {
            return IterationResult.failed(n, Stage.FETCH_STATIONS, records.size(), 0, e);
        }

        List<JoinedPrice> joined = StationJoin.join(records, table);
        try {
            emit(joined);
        } catch (Exception e) {
            return IterationResult.failed(n, Stage.JOIN_AND_EMIT, records.size(), table.size(), e);
        }
        metrics.counter("refresh.emitted").inc(joined.size());
        return IterationResult.completed(n, records.size(), table.size(), joined.size());
    }

    private void emit(List<JoinedPrice> joined) throws Exception {
        if (sink instanceof BatchSink<JoinedPrice> bs) {
            bs.acceptBatch(joined);
        } else {
            for (JoinedPrice p : joined) {
                sink.accept(p);
            }
        }
    }

    @Override
    public void close() {
        stop();
        sink.close();
    }
}
