package io.fuelprices.config;

import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

public record CollectorConfig(
        URI pricesUrl,
        URI stationsUrl,
        Duration interval,
        Duration cacheTtl,
        ZoneId sourceZone,
        String listen,
        String metricsPath
) {
    // See https://www.mimit.gov.it/index.php/it/open-data/elenco-dataset/carburanti-prezzi-praticati-e-anagrafica-degli-impianti
    public static final String DEFAULT_PRICES_URL = "https://www.mimit.gov.it/images/exportCSV/prezzo_alle_8.csv";
    public static final String DEFAULT_STATIONS_URL = "https://www.mimit.gov.it/images/exportCSV/anagrafica_impianti_attivi.csv";

    public static final Duration MIN_INTERVAL = Duration.ofMillis(1);
    public static final Duration MAX_INTERVAL = Duration.ofDays(365);

    public CollectorConfig {
        if (interval.compareTo(MIN_INTERVAL) < 0 || interval.compareTo(MAX_INTERVAL) > 0) {
            throw new IllegalArgumentException("interval must be between " + MIN_INTERVAL + " and " + MAX_INTERVAL + ": " + interval);
        }
        if (cacheTtl.isNegative()) throw new IllegalArgumentException("cache TTL must not be negative");
        if (!metricsPath.startsWith("/")) throw new IllegalArgumentException("metrics path must start with '/': " + metricsPath);
        checkListen(listen);
    }

    public static CollectorConfig fromEnv() {
        return from(System.getenv());
    }

    static CollectorConfig from(Map<String, String> env) {
        URI prices = URI.create(setting(env, "prices.url", "PRICES_URL", DEFAULT_PRICES_URL));
        URI stations = URI.create(setting(env, "stations.url", "STATIONS_URL", DEFAULT_STATIONS_URL));
        Duration interval = Durations.parse(setting(env, "interval", "INTERVAL", "6h"));
        Duration ttl = Durations.parse(setting(env, "cache.ttl", "CACHE_TTL", "1h"));
        ZoneId zone = ZoneId.of(setting(env, "source.zone", "SOURCE_ZONE", "Europe/Rome"));
        String listen = setting(env, "listen", "LISTEN", ":9112");
        String path = setting(env, "path", "PATH", "/metrics");
        return new CollectorConfig(prices, stations, interval, ttl, zone, listen, path);
    }

    private static String setting(Map<String, String> env, String property, String variable, String fallback) {
        return System.getProperty("fuelprices." + property, env.getOrDefault("FUELPRICES_" + variable, fallback));
    }

    public InetSocketAddress listenAddress() {
        int colon = listen.lastIndexOf(':');
        String host = listen.substring(0, colon);
        int port = Integer.parseInt(listen.substring(colon + 1));
        return host.isEmpty() ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    }

    /** Accepts {@code host:port} or {@code :port}; an empty host binds all interfaces. */
    static void checkListen(String listen) {
        int colon = listen.lastIndexOf(':');
        if (colon < 0) throw new IllegalArgumentException("listen address must be host:port or :port: " + listen);
        int port;
        try {
            port = Integer.parseInt(listen.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in listen address: " + listen, e);
        }
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + listen);
    }

    public CollectorConfig withInterval(Duration d) { return new CollectorConfig(pricesUrl, stationsUrl, d, cacheTtl, sourceZone, listen, metricsPath); }
    public CollectorConfig withCacheTtl(Duration d) { return new CollectorConfig(pricesUrl, stationsUrl, interval, d, sourceZone, listen, metricsPath); }
    public CollectorConfig withListen(String l) { return new CollectorConfig(pricesUrl, stationsUrl, interval, cacheTtl, sourceZone, l, metricsPath); }
    public CollectorConfig withMetricsPath(String p) { return new CollectorConfig(pricesUrl, stationsUrl, interval, cacheTtl, sourceZone, listen, p); }
    public CollectorConfig withFeeds(URI prices, URI stations) { return new CollectorConfig(prices, stations, interval, cacheTtl, sourceZone, listen, metricsPath); }
    public CollectorConfig withSourceZone(ZoneId z) { return new CollectorConfig(pricesUrl, stationsUrl, interval, cacheTtl, z, listen, metricsPath); }
}
