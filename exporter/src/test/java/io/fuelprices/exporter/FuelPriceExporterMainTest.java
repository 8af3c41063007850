package io.fuelprices.exporter;

import io.fuelprices.config.CollectorConfig;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.net.URI;
import java.time.Duration;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class FuelPriceExporterMainTest {
    @Test
    void optionsOverrideConfiguration() {
        FuelPriceExporterMain main = new FuelPriceExporterMain();
        new CommandLine(main).parseArgs("-p", "/prom", "-l", ":9300", "-i", "1h30m", "--cache-ttl", "PT2H",
                "--stations-url", "http://localhost/s.csv", "--source-zone", "UTC");
        CollectorConfig cfg = main.config(CollectorConfig.fromEnv());

        assertEquals("/prom", cfg.metricsPath());
        assertEquals(":9300", cfg.listen());
        assertEquals(Duration.ofMinutes(90), cfg.interval());
        assertEquals(Duration.ofHours(2), cfg.cacheTtl());
        assertEquals(URI.create("http://localhost/s.csv"), cfg.stationsUrl());
        assertEquals(URI.create(CollectorConfig.DEFAULT_PRICES_URL), cfg.pricesUrl());
        assertEquals(ZoneId.of("UTC"), cfg.sourceZone());
    }

    @Test
    void unsetOptionsKeepDefaults() {
        FuelPriceExporterMain main = new FuelPriceExporterMain();
        new CommandLine(main).parseArgs();
        CollectorConfig base = CollectorConfig.fromEnv();
        assertEquals(base, main.config(base));
    }

    @Test
    void badIntervalIsUsageError() {
        int code = new CommandLine(new FuelPriceExporterMain()).execute("-i", "soon");
        assertEquals(2, code);
    }
}
