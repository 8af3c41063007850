package io.fuelprices.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DurationsTest {
    @Test
    void parsesUnitSuffixedComponents() {
        assertEquals(Duration.ofHours(6), Durations.parse("6h"));
        assertEquals(Duration.ofMinutes(90), Durations.parse("1h30m"));
        assertEquals(Duration.ofSeconds(90), Durations.parse("90s"));
        assertEquals(Duration.ofMillis(250), Durations.parse("250ms"));
        assertEquals(Duration.ofMinutes(90), Durations.parse("1.5h"));
    }

    @Test
    void parsesIso8601() {
        assertEquals(Duration.ofHours(6), Durations.parse("PT6H"));
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> Durations.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("6"));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("6 hours"));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("h6"));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("PTxH"));
    }
}
