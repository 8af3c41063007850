package io.fuelprices.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses durations written either as ISO-8601 ({@code PT6H}) or as unit-suffixed
 * components ({@code 6h}, {@code 1h30m}, {@code 90s}, {@code 250ms}).
 */
public final class Durations {
    private static final Pattern COMPONENT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|h|m|s)");

    private Durations() {}

    public static Duration parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("empty duration");
        String s = text.trim();
        if (s.startsWith("P") || s.startsWith("p")) {
            try {
                return Duration.parse(s);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("invalid duration: " + text, e);
            }
        }
        Matcher m = COMPONENT.matcher(s);
        long nanos = 0;
        int end = 0;
        while (m.find()) {
            if (m.start() != end) throw new IllegalArgumentException("invalid duration: " + text);
            double amount = Double.parseDouble(m.group(1));
            long unitNanos = switch (m.group(2)) {
                case "h" -> 3_600_000_000_000L;
                case "m" -> 60_000_000_000L;
                case "s" -> 1_000_000_000L;
                default -> 1_000_000L;
            };
            nanos += Math.round(amount * unitNanos);
            end = m.end();
        }
        if (end == 0 || end != s.length()) throw new IllegalArgumentException("invalid duration: " + text);
        return Duration.ofNanos(nanos);
    }
}
