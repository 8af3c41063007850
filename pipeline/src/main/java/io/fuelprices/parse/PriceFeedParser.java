package io.fuelprices.parse;

import com.codahale.metrics.MetricRegistry;
import io.fuelprices.cache.RecordCache;
import io.fuelprices.core.PriceRecord;
import io.fuelprices.error.FeedException;
import io.fuelprices.error.FetchException;
import io.fuelprices.error.MalformedFieldException;
import io.fuelprices.error.MalformedRowException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses the price feed: two header lines, then semicolon-separated rows of exactly five fields
 * (station id, fuel type, price, self-service flag, observation time). Any bad row fails the whole
 * batch. Every parsed record is put in the cache before the next row is read.
 */
public class PriceFeedParser {
    public static final int HEADER_LINES = 2;
    public static final int FIELDS = 5;
    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("d/M/uuuu H:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Set<String> TRUE_LITERALS = Set.of("1", "t", "T", "TRUE", "true", "True");
    private static final Set<String> FALSE_LITERALS = Set.of("0", "f", "F", "FALSE", "false", "False");
    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setDelimiter(';')
            .setIgnoreEmptyLines(true)
            .build();

    private final RecordCache cache;
    private final ZoneId zone;
    private final MetricRegistry registry; // optional

    public PriceFeedParser(RecordCache cache, ZoneId zone) { this(cache, zone, null); }
    public PriceFeedParser(RecordCache cache, ZoneId zone, MetricRegistry registry) {
        this.cache = Objects.requireNonNull(cache);
        this.zone = Objects.requireNonNull(zone);
        this.registry = registry;
    }

    public List<PriceRecord> parse(InputStream in) throws FeedException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            for (int i = 1; i <= HEADER_LINES; i++) {
                if (reader.readLine() == null) {
                    throw new MalformedRowException(i, "feed ended inside the " + HEADER_LINES + "-line header");
                }
            }
        } catch (IOException e) {
            throw new FetchException("failed to read price feed header", e);
        }

        List<PriceRecord> records = new ArrayList<>();
        try (CSVParser csv = CSVParser.parse(reader, FORMAT)) {
            for (CSVRecord row : csv) {
                long line = HEADER_LINES + row.getRecordNumber();
                PriceRecord record = parseRow(row.toList(), line);
                records.add(record);
                cache.put(record.cacheKey(), record);
                if (registry != null) registry.counter("prices.rows.parsed").inc();
            }
        } catch (IOException | UncheckedIOException e) {
            throw new FetchException("failed to read price feed after " + records.size() + " records", e);
        }
        return records;
    }

    PriceRecord parseRow(List<String> fields, long line) throws FeedException {
        if (fields.size() != FIELDS) {
            throw MalformedRowException.fieldCount(line, Integer.toString(FIELDS), fields.size());
        }
        long id;
        try {
            id = Long.parseLong(fields.get(0));
        } catch (NumberFormatException e) {
            throw new MalformedFieldException("station id", fields.get(0), line, e);
        }
        String fuelType = fields.get(1);
        double price;
        try {
            if (!DECIMAL.matcher(fields.get(2)).matches()) throw new NumberFormatException("not a decimal number");
            price = Double.parseDouble(fields.get(2));
        } catch (NumberFormatException e) {
            throw new MalformedFieldException("price", fields.get(2), line, e);
        }
        boolean selfService = parseBoolean(fields.get(3), line);
        ZonedDateTime observedAt;
        try {
            observedAt = LocalDateTime.parse(fields.get(4), TIMESTAMP).atZone(zone);
        } catch (DateTimeParseException e) {
            throw new MalformedFieldException("observation time", fields.get(4), line, e);
        }
        return new PriceRecord(id, fuelType, price, selfService, observedAt);
    }

    private static boolean parseBoolean(String value, long line) throws MalformedFieldException {
        if (TRUE_LITERALS.contains(value)) return true;
        if (FALSE_LITERALS.contains(value)) return false;
        throw new MalformedFieldException("self-service flag", value, line, null);
    }

    /** Renders a record back into the five feed fields. */
    public static List<String> formatRow(PriceRecord record) {
        return List.of(
                Long.toString(record.stationId()),
                record.fuelType(),
                Double.toString(record.price()),
                Boolean.toString(record.selfService()),
                record.observedAt().toLocalDateTime().format(TIMESTAMP));
    }
}
