package io.fuelprices.parse;

import com.codahale.metrics.MetricRegistry;
import io.fuelprices.core.Station;
import io.fuelprices.core.StationType;
import io.fuelprices.error.FeedException;
import io.fuelprices.error.FetchException;
import io.fuelprices.error.MalformedFieldException;
import io.fuelprices.error.MalformedRowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the station registry into an id-keyed table.
 *
 * <p>The registry is split on the delimiter without quote handling: it carries unterminated
 * quote characters that quote-aware readers reject. Rows have 10 fields, or 11 when the address
 * column is duplicated; in that case the first address is kept and the duplicate dropped. Any
 * other field count, or a non-numeric id, aborts the whole table. Blank lines are skipped and
 * duplicate ids resolve to the later row.
 */
public class StationFeedParser {
    private static final Logger log = LoggerFactory.getLogger(StationFeedParser.class);

    public static final int HEADER_LINES = 1;
    public static final int FIELDS = 10;
    public static final int FIELDS_WITH_DUPLICATE_ADDRESS = 11;
    private static final String DELIMITER = ";";

    private final MetricRegistry registry; // optional

    public StationFeedParser() { this(null); }
    public StationFeedParser(MetricRegistry registry) {
        this.registry = registry;
    }

    public Map<Long, Station> parse(InputStream in) throws FeedException {
        Map<Long, Station> stations = new LinkedHashMap<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            long line = 0;
            String text;
            while ((text = reader.readLine()) != null) {
                line++;
                if (line <= HEADER_LINES) continue;
                if (text.isBlank()) {
                    log.warn("Skipping empty station row at line {}", line);
                    if (registry != null) registry.counter("stations.rows.skipped").inc();
                    continue;
                }
                Station station = parseRow(text.split(DELIMITER, -1), line);
                Station previous = stations.put(station.id(), station);
                if (previous != null) {
                    log.warn("Duplicate station id {} at line {} (type '{}'), keeping the later row",
                            station.id(), line, station.type());
                    if (registry != null) registry.counter("stations.duplicates").inc();
                }
            }
        } catch (IOException e) {
            throw new FetchException("failed to read station feed after " + stations.size() + " stations", e);
        }
        return stations;
    }

    Station parseRow(String[] f, long line) throws FeedException {
        // offset of the fields following the address: 1 when the address is duplicated
        int shift;
        if (f.length == FIELDS) {
            shift = 0;
        } else if (f.length == FIELDS_WITH_DUPLICATE_ADDRESS) {
            shift = 1;
        } else {
            throw MalformedRowException.fieldCount(line, FIELDS + " or " + FIELDS_WITH_DUPLICATE_ADDRESS, f.length);
        }
        long id;
        try {
            id = Long.parseLong(f[0]);
        } catch (NumberFormatException e) {
            throw new MalformedFieldException("station id", f[0], line, e);
        }
        return new Station(
                id,
                f[1],
                f[2],
                StationType.of(f[3]),
                f[4],
                f[5],
                f[6 + shift],
                f[7 + shift],
                f[8 + shift],
                f[9 + shift]);
    }
}
