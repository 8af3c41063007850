package io.fuelprices.cache;

import io.fuelprices.core.PriceRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only, key-addressed store of price records with read-time expiry.
 *
 * <p>An entry is stamped when first written and never re-stamped: later puts append to it. Reads
 * treat an entry older than the TTL as absent but leave it in place, so memory grows with the
 * number of distinct keys ever seen. All operations are mutually exclusive.
 */
public class RecordCache {
    private final Map<String, Entry> entries = new HashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public RecordCache(Duration ttl) { this(ttl, Clock.systemUTC()); }
    public RecordCache(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl);
        this.clock = Objects.requireNonNull(clock);
    }

    public synchronized void put(String key, PriceRecord record) {
        Entry entry = entries.get(key);
        if (entry == null) {
            entry = new Entry(clock.instant());
            entries.put(key, entry);
        }
        entry.records.add(record);
    }

    /** Records stored under key in insertion order, or empty when absent or expired. */
    public synchronized Optional<List<PriceRecord>> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) return Optional.empty();
        if (Duration.between(entry.createdAt, clock.instant()).compareTo(ttl) > 0) return Optional.empty();
        return Optional.of(List.copyOf(entry.records));
    }

    /** Stored entries, expired ones included. */
    public synchronized int size() {
        return entries.size();
    }

    public Duration ttl() { return ttl; }

    private static final class Entry {
        final Instant createdAt;
        final List<PriceRecord> records = new ArrayList<>();

        Entry(Instant createdAt) {
            this.createdAt = createdAt;
        }
    }
}
