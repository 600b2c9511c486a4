package dev.aparikh.torrentsearch.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity cache whose entries expire after a time-to-live and are evicted least recently used
 * first when the capacity is reached. An entry is expired from the instant {@code put time + ttl}
 * onwards. Expiry is checked lazily on read; there is no background sweep.
 * <p>
 * Every operation, reads included, runs under a single lock since a read refreshes the entry's
 * access time. Entries are replaced as a whole, so callers never observe a value paired with another
 * value's expiry.
 */
public class BoundedExpiringCache<K, V> {

    private final int maxEntries;
    private final Duration defaultTtl;
    private final Clock clock;
    private final Map<K, Entry<V>> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    // breaks ties between entries touched within the same clock tick
    private long accessSequence;

    public BoundedExpiringCache(int maxEntries, Duration defaultTtl) {
        this(maxEntries, defaultTtl, Clock.systemUTC());
    }

    public BoundedExpiringCache(int maxEntries, Duration defaultTtl, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        this.maxEntries = maxEntries;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    public Optional<V> get(K key) {
        if (key == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            Entry<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            if (!now.isBefore(entry.expiresAt())) {
                entries.remove(key);
                return Optional.empty();
            }
            entries.put(key, entry.touched(now, ++accessSequence));
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    public void put(K key, V value) {
        put(key, value, defaultTtl);
    }

    public void put(K key, V value, Duration ttl) {
        if (key == null || value == null) {
            return;
        }
        Duration effectiveTtl = ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;
        lock.lock();
        try {
            if (!entries.containsKey(key)) {
                evictLeastRecentlyUsed(entries.size() + 1 - maxEntries);
            }
            Instant now = clock.instant();
            entries.put(key, new Entry<>(value, now, ++accessSequence, now.plus(effectiveTtl)));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return maxEntries;
    }

    // caller holds the lock
    private void evictLeastRecentlyUsed(int overflow) {
        if (overflow <= 0) {
            return;
        }
        List<K> victims = entries.entrySet().stream()
                .sorted(Comparator.comparing((Map.Entry<K, Entry<V>> e) -> e.getValue().lastAccessedAt())
                        .thenComparingLong(e -> e.getValue().sequence()))
                .limit(overflow)
                .map(Map.Entry::getKey)
                .toList();
        victims.forEach(entries::remove);
    }

    private record Entry<V>(V value, Instant lastAccessedAt, long sequence, Instant expiresAt) {
        Entry<V> touched(Instant now, long newSequence) {
            return new Entry<>(value, now, newSequence, expiresAt);
        }
    }
}
