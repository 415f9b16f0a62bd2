package org.iceforge.warden.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Process-local store. Expiry is checked lazily on read; {@link #sweepExpired()} (optionally on a timer) and the
 * entry bound keep memory in check.
 */
public final class InMemoryCacheStore implements CacheStore, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

    private record Entry(String value, Instant expiresAt) {
        boolean expired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    private final ConcurrentHashMap<String, Entry> map = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxEntries;
    private volatile ScheduledExecutorService sweeper;

    public InMemoryCacheStore() {
        this(Clock.systemUTC(), 100_000);
    }

    public InMemoryCacheStore(Clock clock, int maxEntries) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.maxEntries = maxEntries <= 0 ? Integer.MAX_VALUE : maxEntries;
    }

    @Override
    public Optional<String> get(String key) {
        if (key == null) return Optional.empty();
        Entry e = map.get(key);
        if (e == null) return Optional.empty();
        if (e.expired(clock.instant())) {
            map.remove(key, e);
            return Optional.empty();
        }
        return Optional.of(e.value());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        if (key == null || value == null) return;
        if (map.size() >= maxEntries && !map.containsKey(key)) makeRoom();
        map.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void delete(String key) {
        if (key != null) map.remove(key);
    }

    @Override
    public long deleteByPrefix(String prefix) {
        long removed = 0;
        for (String key : map.keySet()) {
            if (key.startsWith(prefix) && map.remove(key) != null) removed++;
        }
        return removed;
    }

    @Override
    public CounterSnapshot increment(String key, Duration window) {
        Instant now = clock.instant();
        Entry updated = map.compute(key, (k, e) -> {
            if (e == null || e.expired(now)) return new Entry("1", now.plus(window));
            long next = Long.parseLong(e.value()) + 1;
            return new Entry(Long.toString(next), e.expiresAt());
        });
        return new CounterSnapshot(Long.parseLong(updated.value()), updated.expiresAt());
    }

    @Override
    public boolean ping() {
        return true;
    }

    public int size() {
        return map.size();
    }

    /** Removes every expired entry and returns how many were dropped. */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, Entry> e : map.entrySet()) {
            if (e.getValue().expired(now) && map.remove(e.getKey(), e.getValue())) removed++;
        }
        return removed;
    }

    public synchronized void startSweeper(Duration interval) {
        if (sweeper != null || interval == null || interval.isZero() || interval.isNegative()) return;
        ScheduledExecutorService s = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "warden-cache-sweeper");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        s.scheduleWithFixedDelay(() -> {
            int removed = sweepExpired();
            if (removed > 0) log.debug("Swept {} expired cache entries", removed);
        }, millis, millis, TimeUnit.MILLISECONDS);
        sweeper = s;
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
    }

    private void makeRoom() {
        if (sweepExpired() > 0 && map.size() < maxEntries) return;
        // evict the entry closest to expiry
        map.entrySet().stream()
                .min(Comparator.comparing(e -> e.getValue().expiresAt()))
                .ifPresent(e -> map.remove(e.getKey(), e.getValue()));
    }
}
