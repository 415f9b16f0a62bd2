package org.iceforge.warden.ratelimit;

import org.iceforge.warden.cache.CacheStore;
import org.iceforge.warden.cache.CounterSnapshot;
import org.iceforge.warden.error.RateLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-user request budget kept as an atomic counter in the cache store. The first request of a window creates the
 * counter with the window as its TTL; the budget resets when the counter expires.
 *
 * <p>An unreachable store lets requests through: losing rate limiting is preferable to refusing all traffic.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final CacheStore store;
    private final RateLimitSettings settings;
    private final Clock clock;

    public RateLimiter(CacheStore store, RateLimitSettings settings) {
        this(store, settings, Clock.systemUTC());
    }

    public RateLimiter(CacheStore store, RateLimitSettings settings, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = settings == null ? RateLimitSettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Counts one request for {@code userId}.
     *
     * @throws RateLimitExceededException when the budget of the current window is used up
     */
    public void check(String userId) {
        if (!settings.enabled()) return;
        CounterSnapshot counter;
        try {
            counter = store.increment(key(userId), settings.window());
        } catch (RuntimeException e) {
            log.warn("Rate limit store unavailable ({}); allowing request for user={}", e.getMessage(), userId);
            return;
        }
        if (counter.value() > settings.requestsPerWindow()) {
            long retryAfter = secondsUntil(counter.expiresAt());
            log.info("Rate limit exceeded for user={} ({} requests, retry in {}s)", userId, counter.value(), retryAfter);
            throw new RateLimitExceededException("Rate limit exceeded: " + settings.requestsPerWindow()
                    + " requests per " + describe(settings.window()), retryAfter);
        }
    }

    /** Requests left in the current window; the full budget when unknown. */
    public int remaining(String userId) {
        if (!settings.enabled()) return settings.requestsPerWindow();
        Optional<String> raw;
        try {
            raw = store.get(key(userId));
        } catch (RuntimeException e) {
            log.warn("Rate limit store unavailable ({})", e.getMessage());
            return settings.requestsPerWindow();
        }
        long used = raw.map(RateLimiter::parseCount).orElse(0L);
        return (int) Math.max(0, settings.requestsPerWindow() - used);
    }

    public RateLimitSettings settings() {
        return settings;
    }

    private String key(String userId) {
        return settings.keyPrefix() + "rate:" + userId;
    }

    private long secondsUntil(Instant expiresAt) {
        Duration left = Duration.between(clock.instant(), expiresAt);
        long seconds = left.getSeconds() + (left.getNano() > 0 ? 1 : 0);
        return Math.max(1, seconds);
    }

    private static long parseCount(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring unreadable rate counter value '{}'", raw);
            return 0L;
        }
    }

    private static String describe(Duration window) {
        if (window.toHours() > 0 && window.toMinutesPart() == 0 && window.toSecondsPart() == 0) {
            return window.toHours() == 1 ? "hour" : window.toHours() + " hours";
        }
        if (window.toMinutes() > 0 && window.toSecondsPart() == 0) {
            return window.toMinutes() == 1 ? "minute" : window.toMinutes() + " minutes";
        }
        return window.getSeconds() + " seconds";
    }
}
