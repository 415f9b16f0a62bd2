package org.iceforge.warden.ratelimit;

import org.iceforge.warden.cache.CacheStore;
import org.iceforge.warden.cache.CacheStoreException;
import org.iceforge.warden.cache.InMemoryCacheStore;
import org.iceforge.warden.error.ErrorKind;
import org.iceforge.warden.error.RateLimitExceededException;
import org.iceforge.warden.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RateLimiterTest {

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    private final InMemoryCacheStore store = new InMemoryCacheStore(clock, 1000);

    @Test
    void hundredAndFirstRequestInTheHourIsRejected() {
        RateLimiter limiter = new RateLimiter(store, RateLimitSettings.defaults(), clock);

        for (int i = 0; i < 100; i++) limiter.check("alice");
        clock.advance(Duration.ofMinutes(20));

        RateLimitExceededException e = assertThrows(RateLimitExceededException.class, () -> limiter.check("alice"));
        assertEquals(ErrorKind.RATE_LIMIT, e.kind());
        assertEquals("Rate limit exceeded: 100 requests per hour", e.getMessage());
        assertEquals(40 * 60, e.retryAfterSeconds());
        assertEquals(0, limiter.remaining("alice"));
    }

    @Test
    void budgetsArePerUserAndResetWithTheWindow() {
        RateLimiter limiter = new RateLimiter(store, new RateLimitSettings(true, 2, Duration.ofMinutes(1), "t:"), clock);

        limiter.check("alice");
        limiter.check("alice");
        assertThrows(RateLimitExceededException.class, () -> limiter.check("alice"));
        limiter.check("bob");
        assertEquals(1, limiter.remaining("bob"));

        clock.advance(Duration.ofMinutes(1));
        limiter.check("alice");
        assertEquals(1, limiter.remaining("alice"));
    }

    @Test
    void disabledLimiterNeverRejects() {
        RateLimiter limiter = new RateLimiter(store, new RateLimitSettings(false, 1, Duration.ofMinutes(1), "t:"), clock);

        for (int i = 0; i < 5; i++) limiter.check("alice");
        assertEquals(0, store.size());
    }

    @Test
    void unreachableStoreLetsRequestsThrough() {
        CacheStore broken = mock(CacheStore.class);
        when(broken.increment(anyString(), any())).thenThrow(new CacheStoreException("down", null));
        when(broken.get(anyString())).thenThrow(new CacheStoreException("down", null));
        RateLimiter limiter = new RateLimiter(broken, RateLimitSettings.defaults(), clock);

        assertDoesNotThrow(() -> limiter.check("alice"));
        assertEquals(100, limiter.remaining("alice"));
    }
}
