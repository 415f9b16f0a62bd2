package org.iceforge.warden.cache;

import org.iceforge.warden.exec.ExecutionResult;
import org.iceforge.warden.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CacheManagerTest {

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    private final InMemoryCacheStore store = new InMemoryCacheStore(clock, 1000);
    private final CacheManager cache = new CacheManager(store, CacheSettings.defaults());

    private static ExecutionResult sample() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", 1L);
        row.put("name", "Ada");
        row.put("score", new BigDecimal("9.50"));
        row.put("balance", new BigDecimal("12345678901234567.89"));
        row.put("note", null);
        return new ExecutionResult(List.of("id", "name", "score", "balance", "note"), List.of(row), 1, 12, false, false);
    }

    @Test
    void storedResultReadsBackEqual() {
        cache.put(CacheTier.QUERY, "k", sample());

        Optional<ExecutionResult> hit = cache.get(CacheTier.QUERY, "k", ExecutionResult.class);

        assertEquals(Optional.of(sample()), hit);
        assertTrue(store.get("warden:query:k").isPresent());
        assertEquals(1, cache.stats(CacheTier.QUERY).hits());
    }

    @Test
    void tiersExpireIndependently() {
        cache.put(CacheTier.QUERY, "k", "q");
        cache.put(CacheTier.PERMISSION, "k", "p");
        cache.put(CacheTier.SCHEMA, "k", "s");

        clock.advance(Duration.ofMinutes(6));
        assertFalse(cache.get(CacheTier.QUERY, "k", String.class).isPresent());
        assertTrue(cache.get(CacheTier.PERMISSION, "k", String.class).isPresent());

        clock.advance(Duration.ofMinutes(10));
        assertFalse(cache.get(CacheTier.PERMISSION, "k", String.class).isPresent());
        assertTrue(cache.get(CacheTier.SCHEMA, "k", String.class).isPresent());
    }

    @Test
    void prefixInvalidationStaysInsideOneTier() {
        cache.put(CacheTier.PERMISSION, "alice:public.a", "1");
        cache.put(CacheTier.PERMISSION, "alice:public.b", "1");
        cache.put(CacheTier.QUERY, "alice:public.a", "1");

        assertEquals(2, cache.invalidatePrefix(CacheTier.PERMISSION, "alice:"));
        assertTrue(cache.get(CacheTier.QUERY, "alice:public.a", String.class).isPresent());
    }

    @Test
    void storeFailuresDegradeToMisses() {
        CacheStore broken = mock(CacheStore.class);
        when(broken.get(anyString())).thenThrow(new CacheStoreException("connection refused", null));
        doThrow(new CacheStoreException("connection refused", null)).when(broken).put(anyString(), anyString(), any());
        when(broken.deleteByPrefix(anyString())).thenThrow(new CacheStoreException("connection refused", null));
        when(broken.ping()).thenThrow(new CacheStoreException("connection refused", null));
        CacheManager degraded = new CacheManager(broken, CacheSettings.defaults());

        assertFalse(degraded.get(CacheTier.QUERY, "k", String.class).isPresent());
        degraded.put(CacheTier.QUERY, "k", "v");
        assertEquals(-1, degraded.invalidatePrefix(CacheTier.QUERY, ""));
        assertFalse(degraded.storeReachable());

        CacheMetrics stats = degraded.stats(CacheTier.QUERY);
        assertEquals(1, stats.misses());
        assertEquals(3, stats.errors());
    }

    @Test
    void undecodableEntryIsDroppedAndCountedAsMiss() {
        store.put("warden:query:k", "{not json", Duration.ofMinutes(1));

        assertFalse(cache.get(CacheTier.QUERY, "k", ExecutionResult.class).isPresent());
        assertFalse(store.get("warden:query:k").isPresent());
        assertEquals(1, cache.stats(CacheTier.QUERY).errors());
    }

    @Test
    void hitRatioAndSettings() {
        cache.put(CacheTier.SCHEMA, "t", "x");
        cache.get(CacheTier.SCHEMA, "t", String.class);
        cache.get(CacheTier.SCHEMA, "missing", String.class);

        assertThat(cache.stats(CacheTier.SCHEMA).hitRatio()).isEqualTo(0.5);
        assertThat(cache.stats()).containsOnlyKeys(CacheTier.values());
        assertTrue(cache.settings().volatilityOrdered());
        assertFalse(new CacheSettings("", Duration.ofHours(1), Duration.ofMinutes(1), Duration.ofMinutes(1))
                .volatilityOrdered());
    }
}
