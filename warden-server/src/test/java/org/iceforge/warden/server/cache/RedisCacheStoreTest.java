package org.iceforge.warden.server.cache;

import org.iceforge.warden.cache.CacheStoreException;
import org.iceforge.warden.cache.CounterSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisCacheStoreTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private StringRedisTemplate redis;
    private ValueOperations<String, String> values;
    private RedisCacheStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        values = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(values);
        store = new RedisCacheStore(redis, clock);
    }

    @Test
    void getAndPutUseStringValues() {
        when(values.get("warden:query:k")).thenReturn("{\"a\":1}");

        assertEquals(Optional.of("{\"a\":1}"), store.get("warden:query:k"));
        assertEquals(Optional.empty(), store.get("missing"));

        store.put("warden:query:k", "v", Duration.ofMinutes(5));
        verify(values).set("warden:query:k", "v", Duration.ofMinutes(5));
    }

    @Test
    @SuppressWarnings("unchecked")
    void deleteByPrefixScansAndDeletesInBatches() {
        Cursor<String> cursor = mock(Cursor.class);
        when(cursor.hasNext()).thenReturn(true, true, true, false);
        when(cursor.next()).thenReturn("warden:permission:ana:public.a", "warden:permission:ana:public.b",
                "warden:permission:ana:public.c");
        when(redis.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(redis.delete(anyCollection())).thenAnswer(inv -> (long) ((Collection<?>) inv.getArgument(0)).size());

        long removed = store.deleteByPrefix("warden:permission:ana:");

        assertEquals(3, removed);
        ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
        verify(redis).scan(options.capture());
        assertEquals("warden:permission:ana:*", options.getValue().getPattern());
        verify(cursor).close();
    }

    @Test
    void globCharactersInPrefixAreEscaped() {
        assertEquals("warden:query:a\\*b\\?\\[c\\]", RedisCacheStore.escapeGlob("warden:query:a*b?[c]"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void incrementReturnsCountAndExpiryFromScript() {
        when(redis.execute(any(RedisScript.class), anyList(), any(Object[].class))).thenReturn(List.of(3L, 1_500_000L));

        CounterSnapshot c = store.increment("warden:rate:u1", Duration.ofHours(1));

        assertEquals(3, c.value());
        assertEquals(Instant.parse("2024-05-01T10:25:00Z"), c.expiresAt());
        verify(redis).execute(eq(RedisCacheStore.INCREMENT), eq(List.of("warden:rate:u1")), eq("3600000"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void pingIsTrueOnPong() {
        when(redis.execute(any(RedisCallback.class))).thenReturn("PONG");

        assertTrue(store.ping());
    }

    @Test
    void connectionFailuresBecomeCacheStoreExceptions() {
        when(values.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));
        doThrow(new RedisConnectionFailureException("refused")).when(values).set(anyString(), anyString(), any(Duration.class));

        assertThatThrownBy(() -> store.get("k")).isInstanceOf(CacheStoreException.class).hasMessageContaining("GET");
        assertThatThrownBy(() -> store.put("k", "v", Duration.ofSeconds(1))).isInstanceOf(CacheStoreException.class);
    }
}
