package org.iceforge.warden.cache;

import org.iceforge.warden.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCacheStoreTest {

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");

    @Test
    void entriesExpireAfterTheirTtl() {
        InMemoryCacheStore store = new InMemoryCacheStore(clock, 100);
        store.put("k", "v", Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(4));
        assertEquals(Optional.of("v"), store.get("k"));

        clock.advance(Duration.ofMinutes(1));
        assertEquals(Optional.empty(), store.get("k"));
        assertEquals(0, store.size());
    }

    @Test
    void deleteByPrefixOnlyTouchesMatchingKeys() {
        InMemoryCacheStore store = new InMemoryCacheStore(clock, 100);
        store.put("permission:alice:public.a", "1", Duration.ofMinutes(1));
        store.put("permission:alice:public.b", "1", Duration.ofMinutes(1));
        store.put("permission:alicia:public.a", "1", Duration.ofMinutes(1));

        assertEquals(2, store.deleteByPrefix("permission:alice:"));
        assertTrue(store.get("permission:alicia:public.a").isPresent());
    }

    @Test
    void counterKeepsItsWindowAndRestartsAfterExpiry() {
        InMemoryCacheStore store = new InMemoryCacheStore(clock, 100);
        Instant windowEnd = clock.instant().plus(Duration.ofHours(1));

        assertEquals(1, store.increment("rate:u", Duration.ofHours(1)).value());
        clock.advance(Duration.ofMinutes(30));
        CounterSnapshot second = store.increment("rate:u", Duration.ofHours(1));
        assertEquals(2, second.value());
        assertEquals(windowEnd, second.expiresAt());

        clock.advance(Duration.ofMinutes(30));
        CounterSnapshot fresh = store.increment("rate:u", Duration.ofHours(1));
        assertEquals(1, fresh.value());
        assertEquals(clock.instant().plus(Duration.ofHours(1)), fresh.expiresAt());
    }

    @Test
    void boundEvictsTheEntryClosestToExpiry() {
        InMemoryCacheStore store = new InMemoryCacheStore(clock, 2);
        store.put("short", "1", Duration.ofMinutes(1));
        store.put("long", "2", Duration.ofHours(1));
        store.put("new", "3", Duration.ofMinutes(30));

        assertEquals(2, store.size());
        assertFalse(store.get("short").isPresent());
        assertTrue(store.get("long").isPresent());
        assertTrue(store.get("new").isPresent());
    }

    @Test
    void sweepRemovesExpiredEntries() {
        InMemoryCacheStore store = new InMemoryCacheStore(clock, 100);
        store.put("a", "1", Duration.ofSeconds(10));
        store.put("b", "1", Duration.ofMinutes(10));

        clock.advance(Duration.ofMinutes(1));

        assertEquals(1, store.sweepExpired());
        assertEquals(1, store.size());
    }
}
