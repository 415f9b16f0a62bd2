package org.iceforge.warden.cache;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeysTest {

    @Test
    void queryKeyIsStableForIdenticalInputs() {
        String a = CacheKeys.query("SELECT * FROM t WHERE id = ?", List.of(1), "alice", 1000);
        String b = CacheKeys.query("SELECT * FROM t WHERE id = ?", List.of(1), "alice", 1000);

        assertEquals(a, b);
        assertEquals(64, a.length());
    }

    @Test
    void queryKeyScopesByUserParametersAndRowLimit() {
        String base = CacheKeys.query("SELECT 1", List.of(), "alice", 1000);

        assertNotEquals(base, CacheKeys.query("SELECT 1", List.of(), "bob", 1000));
        assertNotEquals(base, CacheKeys.query("SELECT 1", List.of(), "alice", 10));
        assertNotEquals(CacheKeys.query("SELECT ?", List.of(1), "alice", 10),
                CacheKeys.query("SELECT ?", List.of(1.0), "alice", 10));
        assertNotEquals(CacheKeys.query("SELECT ?", List.of("1"), "alice", 10),
                CacheKeys.query("SELECT ?", List.of(1), "alice", 10));
        assertNotEquals(CacheKeys.query("SELECT ?", Arrays.asList((Object) null), "alice", 10),
                CacheKeys.query("SELECT ?", List.of("null"), "alice", 10));
    }

    @Test
    void userIdsCannotCollideThroughSeparators() {
        assertNotEquals(CacheKeys.permission("a:b", "c", "d"), CacheKeys.permission("a", "b:c", "d"));
        assertTrue(CacheKeys.permission("alice", "Public", "Orders").startsWith(CacheKeys.permissionPrefix("alice")));
        assertEquals("alice:public.orders", CacheKeys.permission("alice", "Public", "Orders"));
    }
}
