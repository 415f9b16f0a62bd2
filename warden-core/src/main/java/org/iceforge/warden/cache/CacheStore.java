package org.iceforge.warden.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value backend with per-key TTL. Implementations must be safe for concurrent use and throw
 * {@link CacheStoreException} when the backend cannot be reached.
 */
public interface CacheStore {

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    void delete(String key);

    /** Deletes every key starting with {@code prefix} and returns how many were removed. */
    long deleteByPrefix(String prefix);

    /**
     * Atomically increments a counter. A missing or expired counter starts at 1 and expires after {@code window};
     * later increments keep the original expiry.
     */
    CounterSnapshot increment(String key, Duration window);

    /** Cheap reachability probe. */
    boolean ping();
}
