package org.iceforge.warden.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tiered cache over a {@link CacheStore}. Values are stored as JSON.
 *
 * <p>Best effort: any store failure is logged, counted and reported as a miss (reads) or ignored (writes and
 * invalidations). Callers never see a cache exception.
 */
public class CacheManager {
    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    private final CacheStore store;
    private final CacheSettings settings;
    private final ObjectMapper mapper;
    private final Map<CacheTier, TierStats> stats = new EnumMap<>(CacheTier.class);

    public CacheManager(CacheStore store, CacheSettings settings) {
        this(store, settings, defaultMapper());
    }

    public CacheManager(CacheStore store, CacheSettings settings, ObjectMapper mapper) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = settings == null ? CacheSettings.defaults() : settings;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        for (CacheTier tier : CacheTier.values()) stats.put(tier, new TierStats());
        if (!this.settings.volatilityOrdered()) {
            log.warn("Cache TTLs are not ordered schema >= permission >= query (schema={}, permission={}, query={})",
                    this.settings.schemaTtl(), this.settings.permissionTtl(), this.settings.queryTtl());
        }
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .enable(DeserializationFeature.USE_LONG_FOR_INTS)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public <T> Optional<T> get(CacheTier tier, String key, Class<T> type) {
        TierStats s = stats.get(tier);
        String storeKey = storeKey(tier, key);
        Optional<String> raw;
        try {
            raw = store.get(storeKey);
        } catch (RuntimeException e) {
            s.error();
            s.miss();
            log.warn("Cache read failed for tier={} ({}); treating as miss", tier, e.getMessage());
            return Optional.empty();
        }
        if (raw.isEmpty()) {
            s.miss();
            return Optional.empty();
        }
        try {
            T value = mapper.readValue(raw.get(), type);
            s.hit();
            return Optional.of(value);
        } catch (JsonProcessingException e) {
            s.error();
            s.miss();
            log.warn("Dropping undecodable cache entry tier={} ({})", tier, e.getOriginalMessage());
            invalidate(tier, key);
            return Optional.empty();
        }
    }

    public void put(CacheTier tier, String key, Object value) {
        put(tier, key, value, settings.ttl(tier));
    }

    public void put(CacheTier tier, String key, Object value, Duration ttl) {
        if (value == null) return;
        String json;
        try {
            json = mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            stats.get(tier).error();
            log.warn("Cannot encode cache value for tier={} ({})", tier, e.getOriginalMessage());
            return;
        }
        try {
            store.put(storeKey(tier, key), json, ttl == null ? settings.ttl(tier) : ttl);
        } catch (RuntimeException e) {
            stats.get(tier).error();
            log.warn("Cache write failed for tier={} ({}); continuing without cache", tier, e.getMessage());
        }
    }

    public void invalidate(CacheTier tier, String key) {
        try {
            store.delete(storeKey(tier, key));
        } catch (RuntimeException e) {
            stats.get(tier).error();
            log.warn("Cache invalidation failed for tier={} ({})", tier, e.getMessage());
        }
    }

    /**
     * Removes every entry of {@code tier} whose key starts with {@code prefix}; an empty prefix clears the tier.
     *
     * @return number of removed entries, or -1 when the store could not be reached
     */
    public long invalidatePrefix(CacheTier tier, String prefix) {
        try {
            long removed = store.deleteByPrefix(storeKey(tier, prefix == null ? "" : prefix));
            log.info("Invalidated {} {} cache entries with prefix '{}'", removed, tier, prefix);
            return removed;
        } catch (RuntimeException e) {
            stats.get(tier).error();
            log.warn("Cache prefix invalidation failed for tier={} ({})", tier, e.getMessage());
            return -1;
        }
    }

    public CacheMetrics stats(CacheTier tier) {
        return stats.get(tier);
    }

    public Map<CacheTier, CacheMetrics> stats() {
        return Collections.unmodifiableMap(new EnumMap<CacheTier, CacheMetrics>(stats));
    }

    public CacheSettings settings() {
        return settings;
    }

    public boolean storeReachable() {
        try {
            return store.ping();
        } catch (RuntimeException e) {
            log.debug("Cache store ping failed: {}", e.getMessage());
            return false;
        }
    }

    private String storeKey(CacheTier tier, String key) {
        return settings.keyPrefix() + tier.keyPrefix() + key;
    }
}
