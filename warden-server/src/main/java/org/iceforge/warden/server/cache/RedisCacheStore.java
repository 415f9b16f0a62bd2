package org.iceforge.warden.server.cache;

import org.iceforge.warden.cache.CacheStore;
import org.iceforge.warden.cache.CacheStoreException;
import org.iceforge.warden.cache.CounterSnapshot;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link CacheStore} over Redis. Prefix deletion walks the keyspace with SCAN in batches, never KEYS.
 */
public class RedisCacheStore implements CacheStore {

    static final int SCAN_BATCH = 500;

    // INCR and the first PEXPIRE must happen together, else a crash between them leaves a counter that never resets
    static final RedisScript<List> INCREMENT = new DefaultRedisScript<>(
            "local c = redis.call('INCR', KEYS[1]) "
                    + "local t = redis.call('PTTL', KEYS[1]) "
                    + "if t < 0 then redis.call('PEXPIRE', KEYS[1], ARGV[1]) t = tonumber(ARGV[1]) end "
                    + "return {c, t}",
            List.class);

    private final StringRedisTemplate redis;
    private final Clock clock;

    public RedisCacheStore(StringRedisTemplate redis) {
        this(redis, Clock.systemUTC());
    }

    public RedisCacheStore(StringRedisTemplate redis, Clock clock) {
        this.redis = Objects.requireNonNull(redis, "redis");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw unavailable("GET", e);
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        try {
            redis.opsForValue().set(key, value, ttl);
        } catch (DataAccessException e) {
            throw unavailable("SET", e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redis.delete(key);
        } catch (DataAccessException e) {
            throw unavailable("DEL", e);
        }
    }

    @Override
    public long deleteByPrefix(String prefix) {
        ScanOptions options = ScanOptions.scanOptions().match(escapeGlob(prefix) + "*").count(SCAN_BATCH).build();
        long removed = 0;
        List<String> batch = new ArrayList<>(SCAN_BATCH);
        try (Cursor<String> cursor = redis.scan(options)) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= SCAN_BATCH) {
                    removed += deleteAll(batch);
                    batch.clear();
                }
            }
            removed += deleteAll(batch);
            return removed;
        } catch (DataAccessException e) {
            throw unavailable("SCAN", e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public CounterSnapshot increment(String key, Duration window) {
        List<Long> reply;
        try {
            reply = redis.execute(INCREMENT, List.of(key), String.valueOf(window.toMillis()));
        } catch (DataAccessException e) {
            throw unavailable("INCR", e);
        }
        if (reply == null || reply.size() < 2) {
            throw new CacheStoreException("Unexpected reply to counter increment: " + reply, null);
        }
        return new CounterSnapshot(reply.get(0), clock.instant().plusMillis(reply.get(1)));
    }

    @Override
    public boolean ping() {
        try {
            String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (DataAccessException e) {
            throw unavailable("PING", e);
        }
    }

    private long deleteAll(List<String> keys) {
        if (keys.isEmpty()) return 0;
        Long n = redis.delete(keys);
        return n == null ? 0 : n;
    }

    static String escapeGlob(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (char c : s.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }

    private static CacheStoreException unavailable(String op, DataAccessException e) {
        return new CacheStoreException("Redis " + op + " failed: " + e.getMessage(), e);
    }
}
