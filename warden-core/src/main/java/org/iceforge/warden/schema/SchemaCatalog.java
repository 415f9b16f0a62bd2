package org.iceforge.warden.schema;

import org.iceforge.warden.cache.CacheKeys;
import org.iceforge.warden.cache.CacheManager;
import org.iceforge.warden.cache.CacheTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Cache-through access to table definitions on the {@link CacheTier#SCHEMA} tier. A failing metadata source yields
 * "unknown", which makes column checks stricter rather than looser.
 */
public class SchemaCatalog {
    private static final Logger log = LoggerFactory.getLogger(SchemaCatalog.class);

    private final SchemaMetadataSource source;
    private final CacheManager cache;

    public SchemaCatalog(SchemaMetadataSource source, CacheManager cache) {
        this.source = Objects.requireNonNull(source, "source");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public Optional<TableSchema> describe(String schema, String table) {
        String key = CacheKeys.schema(schema, table);
        Optional<TableSchema> cached = cache.get(CacheTier.SCHEMA, key, TableSchema.class);
        if (cached.isPresent()) return cached;

        Optional<TableSchema> loaded;
        try {
            loaded = source.describe(schema, table);
        } catch (RuntimeException e) {
            log.warn("Schema lookup failed for {}.{} ({}); treating columns as unknown", schema, table, e.getMessage());
            return Optional.empty();
        }
        loaded.ifPresent(s -> cache.put(CacheTier.SCHEMA, key, s));
        return loaded;
    }

    public void invalidate(String schema, String table) {
        cache.invalidate(CacheTier.SCHEMA, CacheKeys.schema(schema, table));
    }

    /** A catalog that knows no tables. */
    public static SchemaCatalog none(CacheManager cache) {
        return new SchemaCatalog((schema, table) -> Optional.empty(), cache);
    }
}
