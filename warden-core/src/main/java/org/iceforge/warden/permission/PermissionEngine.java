package org.iceforge.warden.permission;

import org.iceforge.warden.cache.CacheKeys;
import org.iceforge.warden.cache.CacheManager;
import org.iceforge.warden.cache.CacheTier;
import org.iceforge.warden.error.PermissionDeniedException;
import org.iceforge.warden.error.QueryExecutionException;
import org.iceforge.warden.error.SqlValidationException;
import org.iceforge.warden.schema.SchemaCatalog;
import org.iceforge.warden.schema.TableSchema;
import org.iceforge.warden.sql.ColumnReference;
import org.iceforge.warden.sql.SqlScanException;
import org.iceforge.warden.sql.SqlStructureException;
import org.iceforge.warden.sql.SqlToken;
import org.iceforge.warden.sql.SqlTokenizer;
import org.iceforge.warden.sql.StatementAnalyzer;
import org.iceforge.warden.sql.StatementStructure;
import org.iceforge.warden.sql.TableReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Table, column and row level authorization for validated statements.
 *
 * <p>All or nothing: one table without SELECT permission, or one referenced column outside an allow-list, denies the
 * whole statement. Columns are never silently dropped. Row filters are injected by {@link RowFilterRewriter}.
 *
 * <p>Permission records are read through the {@link CacheTier#PERMISSION} tier; table definitions (needed to decide
 * which table owns an unqualified column and whether {@code *} is safe) through {@link SchemaCatalog}.
 */
public class PermissionEngine {
    private static final Logger log = LoggerFactory.getLogger(PermissionEngine.class);

    public static final String DEFAULT_SCHEMA = "public";

    private final AuthorizationStore store;
    private final CacheManager cache;
    private final SchemaCatalog schemas;
    private final String defaultSchema;

    public PermissionEngine(AuthorizationStore store, CacheManager cache, SchemaCatalog schemas) {
        this(store, cache, schemas, DEFAULT_SCHEMA);
    }

    public PermissionEngine(AuthorizationStore store, CacheManager cache, SchemaCatalog schemas, String defaultSchema) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.schemas = Objects.requireNonNull(schemas, "schemas");
        this.defaultSchema = (defaultSchema == null || defaultSchema.isBlank())
                ? DEFAULT_SCHEMA : defaultSchema.toLowerCase(Locale.ROOT);
    }

    public AuthorizedQuery authorize(String normalizedSql, String userId) {
        Objects.requireNonNull(normalizedSql, "normalizedSql");
        Objects.requireNonNull(userId, "userId");

        StatementStructure structure = analyze(normalizedSql);

        Map<String, PermissionRecord> grants = new LinkedHashMap<>();
        for (TableReference t : structure.tables()) {
            String qualified = t.qualifiedName(defaultSchema);
            if (grants.containsKey(qualified)) continue;
            PermissionRecord record = lookup(userId, schemaOf(t), t.table()).orElse(null);
            if (record == null || !record.canSelect()) {
                log.debug("Denied user={} table={}: no SELECT grant", userId, qualified);
                throw new PermissionDeniedException("Access denied: no SELECT permission on table '" + t.table() + "'");
            }
            grants.put(qualified, record);
        }

        for (ColumnReference c : structure.columns()) {
            checkColumn(c, grants);
        }

        Map<TableReference, RowPredicate> filters = new LinkedHashMap<>();
        for (TableReference t : structure.tables()) {
            RowPredicate p = grants.get(t.qualifiedName(defaultSchema)).rowFilter();
            if (p != null) filters.put(t, p);
        }
        String rewritten = filters.isEmpty() ? normalizedSql : RowFilterRewriter.rewrite(structure, filters);
        if (!filters.isEmpty() && log.isDebugEnabled()) {
            log.debug("Applied {} row filter(s) for user={}: {}", filters.size(), userId, rewritten);
        }
        return new AuthorizedQuery(rewritten, new ArrayList<>(grants.keySet()), !filters.isEmpty());
    }

    /** Tables the user may read, straight from the store. */
    public AccessibleTables accessibleTables(String userId) {
        Objects.requireNonNull(userId, "userId");
        try {
            return store.accessibleTables(userId);
        } catch (AuthorizationStoreException e) {
            throw QueryExecutionException.serverError("Authorization store unavailable", e);
        }
    }

    /** Drops every cached permission of one user, e.g. after a grant or revoke. */
    public long invalidateUser(String userId) {
        return cache.invalidatePrefix(CacheTier.PERMISSION, CacheKeys.permissionPrefix(userId));
    }

    private StatementStructure analyze(String sql) {
        try {
            List<SqlToken> tokens = SqlTokenizer.tokenize(sql);
            return StatementAnalyzer.analyze(tokens);
        } catch (SqlScanException | SqlStructureException e) {
            throw new SqlValidationException("Unsupported SQL: " + e.getMessage(), e);
        }
    }

    private Optional<PermissionRecord> lookup(String userId, String schema, String table) {
        String key = CacheKeys.permission(userId, schema, table);
        Optional<CachedGrant> cached = cache.get(CacheTier.PERMISSION, key, CachedGrant.class);
        if (cached.isPresent()) {
            try {
                return cached.get().toRecord(userId, schema, table);
            } catch (InvalidRowFilterException e) {
                log.warn("Cached row filter for user={} table={}.{} is unreadable; reloading", userId, schema, table);
                cache.invalidate(CacheTier.PERMISSION, key);
            }
        }
        Optional<PermissionRecord> loaded;
        try {
            loaded = store.find(userId, schema, table);
        } catch (AuthorizationStoreException e) {
            throw QueryExecutionException.serverError("Authorization store unavailable", e);
        }
        cache.put(CacheTier.PERMISSION, key, CachedGrant.of(loaded));
        return loaded;
    }

    private void checkColumn(ColumnReference c, Map<String, PermissionRecord> grants) {
        List<TableReference> candidates = c.candidates();
        if (candidates.isEmpty()) return;

        if (c.wildcard()) {
            for (TableReference t : candidates) {
                PermissionRecord r = grants.get(t.qualifiedName(defaultSchema));
                if (!r.columnFilter().restricted()) continue;
                Optional<TableSchema> schema = schemas.describe(schemaOf(t), t.table());
                if (schema.isEmpty() || !r.columnFilter().permitsAll(schema.get().columns())) {
                    throw new PermissionDeniedException("Access denied: SELECT * is not permitted on table '"
                            + t.table() + "'; list the columns explicitly");
                }
            }
            return;
        }

        if (c.qualified()) {
            for (TableReference t : candidates) {
                PermissionRecord r = grants.get(t.qualifiedName(defaultSchema));
                if (!r.columnFilter().permits(c.column())) throw columnDenied(t, c);
            }
            return;
        }

        boolean anyRestricted = false;
        for (TableReference t : candidates) {
            if (grants.get(t.qualifiedName(defaultSchema)).columnFilter().restricted()) anyRestricted = true;
        }
        if (!anyRestricted) return;

        // unqualified: the owner is whichever table in scope has the column
        boolean knownOwner = false;
        boolean possibleOwner = false;
        TableReference unresolved = null;
        TableReference restricted = null;
        for (TableReference t : candidates) {
            PermissionRecord r = grants.get(t.qualifiedName(defaultSchema));
            if (restricted == null && r.columnFilter().restricted()) restricted = t;
            Optional<TableSchema> schema = schemas.describe(schemaOf(t), t.table());
            if (schema.isPresent()) {
                if (schema.get().hasColumn(c.column())) {
                    knownOwner = true;
                    if (!r.columnFilter().permits(c.column())) throw columnDenied(t, c);
                }
            } else if (r.columnFilter().permits(c.column())) {
                possibleOwner = true;
            } else if (unresolved == null) {
                unresolved = t;
            }
        }
        if (knownOwner) return;
        if (unresolved != null) throw columnDenied(unresolved, c);
        if (possibleOwner) return;
        // no table in scope has such a column: a whole-row reference like "SELECT c FROM customers c"
        throw new PermissionDeniedException("Access denied: '" + c.column() + "' is not a permitted column of table '"
                + restricted.table() + "'");
    }

    private static PermissionDeniedException columnDenied(TableReference t, ColumnReference c) {
        return new PermissionDeniedException("Access denied: column '" + c.column() + "' of table '" + t.table()
                + "' is not permitted");
    }

    private String schemaOf(TableReference t) {
        return t.schema() != null ? t.schema() : defaultSchema;
    }
}
