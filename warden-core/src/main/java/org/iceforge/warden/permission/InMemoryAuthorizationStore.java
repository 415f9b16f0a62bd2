package org.iceforge.warden.permission;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Map-backed store for tests and embedded use. */
public final class InMemoryAuthorizationStore implements AuthorizationStore {

    private final ConcurrentHashMap<String, PermissionRecord> records = new ConcurrentHashMap<>();
    private final Set<String> admins = ConcurrentHashMap.newKeySet();

    public InMemoryAuthorizationStore grant(PermissionRecord record) {
        records.put(key(record.userId(), record.schemaName(), record.tableName()), record);
        return this;
    }

    /** Admins may read every table without restriction. */
    public InMemoryAuthorizationStore grantAdmin(String userId) {
        admins.add(userId);
        return this;
    }

    public void revoke(String userId, String schema, String table) {
        records.remove(key(userId, schema, table));
    }

    @Override
    public Optional<PermissionRecord> find(String userId, String schema, String table) {
        if (admins.contains(userId)) return Optional.of(PermissionRecord.fullAccess(userId, schema, table));
        return Optional.ofNullable(records.get(key(userId, schema, table)));
    }

    @Override
    public AccessibleTables accessibleTables(String userId) {
        if (admins.contains(userId)) return AccessibleTables.everything(userId);
        List<PermissionRecord> grants = records.values().stream()
                .filter(r -> r.userId().equals(userId) && r.canSelect())
                .sorted(Comparator.comparing(PermissionRecord::schemaName).thenComparing(PermissionRecord::tableName))
                .toList();
        return new AccessibleTables(userId, false, grants);
    }

    private static String key(String userId, String schema, String table) {
        return userId + "\u0000" + schema.toLowerCase(Locale.ROOT) + "\u0000" + table.toLowerCase(Locale.ROOT);
    }
}
