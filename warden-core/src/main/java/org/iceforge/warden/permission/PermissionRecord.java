package org.iceforge.warden.permission;

import java.util.Locale;
import java.util.Objects;

/**
 * What one user may do with one table. Owned by the authorization store; the pipeline only reads it.
 *
 * @param rowFilter predicate every visible row must satisfy, or null
 */
public record PermissionRecord(
        String userId,
        String schemaName,
        String tableName,
        boolean canSelect,
        boolean canInsert,
        boolean canUpdate,
        boolean canDelete,
        ColumnFilter columnFilter,
        RowPredicate rowFilter) {

    public PermissionRecord {
        Objects.requireNonNull(userId, "userId");
        schemaName = Objects.requireNonNull(schemaName, "schemaName").toLowerCase(Locale.ROOT);
        tableName = Objects.requireNonNull(tableName, "tableName").toLowerCase(Locale.ROOT);
        columnFilter = columnFilter == null ? ColumnFilter.UNRESTRICTED : columnFilter;
    }

    public static PermissionRecord readOnly(String userId, String schema, String table) {
        return new PermissionRecord(userId, schema, table, true, false, false, false, ColumnFilter.UNRESTRICTED, null);
    }

    public static PermissionRecord fullAccess(String userId, String schema, String table) {
        return new PermissionRecord(userId, schema, table, true, true, true, true, ColumnFilter.UNRESTRICTED, null);
    }

    public static PermissionRecord noAccess(String userId, String schema, String table) {
        return new PermissionRecord(userId, schema, table, false, false, false, false, ColumnFilter.UNRESTRICTED, null);
    }

    public PermissionRecord withColumns(ColumnFilter filter) {
        return new PermissionRecord(userId, schemaName, tableName, canSelect, canInsert, canUpdate, canDelete,
                filter, rowFilter);
    }

    public PermissionRecord withRowFilter(RowPredicate filter) {
        return new PermissionRecord(userId, schemaName, tableName, canSelect, canInsert, canUpdate, canDelete,
                columnFilter, filter);
    }
}
