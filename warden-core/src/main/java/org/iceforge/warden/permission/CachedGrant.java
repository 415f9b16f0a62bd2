package org.iceforge.warden.permission;

import java.util.List;
import java.util.Optional;

/**
 * Cache form of a permission lookup. Negative lookups are cached too ({@code present = false}); the row filter is
 * kept in its rendered text form and parsed again on read.
 */
public record CachedGrant(boolean present, boolean canSelect, boolean canInsert, boolean canUpdate, boolean canDelete,
                          List<String> allowedColumns, String rowFilter) {

    static CachedGrant of(Optional<PermissionRecord> record) {
        if (record.isEmpty()) return new CachedGrant(false, false, false, false, false, null, null);
        PermissionRecord r = record.get();
        List<String> columns = r.columnFilter().restricted() ? List.copyOf(r.columnFilter().allowed()) : null;
        String filter = r.rowFilter() == null ? null : r.rowFilter().render(null);
        return new CachedGrant(true, r.canSelect(), r.canInsert(), r.canUpdate(), r.canDelete(), columns, filter);
    }

    Optional<PermissionRecord> toRecord(String userId, String schema, String table) {
        if (!present) return Optional.empty();
        ColumnFilter columns = allowedColumns == null ? ColumnFilter.UNRESTRICTED : ColumnFilter.allowOnly(allowedColumns);
        RowPredicate predicate = rowFilter == null ? null : RowPredicateParser.parse(rowFilter);
        return Optional.of(new PermissionRecord(userId, schema, table, canSelect, canInsert, canUpdate, canDelete,
                columns, predicate));
    }
}
