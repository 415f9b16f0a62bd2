package org.iceforge.warden.schema;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Column names of one table as reported by the database, lower-cased, in ordinal order.
 */
public record TableSchema(String schemaName, String tableName, List<String> columns) {

    public TableSchema {
        Objects.requireNonNull(schemaName, "schemaName");
        Objects.requireNonNull(tableName, "tableName");
        columns = columns == null ? List.of() : columns.stream().map(c -> c.toLowerCase(Locale.ROOT)).toList();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column.toLowerCase(Locale.ROOT));
    }
}
