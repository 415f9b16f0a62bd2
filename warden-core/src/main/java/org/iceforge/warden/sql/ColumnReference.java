package org.iceforge.warden.sql;

import java.util.List;
import java.util.Objects;

/**
 * A column mentioned anywhere in the statement.
 *
 * <p>A qualified reference has exactly one candidate table. An unqualified one lists every base table that is in
 * scope where it appears, innermost first; deciding which of them owns the column needs catalog metadata. An empty
 * candidate list means the qualifier names a derived table or CTE whose own body is checked separately.
 *
 * @param column lower-cased column name, or {@code *}
 */
public record ColumnReference(String column, boolean qualified, List<TableReference> candidates) {

    public ColumnReference {
        Objects.requireNonNull(column, "column");
        candidates = List.copyOf(candidates);
    }

    public boolean wildcard() {
        return "*".equals(column);
    }
}
