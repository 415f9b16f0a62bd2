package org.iceforge.warden.exec;

import java.util.List;
import java.util.Map;

/**
 * Rows are keyed by column label in column order. Values are already normalized by {@link JdbcValues}, so a result
 * read back from the cache is equal to the one that was stored.
 */
public record ExecutionResult(
        List<String> columns,
        List<Map<String, Object>> rows,
        int rowCount,
        long executionTimeMs,
        boolean truncated,
        boolean cached) {

    public ExecutionResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public ExecutionResult asCached(long lookupTimeMs) {
        return new ExecutionResult(columns, rows, rowCount, lookupTimeMs, truncated, true);
    }
}
