package org.iceforge.warden.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.iceforge.warden.error.ErrorRecord;
import org.iceforge.warden.exec.ExecutionResult;
import org.iceforge.warden.sql.ComplexityScore;

import java.util.List;
import java.util.Map;

/**
 * Response envelope. A failed response never carries rows.
 *
 * @param sql the SQL that ran (rewritten when a row filter applied); on failure, the SQL as far as it got
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse(
        QueryStatus status,
        List<Map<String, Object>> rows,
        List<String> columns,
        int rowCount,
        long executionTimeMs,
        boolean cached,
        boolean truncated,
        String sql,
        ComplexityScore complexity,
        List<String> warnings,
        ErrorRecord error) {

    public QueryResponse {
        rows = rows == null ? List.of() : rows;
        columns = columns == null ? List.of() : columns;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static QueryResponse success(ExecutionResult result, String sql, ComplexityScore complexity,
                                        List<String> warnings) {
        return new QueryResponse(QueryStatus.SUCCESS, result.rows(), result.columns(), result.rowCount(),
                result.executionTimeMs(), result.cached(), result.truncated(), sql, complexity, warnings, null);
    }

    public static QueryResponse failure(ErrorRecord error, String sql, long elapsedMs) {
        return new QueryResponse(QueryStatus.of(error.kind()), List.of(), List.of(), 0, elapsedMs, false, false, sql,
                null, List.of(), error);
    }

    public boolean succeeded() {
        return status == QueryStatus.SUCCESS;
    }
}
