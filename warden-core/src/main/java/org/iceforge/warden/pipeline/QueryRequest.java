package org.iceforge.warden.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable input of one pipeline run.
 *
 * @param question   natural-language question the SQL was generated from; audit only
 * @param confidence generator confidence; carried through, never used to reject
 */
public record QueryRequest(
        String rawSql,
        String userId,
        List<Object> bindParameters,
        Integer requestedRowLimit,
        String question,
        Double confidence) {

    public QueryRequest {
        Objects.requireNonNull(userId, "userId");
        rawSql = rawSql == null ? "" : rawSql;
        bindParameters = bindParameters == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(bindParameters));
    }

    public static QueryRequest of(String sql, String userId) {
        return new QueryRequest(sql, userId, List.of(), null, null, null);
    }
}
