package org.iceforge.warden.server.audit;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/** One {@code query_history} row as returned by GET /api/history. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryHistoryEntry(
        long id,
        String userId,
        String question,
        String sql,
        String status,
        Integer rowCount,
        Long executionTimeMs,
        Boolean cached,
        String errorMessage,
        Instant createdAt
) {}
