package org.iceforge.warden.server.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.iceforge.warden.server.audit.QueryHistoryEntry;

import java.util.List;

public final class QueryApiModels {
    private QueryApiModels() {}

    /**
     * Body of {@code POST /api/v1/queries}, as produced by the NL-to-SQL generator.
     *
     * @param confidence carried into the pipeline; low values are not rejected here
     * @param rowLimit   optional; capped by warden.execution.max-rows
     */
    public record SubmitQueryRequest(
            String sql,
            Double confidence,
            String question,
            List<Object> parameters,
            Integer rowLimit
    ) {}

    public record RateLimitStatus(
            String userId,
            boolean enabled,
            int limit,
            int remaining,
            long windowSeconds
    ) {}

    public record TierStats(
            long hits,
            long misses,
            long errors,
            double hitRatio
    ) {}

    /** {@code removed} is null where the store does not report a count. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record InvalidationResult(
            String tier,
            String target,
            Long removed
    ) {}

    public record LoginRequest(String username, String password) {
        @Override
        public String toString() {
            return "LoginRequest[username=" + username + "]";
        }
    }

    /** {@code tokenType} is always "bearer"; send the token back as {@code Authorization: Bearer <accessToken>}. */
    public record LoginResponse(
            String accessToken,
            String tokenType,
            long expiresIn,
            UserView user
    ) {}

    public record UserView(String userId, String role) {}

    public record HistoryPage(String userId, int limit, List<QueryHistoryEntry> entries) {}

    /**
     * Tables the caller may read. Admins get {@code allTables=true} and no list.
     */
    public record AccessibleTablesView(String userId, boolean allTables, List<TableAccessView> tables) {}

    /**
     * @param columns     allowed columns, or null when every column is readable
     * @param rowFiltered whether a row filter narrows the visible rows
     */
    public record TableAccessView(String schema, String table, List<String> columns, boolean rowFiltered) {}
}
