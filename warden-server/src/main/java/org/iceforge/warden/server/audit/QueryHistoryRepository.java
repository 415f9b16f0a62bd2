package org.iceforge.warden.server.audit;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Reads back what {@link JdbcQueryHistoryAuditSink} wrote, newest first. */
public class QueryHistoryRepository {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    static final String RECENT_SQL = "SELECT id, user_id, question, sql_text, status, row_count, execution_time_ms, "
            + "cached, error_message, created_at FROM query_history WHERE user_id = ? ORDER BY created_at DESC, id DESC";

    private final DataSource dataSource;

    public QueryHistoryRepository(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    /** @param limit clamped to 1..{@value #MAX_LIMIT} */
    public List<QueryHistoryEntry> recent(String userId, int limit) {
        int n = Math.max(1, Math.min(limit, MAX_LIMIT));
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(RECENT_SQL)) {
            ps.setMaxRows(n);
            ps.setString(1, userId);
            List<QueryHistoryEntry> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(toEntry(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot read query history: " + e.getMessage(), e);
        }
    }

    private static QueryHistoryEntry toEntry(ResultSet rs) throws SQLException {
        Timestamp created = rs.getTimestamp("created_at");
        return new QueryHistoryEntry(
                rs.getLong("id"),
                rs.getString("user_id"),
                rs.getString("question"),
                rs.getString("sql_text"),
                rs.getString("status"),
                rs.getObject("row_count") == null ? null : rs.getInt("row_count"),
                rs.getObject("execution_time_ms") == null ? null : rs.getLong("execution_time_ms"),
                rs.getObject("cached") == null ? null : rs.getBoolean("cached"),
                rs.getString("error_message"),
                created == null ? null : created.toInstant());
    }
}
