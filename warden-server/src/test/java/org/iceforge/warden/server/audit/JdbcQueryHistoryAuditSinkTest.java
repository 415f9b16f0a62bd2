package org.iceforge.warden.server.audit;

import org.h2.jdbcx.JdbcDataSource;
import org.iceforge.warden.audit.AuditRecord;
import org.iceforge.warden.error.ErrorKind;
import org.iceforge.warden.pipeline.PipelineState;
import org.iceforge.warden.pipeline.QueryStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcQueryHistoryAuditSinkTest {

    private JdbcDataSource ds;

    @BeforeEach
    void setUp() {
        ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:history-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    }

    private static AuditRecord record(String user, QueryStatus status, ErrorKind kind, String message, String sql) {
        return new AuditRecord(user, "how many orders?", sql, status,
                kind == null ? PipelineState.COMPLETED : PipelineState.REJECTED, kind, message,
                kind == null ? 4 : 0, 17, false, Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void writesOneRowPerRecordAfterDraining() throws SQLException {
        JdbcQueryHistoryAuditSink sink = new JdbcQueryHistoryAuditSink(ds, 100);
        sink.createTableIfMissing();

        sink.record(record("ana", QueryStatus.SUCCESS, null, null, "SELECT COUNT(*) FROM orders"));
        sink.record(record("ana", QueryStatus.PERMISSION_DENIED, ErrorKind.PERMISSION_DENIED,
                "Access denied", "SELECT * FROM payroll"));
        sink.close();

        try (Connection c = ds.getConnection(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT user_id, status, row_count, error_message, question "
                     + "FROM query_history ORDER BY id")) {
            assertTrue(rs.next());
            assertEquals("ana", rs.getString(1));
            assertEquals("success", rs.getString(2));
            assertEquals(4, rs.getInt(3));
            assertNull(rs.getString(4));
            assertEquals("how many orders?", rs.getString(5));
            assertTrue(rs.next());
            assertEquals("permission_denied", rs.getString(2));
            assertEquals("Access denied", rs.getString(4));
            assertFalse(rs.next());
        }
        assertEquals(0, sink.dropped());
    }

    @Test
    void longSqlIsTruncated() throws SQLException {
        JdbcQueryHistoryAuditSink sink = new JdbcQueryHistoryAuditSink(ds, 10);
        sink.createTableIfMissing();

        sink.write(record("ana", QueryStatus.SUCCESS, null, null, "SELECT " + "x, ".repeat(3000) + "1"));
        sink.close();

        try (Connection c = ds.getConnection(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT LENGTH(sql_text) FROM query_history")) {
            assertTrue(rs.next());
            assertEquals(JdbcQueryHistoryAuditSink.MAX_TEXT, rs.getInt(1));
        }
    }

    @Test
    void missingTableIsLoggedNotThrown() {
        JdbcQueryHistoryAuditSink sink = new JdbcQueryHistoryAuditSink(ds, 10);

        assertDoesNotThrow(() -> sink.write(record("ana", QueryStatus.SUCCESS, null, null, "SELECT 1")));
        sink.close();
    }

    @Test
    void createTableIsIdempotent() {
        JdbcQueryHistoryAuditSink sink = new JdbcQueryHistoryAuditSink(ds, 10);
        sink.createTableIfMissing();
        assertDoesNotThrow(sink::createTableIfMissing);
        sink.close();
    }
}
