package org.iceforge.warden.server.audit;

import org.h2.jdbcx.JdbcDataSource;
import org.iceforge.warden.audit.AuditRecord;
import org.iceforge.warden.error.ErrorKind;
import org.iceforge.warden.pipeline.PipelineState;
import org.iceforge.warden.pipeline.QueryStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class QueryHistoryRepositoryTest {

    private JdbcDataSource ds;
    private JdbcQueryHistoryAuditSink sink;
    private QueryHistoryRepository repo;

    @BeforeEach
    void setUp() {
        ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:history-read-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        sink = new JdbcQueryHistoryAuditSink(ds, 100);
        sink.createTableIfMissing();
        repo = new QueryHistoryRepository(ds);
    }

    private void write(String user, String sql, String at, ErrorKind kind) {
        sink.write(new AuditRecord(user, "q", sql, kind == null ? QueryStatus.SUCCESS : QueryStatus.PERMISSION_DENIED,
                kind == null ? PipelineState.COMPLETED : PipelineState.REJECTED, kind,
                kind == null ? null : "Access denied", kind == null ? 2 : 0, 9, false, Instant.parse(at)));
    }

    @Test
    void returnsOnlyTheUsersRowsNewestFirst() {
        write("ana", "SELECT 1", "2024-05-01T10:00:00Z", null);
        write("bob", "SELECT 2", "2024-05-01T11:00:00Z", null);
        write("ana", "SELECT * FROM payroll", "2024-05-01T12:00:00Z", ErrorKind.PERMISSION_DENIED);

        List<QueryHistoryEntry> rows = repo.recent("ana", 10);

        assertThat(rows).extracting(QueryHistoryEntry::sql).containsExactly("SELECT * FROM payroll", "SELECT 1");
        QueryHistoryEntry denied = rows.get(0);
        assertEquals("permission_denied", denied.status());
        assertEquals("Access denied", denied.errorMessage());
        assertEquals(Instant.parse("2024-05-01T12:00:00Z"), denied.createdAt());
        assertEquals(2, rows.get(1).rowCount());
        assertNull(rows.get(1).errorMessage());
    }

    @Test
    void limitCapsTheRowCount() {
        for (int i = 0; i < 5; i++) {
            write("ana", "SELECT " + i, "2024-05-01T10:0" + i + ":00Z", null);
        }

        assertThat(repo.recent("ana", 2)).extracting(QueryHistoryEntry::sql).containsExactly("SELECT 4", "SELECT 3");
        assertEquals(1, repo.recent("ana", 0).size());
        assertTrue(repo.recent("nobody", 10).isEmpty());
    }
}
