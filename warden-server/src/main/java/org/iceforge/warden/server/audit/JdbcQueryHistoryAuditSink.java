package org.iceforge.warden.server.audit;

import org.iceforge.warden.audit.AuditRecord;
import org.iceforge.warden.audit.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes one {@code query_history} row per request on a background thread. When the queue is full, records are dropped
 * and counted rather than slowing the request path down.
 */
public class JdbcQueryHistoryAuditSink implements AuditSink, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JdbcQueryHistoryAuditSink.class);

    static final int MAX_TEXT = 4000;

    static final String CREATE_SQL = "CREATE TABLE IF NOT EXISTS query_history ("
            + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
            + "user_id VARCHAR(128) NOT NULL, "
            + "question VARCHAR(4000), "
            + "sql_text VARCHAR(4000), "
            + "status VARCHAR(32) NOT NULL, "
            + "row_count INT, "
            + "execution_time_ms BIGINT, "
            + "cached BOOLEAN, "
            + "error_message VARCHAR(4000), "
            + "created_at TIMESTAMP NOT NULL)";

    static final String INSERT_SQL = "INSERT INTO query_history "
            + "(user_id, question, sql_text, status, row_count, execution_time_ms, cached, error_message, created_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final DataSource dataSource;
    private final ExecutorService writer;
    private final AtomicLong dropped = new AtomicLong();

    public JdbcQueryHistoryAuditSink(DataSource dataSource, int queueCapacity) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.writer = new ThreadPoolExecutor(1, 1, 0, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                r -> {
                    Thread t = new Thread(r, "warden-history");
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    public void createTableIfMissing() {
        try (Connection c = dataSource.getConnection(); Statement st = c.createStatement()) {
            st.execute(CREATE_SQL);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot create query_history table", e);
        }
    }

    @Override
    public void record(AuditRecord record) {
        try {
            writer.execute(() -> write(record));
        } catch (RejectedExecutionException e) {
            long n = dropped.incrementAndGet();
            if (n == 1 || n % 100 == 0) {
                log.warn("History queue full; {} record(s) dropped so far", n);
            }
        }
    }

    public long dropped() {
        return dropped.get();
    }

    void write(AuditRecord r) {
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(INSERT_SQL)) {
            ps.setString(1, r.userId());
            setText(ps, 2, r.question());
            setText(ps, 3, r.sql());
            ps.setString(4, r.status().wireName());
            ps.setInt(5, r.rowCount());
            ps.setLong(6, r.executionTimeMs());
            ps.setBoolean(7, r.cached());
            setText(ps, 8, r.errorMessage());
            ps.setTimestamp(9, Timestamp.from(r.createdAt()));
            ps.executeUpdate();
        } catch (SQLException e) {
            log.warn("Failed to write query history for user={}: {}", r.userId(), e.getMessage());
        }
    }

    private static void setText(PreparedStatement ps, int idx, String v) throws SQLException {
        if (v == null) {
            ps.setNull(idx, Types.VARCHAR);
        } else {
            ps.setString(idx, v.length() > MAX_TEXT ? v.substring(0, MAX_TEXT) : v);
        }
    }

    /** Waits briefly for queued records to be written. */
    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("History writer did not drain in time; {} record(s) lost", writer.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }
}
