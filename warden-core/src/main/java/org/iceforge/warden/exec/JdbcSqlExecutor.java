package org.iceforge.warden.exec;

import org.iceforge.warden.error.QueryExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes statements over JDBC with a hard time limit and a row ceiling.
 *
 * <p>The caller thread takes a connection from the pool (waiting at most the pool timeout) and hands it to a worker
 * that owns it until the statement finishes. On timeout the statement is cancelled and the caller waits up to the
 * cancel grace period for the worker to stop; the worker closes the connection, so it never goes back to the pool
 * while a cancel is still in flight.
 */
public class JdbcSqlExecutor implements SqlExecutor, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JdbcSqlExecutor.class);

    private final DataSource dataSource;
    private final ExecutorService workers;
    private final boolean ownsWorkers;
    private final Duration cancelGrace;

    public JdbcSqlExecutor(DataSource dataSource, Duration cancelGrace) {
        this(dataSource, cancelGrace, Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "warden-sql-exec");
            t.setDaemon(true);
            return t;
        }), true);
    }

    public JdbcSqlExecutor(DataSource dataSource, Duration cancelGrace, ExecutorService workers) {
        this(dataSource, cancelGrace, workers, false);
    }

    private JdbcSqlExecutor(DataSource dataSource, Duration cancelGrace, ExecutorService workers, boolean ownsWorkers) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.cancelGrace = cancelGrace == null ? Duration.ofSeconds(5) : cancelGrace;
        this.ownsWorkers = ownsWorkers;
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request) {
        Objects.requireNonNull(request, "request");

        Connection conn;
        try {
            conn = dataSource.getConnection();
        } catch (SQLException e) {
            log.warn("Could not obtain a database connection: {}", e.getMessage());
            throw SqlErrorClassifier.classify(e);
        }

        ActiveStatement active = new ActiveStatement();
        Future<ExecutionResult> future;
        try {
            future = workers.submit(() -> {
                try (Connection c = conn) {
                    return run(c, request, active);
                }
            });
        } catch (RejectedExecutionException e) {
            closeQuietly(conn);
            throw QueryExecutionException.serverError("Executor is shutting down", e);
        }

        try {
            return future.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("Statement exceeded {} ms; cancelling", request.timeout().toMillis());
            active.cancel();
            awaitCancellation(future);
            throw QueryExecutionException.timeout("Query exceeded the time limit of " + describe(request.timeout()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SQLException sql) throw SqlErrorClassifier.classify(sql);
            if (cause instanceof QueryExecutionException qe) throw qe;
            throw QueryExecutionException.serverError("Query execution failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            active.cancel();
            throw QueryExecutionException.serverError("Interrupted while waiting for the query", e);
        }
    }

    private static ExecutionResult run(Connection conn, ExecutionRequest request, ActiveStatement active) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(request.sql())) {
            if (!active.attach(ps)) {
                throw new SQLException("Statement cancelled before start", "57014");
            }
            try {
                int fetchLimit = request.rowLimit() + 1;
                ps.setMaxRows(fetchLimit);
                ps.setFetchSize(Math.min(fetchLimit, 1000));
                ps.setQueryTimeout((int) Math.max(1, (request.timeout().toMillis() + 999) / 1000));
                bind(ps, request.parameters());

                long start = System.nanoTime();
                try (ResultSet rs = ps.executeQuery()) {
                    List<String> columns = columnLabels(rs.getMetaData());
                    List<Map<String, Object>> rows = new ArrayList<>();
                    boolean truncated = false;
                    while (rs.next()) {
                        if (rows.size() == request.rowLimit()) {
                            truncated = true;
                            break;
                        }
                        Map<String, Object> row = new LinkedHashMap<>();
                        for (int i = 0; i < columns.size(); i++) {
                            row.put(columns.get(i), JdbcValues.normalize(rs.getObject(i + 1)));
                        }
                        rows.add(row);
                    }
                    long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                    return new ExecutionResult(columns, rows, rows.size(), elapsedMs, truncated, false);
                }
            } finally {
                active.detach();
            }
        }
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    /** Column labels made unique: a repeated label gets a {@code _2}, {@code _3}... suffix. */
    static List<String> columnLabels(ResultSetMetaData md) throws SQLException {
        int n = md.getColumnCount();
        List<String> out = new ArrayList<>(n);
        Set<String> seen = new HashSet<>();
        for (int i = 1; i <= n; i++) {
            String label = md.getColumnLabel(i);
            if (label == null || label.isEmpty()) label = "column" + i;
            String unique = label;
            for (int k = 2; !seen.add(unique); k++) unique = label + "_" + k;
            out.add(unique);
        }
        return out;
    }

    private void awaitCancellation(Future<ExecutionResult> future) {
        try {
            future.get(cancelGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Cancelled statement still running after {} ms; its connection is released when it stops",
                    cancelGrace.toMillis());
        } catch (ExecutionException e) {
            log.debug("Cancelled statement ended with {}", e.getCause().toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            log.debug("Failed to close connection: {}", e.getMessage());
        }
    }

    private static String describe(Duration d) {
        return d.toMillis() % 1000 == 0 ? d.getSeconds() + "s" : d.toMillis() + "ms";
    }

    @Override
    public void close() {
        if (ownsWorkers) workers.shutdownNow();
    }

    /** Statement currently owned by a worker; cancellation and attach/detach are mutually exclusive. */
    private static final class ActiveStatement {
        private PreparedStatement statement;
        private boolean cancelled;

        synchronized boolean attach(PreparedStatement ps) {
            if (cancelled) return false;
            statement = ps;
            return true;
        }

        synchronized void detach() {
            statement = null;
        }

        synchronized void cancel() {
            cancelled = true;
            if (statement == null) return;
            try {
                statement.cancel();
            } catch (SQLException e) {
                log.warn("Statement cancel failed: {}", e.getMessage());
            }
        }
    }
}
