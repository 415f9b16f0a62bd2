package org.iceforge.warden.exec;

import org.iceforge.warden.error.ErrorKind;
import org.iceforge.warden.error.QueryExecutionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.SQLTransientException;

/**
 * Maps driver exceptions onto the error taxonomy:
 * <ul>
 *   <li>timeouts and cancellations ({@link SQLTimeoutException}, SQLState 57014, HYT00, HYT01): {@code timeout}</li>
 *   <li>connection failures and pool exhaustion (SQLState class 08, transient exceptions, 53xxx): {@code server_error}</li>
 *   <li>everything else: {@code sql_error} carrying the driver message</li>
 * </ul>
 */
public final class SqlErrorClassifier {
    private SqlErrorClassifier() {
    }

    public static QueryExecutionException classify(SQLException e) {
        String state = e.getSQLState() == null ? "" : e.getSQLState();
        if (e instanceof SQLTimeoutException || state.equals("57014") || state.equals("HYT00") || state.equals("HYT01")) {
            return new QueryExecutionException(ErrorKind.TIMEOUT, "Query was cancelled after exceeding its time limit", e);
        }
        if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException
                || state.startsWith("08")) {
            return new QueryExecutionException(ErrorKind.SERVER_ERROR, "Database connection unavailable", e);
        }
        if (e instanceof SQLTransientException || state.startsWith("53")) {
            return new QueryExecutionException(ErrorKind.SERVER_ERROR, "Database temporarily unavailable", e);
        }
        String message = e.getMessage() == null ? "SQL error" : e.getMessage();
        return new QueryExecutionException(ErrorKind.SQL_ERROR, message, e);
    }
}
