package org.iceforge.warden.exec;

import org.iceforge.warden.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SqlErrorClassifierTest {

    @Test
    void classifiesByExceptionTypeAndSqlState() {
        assertEquals(ErrorKind.TIMEOUT, SqlErrorClassifier.classify(new SQLTimeoutException("slow")).kind());
        assertEquals(ErrorKind.TIMEOUT, SqlErrorClassifier.classify(new SQLException("cancel", "57014")).kind());
        assertEquals(ErrorKind.SERVER_ERROR,
                SqlErrorClassifier.classify(new SQLTransientConnectionException("pool timeout")).kind());
        assertEquals(ErrorKind.SERVER_ERROR, SqlErrorClassifier.classify(new SQLException("gone", "08006")).kind());
        assertEquals(ErrorKind.SERVER_ERROR, SqlErrorClassifier.classify(new SQLException("oom", "53200")).kind());
    }

    @Test
    void anythingElseIsSqlErrorWithDriverMessage() {
        var e = SqlErrorClassifier.classify(new SQLException("relation \"x\" does not exist", "42P01"));

        assertEquals(ErrorKind.SQL_ERROR, e.kind());
        assertEquals("relation \"x\" does not exist", e.getMessage());
    }
}
