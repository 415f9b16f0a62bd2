package org.iceforge.warden.error;

/** Raised by the executor: {@code timeout}, {@code sql_error} or {@code server_error}. */
public class QueryExecutionException extends QueryPipelineException {

    public QueryExecutionException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public QueryExecutionException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public static QueryExecutionException timeout(String message) {
        return new QueryExecutionException(ErrorKind.TIMEOUT, message);
    }

    public static QueryExecutionException serverError(String message, Throwable cause) {
        return new QueryExecutionException(ErrorKind.SERVER_ERROR, message, cause);
    }
}
