package org.iceforge.warden.error;

/** Unsafe or malformed SQL. The message is shown to the user as-is. */
public class SqlValidationException extends QueryPipelineException {

    public SqlValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }

    public SqlValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_ERROR, message, cause);
    }
}
