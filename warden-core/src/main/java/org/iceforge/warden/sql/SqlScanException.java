package org.iceforge.warden.sql;

/** The text could not be split into tokens (unterminated literal or comment, stray character). */
public class SqlScanException extends RuntimeException {

    private final int position;

    public SqlScanException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
