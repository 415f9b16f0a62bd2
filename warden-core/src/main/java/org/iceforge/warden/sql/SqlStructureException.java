package org.iceforge.warden.sql;

/** The statement uses a construct the structural scan does not recognize. */
public class SqlStructureException extends RuntimeException {

    public SqlStructureException(String message) {
        super(message);
    }
}
