package org.iceforge.warden.permission;

/** A stored row filter does not fit the supported predicate grammar. */
public class InvalidRowFilterException extends IllegalArgumentException {

    public InvalidRowFilterException(String message) {
        super(message);
    }
}
