package org.iceforge.warden.permission;

public class AuthorizationStoreException extends RuntimeException {

    public AuthorizationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
