package org.iceforge.warden.server.auth;

import org.iceforge.warden.permission.JdbcAuthorizationStore;

import java.util.Objects;

/** Caller identity taken from a verified bearer token. */
public record AuthenticatedUser(String userId, String role) {

    public AuthenticatedUser {
        Objects.requireNonNull(userId, "userId");
    }

    public boolean admin() {
        return JdbcAuthorizationStore.ADMIN_ROLE.equalsIgnoreCase(role);
    }
}
