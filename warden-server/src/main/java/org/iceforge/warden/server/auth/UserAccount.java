package org.iceforge.warden.server.auth;

/**
 * Login record of one user.
 *
 * @param passwordHash bcrypt hash, or null for accounts that cannot log in
 */
public record UserAccount(String userId, String role, boolean active, String passwordHash) {

    @Override
    public String toString() {
        return "UserAccount[userId=" + userId + ", role=" + role + ", active=" + active + "]";
    }
}
