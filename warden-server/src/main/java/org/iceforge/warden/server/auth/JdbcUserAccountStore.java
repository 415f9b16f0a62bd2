package org.iceforge.warden.server.auth;

import org.iceforge.warden.permission.AuthorizationStoreException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads {@code warden_users(user_id, role, is_active, password_hash)}, the same table the authorization store
 * resolves roles from.
 */
public class JdbcUserAccountStore implements UserAccountStore {

    private static final String FIND_SQL =
            "SELECT user_id, role, is_active, password_hash FROM warden_users WHERE user_id = ?";

    private final DataSource dataSource;

    public JdbcUserAccountStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public Optional<UserAccount> find(String userId) {
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(FIND_SQL)) {
            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new UserAccount(rs.getString("user_id"), rs.getString("role"),
                        rs.getBoolean("is_active"), rs.getString("password_hash")));
            }
        } catch (SQLException e) {
            throw new AuthorizationStoreException("User store unavailable", e);
        }
    }
}
