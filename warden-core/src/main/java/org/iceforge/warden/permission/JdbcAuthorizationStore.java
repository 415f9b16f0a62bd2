package org.iceforge.warden.permission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads grants from two tables:
 * <pre>
 *   warden_users(user_id, role, is_active)
 *   role_permissions(user_id, schema_name, table_name, can_select, can_insert, can_update, can_delete,
 *                    allowed_columns, row_filter)
 * </pre>
 * {@code allowed_columns} is a comma-separated list (null means every column). {@code row_filter} uses the
 * {@link RowPredicateParser} grammar. Users with role {@code ADMIN} read everything; unknown or inactive users get
 * nothing. A row filter that fails to parse disables the grant instead of dropping the filter.
 */
public class JdbcAuthorizationStore implements AuthorizationStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcAuthorizationStore.class);

    public static final String ADMIN_ROLE = "ADMIN";

    private static final String USER_SQL = "SELECT role, is_active FROM warden_users WHERE user_id = ?";
    private static final String GRANT_SQL = "SELECT can_select, can_insert, can_update, can_delete, allowed_columns, row_filter "
            + "FROM role_permissions WHERE user_id = ? AND LOWER(schema_name) = ? AND LOWER(table_name) = ?";
    private static final String LIST_SQL = "SELECT schema_name, table_name, can_select, can_insert, can_update, can_delete, "
            + "allowed_columns, row_filter FROM role_permissions WHERE user_id = ? AND can_select = TRUE "
            + "ORDER BY LOWER(schema_name), LOWER(table_name)";

    private final DataSource dataSource;

    public JdbcAuthorizationStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public Optional<PermissionRecord> find(String userId, String schema, String table) {
        String s = schema.toLowerCase(Locale.ROOT);
        String t = table.toLowerCase(Locale.ROOT);
        try (Connection conn = dataSource.getConnection()) {
            String role = activeRole(conn, userId);
            if (role == null) return Optional.empty();
            if (ADMIN_ROLE.equalsIgnoreCase(role)) {
                return Optional.of(PermissionRecord.fullAccess(userId, s, t));
            }
            try (PreparedStatement ps = conn.prepareStatement(GRANT_SQL)) {
                ps.setString(1, userId);
                ps.setString(2, s);
                ps.setString(3, t);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) return Optional.empty();
                    return Optional.of(toRecord(userId, s, t, rs));
                }
            }
        } catch (SQLException e) {
            throw new AuthorizationStoreException("Authorization store unavailable", e);
        }
    }

    @Override
    public AccessibleTables accessibleTables(String userId) {
        try (Connection conn = dataSource.getConnection()) {
            String role = activeRole(conn, userId);
            if (role == null) return AccessibleTables.none(userId);
            if (ADMIN_ROLE.equalsIgnoreCase(role)) return AccessibleTables.everything(userId);
            List<PermissionRecord> grants = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(LIST_SQL)) {
                ps.setString(1, userId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        PermissionRecord r = toRecord(userId, rs.getString("schema_name").toLowerCase(Locale.ROOT),
                                rs.getString("table_name").toLowerCase(Locale.ROOT), rs);
                        // a grant whose row filter does not parse is no grant
                        if (r.canSelect()) grants.add(r);
                    }
                }
            }
            return new AccessibleTables(userId, false, grants);
        } catch (SQLException e) {
            throw new AuthorizationStoreException("Authorization store unavailable", e);
        }
    }

    /** Role of an active user, or null when the user is unknown or inactive. */
    private static String activeRole(Connection conn, String userId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(USER_SQL)) {
            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return null;
                if (!rs.getBoolean(2)) {
                    log.debug("User {} is inactive", userId);
                    return null;
                }
                return rs.getString(1);
            }
        }
    }

    private static PermissionRecord toRecord(String userId, String schema, String table, ResultSet rs) throws SQLException {
        boolean canSelect = rs.getBoolean("can_select");
        boolean canInsert = rs.getBoolean("can_insert");
        boolean canUpdate = rs.getBoolean("can_update");
        boolean canDelete = rs.getBoolean("can_delete");
        String columns = rs.getString("allowed_columns");
        String rowFilter = rs.getString("row_filter");

        ColumnFilter columnFilter = ColumnFilter.UNRESTRICTED;
        if (columns != null && !columns.isBlank()) {
            Set<String> allowed = Arrays.stream(columns.split(","))
                    .map(String::trim)
                    .filter(c -> !c.isEmpty())
                    .collect(Collectors.toSet());
            columnFilter = new ColumnFilter(allowed);
        }

        RowPredicate predicate = null;
        if (rowFilter != null && !rowFilter.isBlank()) {
            try {
                predicate = RowPredicateParser.parse(rowFilter);
            } catch (InvalidRowFilterException e) {
                log.error("Row filter for user={} table={}.{} is invalid ({}); denying access", userId, schema, table,
                        e.getMessage());
                return PermissionRecord.noAccess(userId, schema, table);
            }
        }
        return new PermissionRecord(userId, schema, table, canSelect, canInsert, canUpdate, canDelete,
                columnFilter, predicate);
    }
}
