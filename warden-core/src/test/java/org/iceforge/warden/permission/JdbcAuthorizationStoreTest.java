package org.iceforge.warden.permission;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class JdbcAuthorizationStoreTest {

    private JdbcDataSource ds;
    private JdbcAuthorizationStore store;

    @BeforeEach
    void setUp() throws SQLException {
        ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:authz-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        try (Connection c = ds.getConnection(); Statement s = c.createStatement()) {
            s.execute("CREATE TABLE warden_users(user_id VARCHAR(64) PRIMARY KEY, role VARCHAR(32), is_active BOOLEAN)");
            s.execute("CREATE TABLE role_permissions(user_id VARCHAR(64), schema_name VARCHAR(64), table_name VARCHAR(64), "
                    + "can_select BOOLEAN, can_insert BOOLEAN, can_update BOOLEAN, can_delete BOOLEAN, "
                    + "allowed_columns VARCHAR(1000), row_filter VARCHAR(1000))");
            s.execute("INSERT INTO warden_users VALUES ('admin', 'ADMIN', TRUE), ('ana', 'ANALYST', TRUE), "
                    + "('gone', 'ANALYST', FALSE), ('broken', 'ANALYST', TRUE)");
            s.execute("INSERT INTO role_permissions VALUES "
                    + "('ana', 'public', 'Orders', TRUE, FALSE, FALSE, FALSE, 'id, amount ,region', 'region = ''US'''), "
                    + "('ana', 'public', 'customers', TRUE, FALSE, FALSE, FALSE, NULL, NULL), "
                    + "('gone', 'public', 'orders', TRUE, FALSE, FALSE, FALSE, NULL, NULL), "
                    + "('broken', 'public', 'orders', TRUE, FALSE, FALSE, FALSE, NULL, 'region = (SELECT 1)')");
        }
        store = new JdbcAuthorizationStore(ds);
    }

    @Test
    void readsColumnListAndRowFilter() {
        PermissionRecord r = store.find("ana", "PUBLIC", "orders").orElseThrow();

        assertTrue(r.canSelect());
        assertFalse(r.canDelete());
        assertThat(r.columnFilter().allowed()).containsExactlyInAnyOrder("id", "amount", "region");
        assertEquals("region = 'US'", r.rowFilter().render(null));
    }

    @Test
    void nullColumnListMeansUnrestricted() {
        PermissionRecord r = store.find("ana", "public", "customers").orElseThrow();

        assertFalse(r.columnFilter().restricted());
        assertNull(r.rowFilter());
    }

    @Test
    void missingGrantUnknownUserAndInactiveUserGetNothing() {
        assertEquals(Optional.empty(), store.find("ana", "public", "payroll"));
        assertEquals(Optional.empty(), store.find("stranger", "public", "orders"));
        assertEquals(Optional.empty(), store.find("gone", "public", "orders"));
    }

    @Test
    void adminReadsEverything() {
        PermissionRecord r = store.find("admin", "public", "payroll").orElseThrow();

        assertTrue(r.canSelect());
        assertFalse(r.columnFilter().restricted());
        assertNull(r.rowFilter());
    }

    @Test
    void invalidRowFilterDisablesTheGrant() {
        PermissionRecord r = store.find("broken", "public", "orders").orElseThrow();

        assertFalse(r.canSelect());
    }

    @Test
    void listsSelectGrantsInNameOrderAndSkipsBrokenOnes() {
        AccessibleTables ana = store.accessibleTables("ana");

        assertFalse(ana.allTables());
        assertThat(ana.grants()).extracting(PermissionRecord::tableName).containsExactly("customers", "orders");
        assertNotNull(ana.grants().get(1).rowFilter());
        assertTrue(store.accessibleTables("broken").grants().isEmpty());
    }

    @Test
    void adminListsEverythingAndStrangersNothing() {
        assertTrue(store.accessibleTables("admin").allTables());
        assertEquals(AccessibleTables.none("stranger"), store.accessibleTables("stranger"));
        assertEquals(AccessibleTables.none("gone"), store.accessibleTables("gone"));
    }

    @Test
    void databaseFailureIsReportedAsStoreException() throws SQLException {
        try (Connection c = ds.getConnection(); Statement s = c.createStatement()) {
            s.execute("DROP TABLE warden_users");
        }

        assertThrows(AuthorizationStoreException.class, () -> store.find("ana", "public", "orders"));
        assertThrows(AuthorizationStoreException.class, () -> store.accessibleTables("ana"));
    }
}
