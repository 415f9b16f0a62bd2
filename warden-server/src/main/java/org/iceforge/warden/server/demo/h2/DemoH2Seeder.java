package org.iceforge.warden.server.demo.h2;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Creates and fills the demo tables. Re-running is harmless: tables are created if missing and rows are merged by key.
 */
public class DemoH2Seeder {
    private static final Logger log = LoggerFactory.getLogger(DemoH2Seeder.class);

    private final DataSource dataSource;
    private final DemoH2Properties props;
    private final PasswordEncoder passwordEncoder;

    public DemoH2Seeder(DataSource dataSource, DemoH2Properties props, PasswordEncoder passwordEncoder) {
        this.dataSource = Objects.requireNonNull(dataSource);
        this.props = Objects.requireNonNull(props);
        this.passwordEncoder = Objects.requireNonNull(passwordEncoder);
    }

    /** Runs every statement in one transaction; any failure rolls the whole seed back. */
    public int seed() {
        List<String> statements = statements();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (Statement st = conn.createStatement()) {
                for (String sql : statements) {
                    st.execute(sql);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Demo seed failed: " + e.getMessage(), e);
        }
        log.info("Seeded demo dataset ({} statements); analyst restricted to region {}", statements.size(),
                props.getAnalystRegion());
        return statements.size();
    }

    List<String> statements() {
        List<String> out = new ArrayList<>();
        out.add("CREATE TABLE IF NOT EXISTS customers ("
                + "id INT PRIMARY KEY, name VARCHAR(100), email VARCHAR(200), region VARCHAR(8))");
        out.add("CREATE TABLE IF NOT EXISTS orders ("
                + "id INT PRIMARY KEY, customer_id INT, region VARCHAR(8), amount DECIMAL(12,2), "
                + "status VARCHAR(16), created_at DATE)");
        out.add("CREATE TABLE IF NOT EXISTS warden_users ("
                + "user_id VARCHAR(64) PRIMARY KEY, role VARCHAR(32) NOT NULL, is_active BOOLEAN NOT NULL, "
                + "password_hash VARCHAR(100))");
        out.add("ALTER TABLE warden_users ADD COLUMN IF NOT EXISTS password_hash VARCHAR(100)");
        out.add("CREATE TABLE IF NOT EXISTS role_permissions ("
                + "user_id VARCHAR(64) NOT NULL, schema_name VARCHAR(64) NOT NULL, table_name VARCHAR(64) NOT NULL, "
                + "can_select BOOLEAN, can_insert BOOLEAN, can_update BOOLEAN, can_delete BOOLEAN, "
                + "allowed_columns VARCHAR(1000), row_filter VARCHAR(1000), "
                + "PRIMARY KEY (user_id, schema_name, table_name))");

        out.add("MERGE INTO customers KEY(id) VALUES "
                + "(1, 'Ada Lovelace', 'ada@example.com', 'EU'), "
                + "(2, 'Grace Hopper', 'grace@example.com', 'US'), "
                + "(3, 'Alan Turing', 'alan@example.com', 'EU'), "
                + "(4, 'Katherine Johnson', 'katherine@example.com', 'US'), "
                + "(5, 'Edsger Dijkstra', 'edsger@example.com', 'EU'), "
                + "(6, 'Barbara Liskov', 'barbara@example.com', 'US')");
        out.add("MERGE INTO orders KEY(id) VALUES "
                + "(100, 1, 'EU', 120.50, 'shipped', DATE '2024-01-04'), "
                + "(101, 2, 'US', 75.00, 'open', DATE '2024-01-05'), "
                + "(102, 2, 'US', 310.25, 'shipped', DATE '2024-01-09'), "
                + "(103, 3, 'EU', 42.00, 'cancelled', DATE '2024-01-11'), "
                + "(104, 4, 'US', 980.00, 'open', DATE '2024-02-01'), "
                + "(105, 5, 'EU', 15.75, 'shipped', DATE '2024-02-03'), "
                + "(106, 6, 'US', 220.00, 'shipped', DATE '2024-02-14'), "
                + "(107, 1, 'EU', 64.10, 'open', DATE '2024-02-20')");

        String hash = literal(passwordEncoder.encode(props.getPassword()));
        out.add("MERGE INTO warden_users (user_id, role, is_active, password_hash) KEY(user_id) VALUES "
                + "('admin', 'ADMIN', TRUE, " + hash + "), "
                + "('analyst', 'ANALYST', TRUE, " + hash + "), "
                + "('viewer', 'VIEWER', TRUE, " + hash + "), "
                + "('former', 'ANALYST', FALSE, " + hash + ")");
        String analystFilter = "region = " + literal(props.getAnalystRegion());
        out.add("MERGE INTO role_permissions KEY(user_id, schema_name, table_name) VALUES "
                + "('analyst', 'public', 'customers', TRUE, FALSE, FALSE, FALSE, 'id,name,region', NULL), "
                + "('analyst', 'public', 'orders', TRUE, FALSE, FALSE, FALSE, NULL, " + literal(analystFilter) + "), "
                + "('viewer', 'public', 'orders', TRUE, FALSE, FALSE, FALSE, 'id,region,amount,status', "
                + literal("status <> 'cancelled'") + ")");
        return out;
    }

    private static String literal(String s) {
        return "'" + s.replace("'", "''") + "'";
    }
}
