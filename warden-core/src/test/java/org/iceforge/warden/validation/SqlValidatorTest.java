package org.iceforge.warden.validation;

import org.iceforge.warden.error.ErrorKind;
import org.iceforge.warden.error.SqlValidationException;
import org.iceforge.warden.sql.ComplexityScore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class SqlValidatorTest {

    private final SqlValidator validator = new SqlValidator();

    @ParameterizedTest
    @ValueSource(strings = {
            "DROP TABLE customers",
            "delete from orders",
            "TRUNCATE orders",
            "ALTER TABLE orders ADD COLUMN x int",
            "GRANT SELECT ON orders TO bob",
            "REVOKE SELECT ON orders FROM bob",
            "SELECT * FROM orders; DROP TABLE orders",
            "WITH x AS (DELETE FROM orders RETURNING *) SELECT * FROM x",
            "SELECT id INTO backup FROM orders"
    })
    void rejectsWriteAndDdlStatements(String sql) {
        SqlValidationException e = assertThrows(SqlValidationException.class, () -> validator.validate(sql));
        assertEquals(ErrorKind.VALIDATION_ERROR, e.kind());
        assertFalse(e.retriable());
    }

    @Test
    void forbiddenVerbMessageNamesTheWord() {
        assertThatThrownBy(() -> validator.validate("drop table customers"))
                .hasMessage("Forbidden keyword: DROP. Only read-only queries are allowed.");
    }

    @Test
    void forbiddenWordsInsideLiteralsAreHarmless() {
        ValidatedQuery q = validator.validate("SELECT id FROM audit_log WHERE action = 'DROP TABLE' OR note = 'delete'");

        assertThat(q.normalizedSql()).contains("'DROP TABLE'");
    }

    @Test
    void identifiersContainingForbiddenWordsAreAllowed() {
        validator.validate("SELECT updated_at, created_by, deleted FROM orders");
    }

    @Test
    void rejectsComments() {
        assertThatThrownBy(() -> validator.validate("SELECT * FROM orders -- WHERE region = 'US'"))
                .isInstanceOf(SqlValidationException.class).hasMessageContaining("comments");
        assertThatThrownBy(() -> validator.validate("SELECT /* hint */ * FROM orders"))
                .isInstanceOf(SqlValidationException.class);
    }

    @Test
    void trailingSemicolonsAreTolerated() {
        ValidatedQuery q = validator.validate("SELECT * FROM orders;;");

        assertEquals("SELECT * FROM orders", q.normalizedSql());
    }

    @Test
    void rejectsStackedQueriesAndNonSelectStatements() {
        assertThatThrownBy(() -> validator.validate("SELECT 1; SELECT 2"))
                .hasMessage("Multiple statements are not allowed");
        assertThatThrownBy(() -> validator.validate("SHOW TABLES"))
                .hasMessageContaining("Only SELECT queries are allowed");
    }

    @Test
    void rejectsMalformedInput() {
        assertThatThrownBy(() -> validator.validate("   ")).hasMessage("Empty query");
        assertThatThrownBy(() -> validator.validate(null)).hasMessage("Empty query");
        assertThatThrownBy(() -> validator.validate("SELECT 'abc FROM t")).hasMessageContaining("Malformed SQL");
        assertThatThrownBy(() -> validator.validate("SELECT (1 FROM t")).hasMessage("Unbalanced parentheses");
        assertThatThrownBy(() -> validator.validate("SELECT * FROM generate_series(1, 3)"))
                .hasMessageContaining("Unsupported SQL");
    }

    @Test
    void rejectsOverlongStatements() {
        SqlValidator small = new SqlValidator(20);

        assertThatThrownBy(() -> small.validate("SELECT id, name, region FROM customers"))
                .hasMessageContaining("Query too long");
    }

    @Test
    void rejectsTautologiesAndDangerousFunctions() {
        assertThatThrownBy(() -> validator.validate("SELECT * FROM users WHERE name = 'x' OR 1 = 1"))
                .hasMessageContaining("always-true");
        assertThatThrownBy(() -> validator.validate("SELECT * FROM users WHERE name = '' OR 'a'='a'"))
                .hasMessageContaining("always-true");
        assertThatThrownBy(() -> validator.validate("SELECT pg_sleep(10)"))
                .hasMessage("Forbidden function: PG_SLEEP");
    }

    @Test
    void normalizesLayoutWithoutChangingMeaning() {
        ValidatedQuery q = validator.validate("  SELECT   name ,region\n\tFROM customers   WHERE region='US'  ORDER BY name  LIMIT 10 ");

        assertEquals("SELECT name, region FROM customers WHERE region = 'US' ORDER BY name LIMIT 10", q.normalizedSql());
        assertTrue(q.warnings().isEmpty());
    }

    @Test
    void highComplexityIsAWarningNotARejection() {
        ValidatedQuery q = validator.validate("SELECT c.name, COUNT(*) FROM customers c "
                + "JOIN orders o ON o.customer_id = c.id JOIN regions r ON r.code = o.region "
                + "GROUP BY c.name ORDER BY c.name");

        assertEquals(ComplexityScore.Level.HIGH, q.complexity().level());
        assertThat(q.warnings()).hasSize(1);
        assertThat(q.warnings().get(0)).startsWith("High query complexity");
    }

    @Test
    void readOnlyShapesPass() {
        validator.validate("SELECT 1");
        validator.validate("WITH t AS (SELECT id FROM orders) SELECT COUNT(*) FROM t");
        validator.validate("SELECT id FROM a UNION SELECT id FROM b");
        validator.validate("SELECT * FROM orders WHERE created_at > DATE '2024-01-01' AND amount BETWEEN 1 AND 5");
    }
}
