package org.iceforge.warden.validation;

import org.iceforge.warden.error.SqlValidationException;
import org.iceforge.warden.sql.ComplexityScore;
import org.iceforge.warden.sql.SqlRenderer;
import org.iceforge.warden.sql.SqlScanException;
import org.iceforge.warden.sql.SqlStructureException;
import org.iceforge.warden.sql.SqlToken;
import org.iceforge.warden.sql.SqlTokenType;
import org.iceforge.warden.sql.SqlTokenizer;
import org.iceforge.warden.sql.StatementAnalyzer;
import org.iceforge.warden.sql.StatementStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Allow/deny screen for caller-supplied SQL. Stateless and free of I/O.
 *
 * <p>Checks run in this order and the first failure wins:
 * <ol>
 *   <li>empty input, length limit</li>
 *   <li>unterminated string, identifier or comment</li>
 *   <li>comments anywhere (comment-based statement termination)</li>
 *   <li>statement separators other than trailing ones (stacked queries)</li>
 *   <li>forbidden verbs and dangerous functions, matched as words outside literals</li>
 *   <li>leading verb must be SELECT or WITH</li>
 *   <li>{@code OR x = x} tautologies</li>
 *   <li>balanced parentheses and a structure the analyzer recognizes</li>
 * </ol>
 * Nothing is ever repaired: a statement either passes unchanged (apart from layout) or is rejected.
 */
public final class SqlValidator {
    private static final Logger log = LoggerFactory.getLogger(SqlValidator.class);

    public static final int MAX_SQL_LENGTH = 100_000;

    static final Set<String> FORBIDDEN_WORDS = Set.of(
            "DROP", "DELETE", "TRUNCATE", "ALTER", "GRANT", "REVOKE",
            "UPDATE", "INSERT", "MERGE", "CREATE", "UPSERT", "RENAME",
            "COMMIT", "ROLLBACK", "SAVEPOINT", "EXEC", "EXECUTE", "CALL",
            "INTO", "WAITFOR", "UTL_FILE", "UTL_HTTP", "COPY", "LOCK");

    /** Matched only when called: {@code name(}. */
    static final Set<String> FORBIDDEN_FUNCTIONS = Set.of(
            "LOAD_FILE", "XP_CMDSHELL", "PG_SLEEP", "SLEEP", "BENCHMARK", "PG_READ_FILE", "PG_READ_BINARY_FILE",
            "PG_LS_DIR", "PG_STAT_FILE", "LO_IMPORT", "LO_EXPORT", "OPENROWSET", "OPENDATASOURCE", "DBLINK",
            "QUERY_TO_XML", "TABLE_TO_XML", "CURSOR_TO_XML", "SET_CONFIG", "PG_TERMINATE_BACKEND",
            "PG_CANCEL_BACKEND");

    private final int maxLength;

    public SqlValidator() {
        this(MAX_SQL_LENGTH);
    }

    public SqlValidator(int maxLength) {
        if (maxLength <= 0) throw new IllegalArgumentException("maxLength must be > 0");
        this.maxLength = maxLength;
    }

    public ValidatedQuery validate(String rawSql) {
        if (rawSql == null || rawSql.isBlank()) throw new SqlValidationException("Empty query");
        if (rawSql.length() > maxLength) {
            throw new SqlValidationException("Query too long: " + rawSql.length() + " characters (max " + maxLength + ")");
        }

        List<SqlToken> tokens;
        try {
            tokens = SqlTokenizer.tokenize(rawSql);
        } catch (SqlScanException e) {
            throw new SqlValidationException("Malformed SQL: " + e.getMessage(), e);
        }

        for (SqlToken t : tokens) {
            if (t.isComment()) throw new SqlValidationException("SQL comments are not allowed");
        }

        tokens = stripTrailingSeparators(tokens);
        if (tokens.isEmpty()) throw new SqlValidationException("Empty query");
        for (SqlToken t : tokens) {
            if (t.is(SqlTokenType.SEMICOLON)) {
                throw new SqlValidationException("Multiple statements are not allowed");
            }
        }

        checkForbiddenWords(tokens);

        SqlToken first = tokens.get(0);
        if (!first.isWord("SELECT") && !first.isWord("WITH")) {
            throw new SqlValidationException("Only SELECT queries are allowed, got: " + first.upper());
        }

        checkTautologies(tokens);
        checkParentheses(tokens);

        StatementStructure structure;
        try {
            structure = StatementAnalyzer.analyze(tokens);
        } catch (SqlStructureException e) {
            throw new SqlValidationException("Unsupported SQL: " + e.getMessage(), e);
        }

        String normalized = SqlRenderer.render(tokens);
        ComplexityScore complexity = structure.complexity();
        List<String> warnings = new ArrayList<>();
        if (complexity.level() == ComplexityScore.Level.HIGH) {
            warnings.add("High query complexity (score " + complexity.score() + ")");
        }
        if (log.isDebugEnabled()) {
            log.debug("Validated sql={} complexity={}", normalized, complexity);
        }
        return new ValidatedQuery(normalized, complexity, warnings);
    }

    private static List<SqlToken> stripTrailingSeparators(List<SqlToken> tokens) {
        int end = tokens.size();
        while (end > 0 && tokens.get(end - 1).is(SqlTokenType.SEMICOLON)) end--;
        return tokens.subList(0, end);
    }

    private static void checkForbiddenWords(List<SqlToken> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            SqlToken t = tokens.get(i);
            if (!t.is(SqlTokenType.WORD)) continue;
            String w = t.upper();
            if (FORBIDDEN_WORDS.contains(w)) {
                throw new SqlValidationException("Forbidden keyword: " + w + ". Only read-only queries are allowed.");
            }
            if (FORBIDDEN_FUNCTIONS.contains(w) && i + 1 < tokens.size() && tokens.get(i + 1).is(SqlTokenType.LPAREN)) {
                throw new SqlValidationException("Forbidden function: " + w);
            }
        }
    }

    /** Rejects {@code OR <literal> = <same literal>}, the classic always-true injection. */
    private static void checkTautologies(List<SqlToken> tokens) {
        for (int i = 0; i + 3 < tokens.size(); i++) {
            if (!tokens.get(i).isWord("OR")) continue;
            SqlToken left = tokens.get(i + 1);
            SqlToken op = tokens.get(i + 2);
            SqlToken right = tokens.get(i + 3);
            if (isLiteral(left) && op.isOperator("=") && isLiteral(right) && left.text().equalsIgnoreCase(right.text())) {
                throw new SqlValidationException("Suspicious always-true condition: OR " + left.text() + "=" + right.text());
            }
        }
    }

    private static boolean isLiteral(SqlToken t) {
        return t.is(SqlTokenType.NUMBER) || t.is(SqlTokenType.STRING);
    }

    private static void checkParentheses(List<SqlToken> tokens) {
        int depth = 0;
        for (SqlToken t : tokens) {
            if (t.is(SqlTokenType.LPAREN)) depth++;
            if (t.is(SqlTokenType.RPAREN) && --depth < 0) break;
        }
        if (depth != 0) throw new SqlValidationException("Unbalanced parentheses");
    }
}
