package org.iceforge.warden.sql;

import java.util.Locale;
import java.util.Set;

/**
 * Word classes used by the structural scan. Only words that cannot be an unquoted column name are treated as
 * reserved; anything else that looks like an identifier is recorded as a column reference.
 */
public final class SqlKeywords {
    private SqlKeywords() {
    }

    static final Set<String> RESERVED = Set.of(
            "SELECT", "FROM", "WHERE", "AND", "OR", "NOT", "NULL", "IS", "IN", "BETWEEN", "LIKE", "ILIKE",
            "SIMILAR", "CASE", "WHEN", "THEN", "ELSE", "END", "AS", "ON", "USING", "JOIN", "INNER", "LEFT",
            "RIGHT", "FULL", "OUTER", "CROSS", "NATURAL", "GROUP", "BY", "ORDER", "HAVING", "LIMIT", "OFFSET",
            "FETCH", "UNION", "INTERSECT", "EXCEPT", "MINUS", "ALL", "DISTINCT", "ANY", "SOME", "EXISTS", "TRUE",
            "FALSE", "ASC", "DESC", "NULLS", "WITH", "RECURSIVE", "OVER", "PARTITION", "WINDOW", "QUALIFY",
            "ESCAPE", "INTERVAL", "CURRENT_DATE", "CURRENT_TIME", "CURRENT_TIMESTAMP", "LOCALTIME",
            "LOCALTIMESTAMP", "CURRENT_USER", "SESSION_USER", "LATERAL", "TABLESAMPLE", "MATERIALIZED", "FOR",
            "COLLATE", "AT", "ZONE", "FILTER", "WITHIN", "UNKNOWN", "VALUES", "TOP", "BOTH", "LEADING",
            "TRAILING");

    /** Words that end a clause of a SELECT block when met outside parentheses. */
    static final Set<String> CLAUSE_TERMINATORS = Set.of(
            "FROM", "WHERE", "GROUP", "HAVING", "WINDOW", "QUALIFY", "ORDER", "LIMIT", "OFFSET", "FETCH",
            "UNION", "INTERSECT", "EXCEPT", "MINUS");

    static final Set<String> SET_OPERATORS = Set.of("UNION", "INTERSECT", "EXCEPT", "MINUS");

    static final Set<String> JOIN_WORDS = Set.of("JOIN", "INNER", "LEFT", "RIGHT", "FULL", "OUTER", "CROSS", "NATURAL");

    static final Set<String> AGGREGATES = Set.of(
            "COUNT", "SUM", "AVG", "MIN", "MAX", "STDDEV", "VARIANCE", "ARRAY_AGG", "STRING_AGG", "GROUP_CONCAT");

    /** Words that keep their reserved meaning only inside a window frame clause. */
    static final Set<String> WINDOW_FRAME = Set.of(
            "ROWS", "RANGE", "GROUPS", "UNBOUNDED", "PRECEDING", "FOLLOWING", "CURRENT", "ROW", "EXCLUDE", "TIES",
            "OTHERS", "NO");

    /** Typed-literal prefixes such as {@code DATE '2024-01-01'}. */
    static final Set<String> TYPED_LITERAL_PREFIXES = Set.of("DATE", "TIME", "TIMESTAMP");

    public static boolean isReserved(String word) {
        return word != null && RESERVED.contains(word.toUpperCase(Locale.ROOT));
    }

    public static boolean isAggregate(String word) {
        return word != null && AGGREGATES.contains(word.toUpperCase(Locale.ROOT));
    }
}
