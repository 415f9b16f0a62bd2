package org.iceforge.warden.sql;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Restricted-grammar walker that finds the tables and columns a read-only statement touches.
 *
 * <p>Recognized:
 * <ul>
 *   <li>{@code WITH [RECURSIVE] name [(cols)] AS (query), ...} followed by a query; CTE names are not tables once
 *       defined, and only a RECURSIVE body sees its own name</li>
 *   <li>SELECT blocks combined with UNION / INTERSECT / EXCEPT / MINUS, optionally parenthesized</li>
 *   <li>FROM items: {@code [schema.]table [[AS] alias]} and {@code (query) [AS] alias}</li>
 *   <li>comma joins and {@code [NATURAL] [INNER|LEFT|RIGHT|FULL|CROSS] [OUTER] JOIN ... ON|USING}</li>
 *   <li>subqueries anywhere an expression may appear</li>
 *   <li>WHERE, GROUP BY, HAVING, WINDOW, QUALIFY, ORDER BY, LIMIT, OFFSET, FETCH</li>
 * </ul>
 *
 * <p>Everything else in a FROM clause (table functions, LATERAL, VALUES lists, parenthesized join trees, sampling
 * clauses) and any qualifier that does not name a table in scope raises {@link SqlStructureException}.
 *
 * <p>The scanner over-reports rather than under-reports: a word it cannot classify is recorded as a column.
 */
public final class StatementAnalyzer {

    private enum Mode {
        SELECT_LIST,
        LIST,
        CONDITION,
        JOIN_CONDITION,
        NESTED,
        WINDOW_SPEC
    }

    private static final class Scope {
        final Scope parent;
        final boolean opaque;
        final List<TableReference> tables = new ArrayList<>();
        final Set<String> derivedNames = new HashSet<>();
        final Set<String> cteNames = new HashSet<>();
        final Set<String> outputAliases = new HashSet<>();

        Scope(Scope parent, boolean opaque) {
            this.parent = parent;
            this.opaque = opaque;
        }

        boolean isCte(String name) {
            for (Scope s = this; s != null; s = s.parent) {
                if (s.cteNames.contains(name)) return true;
            }
            return false;
        }
    }

    private record PendingColumn(Scope scope, List<String> parts, boolean wildcard) {}

    private record BlockInfo(Scope scope, TableReference soleTable, int whereIndex, int whereEnd, int clauseEnd) {}

    private final List<SqlToken> tokens;
    private final List<TableReference> tables = new ArrayList<>();
    private final List<PendingColumn> pending = new ArrayList<>();
    private int pos;
    private int joins;
    private int maxDepth;
    private int aggregates;
    private boolean orderBy;
    private TopLevelBlock topLevel;
    private Scope orderByScope;

    private StatementAnalyzer(List<SqlToken> tokens) {
        this.tokens = tokens;
    }

    /**
     * @param tokens tokens of a single statement without comments or statement separators
     */
    public static StatementStructure analyze(List<SqlToken> tokens) {
        if (tokens == null || tokens.isEmpty()) throw new SqlStructureException("Empty statement");
        for (SqlToken t : tokens) {
            if (t.isComment()) throw new SqlStructureException("Comments are not allowed");
            if (t.is(SqlTokenType.SEMICOLON)) throw new SqlStructureException("Statement separators are not allowed");
        }
        return new StatementAnalyzer(List.copyOf(tokens)).run();
    }

    private StatementStructure run() {
        parseQuery(new Scope(null, false), 0, true);
        if (pos < tokens.size()) throw unexpected(tokens.get(pos));
        List<ColumnReference> columns = resolveColumns();
        return new StatementStructure(tokens, tables, columns, topLevel,
                ComplexityScore.of(joins, maxDepth, aggregates, orderBy));
    }

    // ---- queries and blocks ----

    private void parseQuery(Scope parent, int depth, boolean top) {
        Scope scope = parent;
        if (peekWord("WITH")) {
            scope = new Scope(parent, false);
            pos++;
            boolean recursive = peekWord("RECURSIVE");
            if (recursive) pos++;
            while (true) {
                String name = expectIdentifier("common table expression name").identifierName();
                // without RECURSIVE a body that repeats its own name reads the base table
                if (recursive) scope.cteNames.add(name);
                if (peekType(SqlTokenType.LPAREN)) skipIdentifierList();
                expectWord("AS");
                if (peekWord("NOT")) pos++;
                if (peekWord("MATERIALIZED")) pos++;
                expect(SqlTokenType.LPAREN);
                maxDepth = Math.max(maxDepth, depth + 1);
                parseQuery(scope, depth + 1, false);
                expect(SqlTokenType.RPAREN);
                scope.cteNames.add(name);
                if (!peekType(SqlTokenType.COMMA)) break;
                pos++;
            }
        }

        BlockInfo first = parseSelectTerm(scope, depth);
        boolean setOperation = false;
        while (peekWordIn(SqlKeywords.SET_OPERATORS)) {
            setOperation = true;
            pos++;
            if (peekWord("ALL") || peekWord("DISTINCT")) pos++;
            parseSelectTerm(scope, depth);
        }

        Scope opaque = new Scope(scope, true);
        if (peekWord("ORDER")) {
            pos++;
            expectWord("BY");
            orderBy = true;
            // ORDER BY after a set operation names output columns, not table columns
            Scope orderScope = (setOperation || first == null) ? opaque : first.scope();
            Scope enclosing = orderByScope;
            orderByScope = orderScope;
            parseExpression(orderScope, depth, Mode.LIST);
            orderByScope = enclosing;
        }
        while (peekWord("LIMIT") || peekWord("OFFSET") || peekWord("FETCH")) {
            pos++;
            parseExpression(opaque, depth, Mode.LIST);
        }

        if (top && !setOperation && first != null) {
            topLevel = new TopLevelBlock(first.soleTable(), first.whereIndex(), first.whereEnd(), first.clauseEnd());
        }
    }

    private BlockInfo parseSelectTerm(Scope scope, int depth) {
        if (peekType(SqlTokenType.LPAREN) && isQueryStart(pos + 1)) {
            pos++;
            parseQuery(scope, depth, false);
            expect(SqlTokenType.RPAREN);
            return null;
        }
        if (!peekWord("SELECT")) {
            SqlToken t = peek();
            throw t == null ? new SqlStructureException("Expected SELECT") : unexpected(t);
        }
        return parseSelectBlock(scope, depth);
    }

    private BlockInfo parseSelectBlock(Scope parent, int depth) {
        Scope scope = new Scope(parent, false);
        pos++;
        if (peekWord("DISTINCT")) {
            pos++;
            if (peekWord("ON")) {
                pos++;
                parseParenGroup(scope, depth, Mode.NESTED);
            }
        } else if (peekWord("ALL")) {
            pos++;
        }
        parseExpression(scope, depth, Mode.SELECT_LIST);

        TableReference sole = null;
        if (peekWord("FROM")) {
            pos++;
            sole = parseFromList(scope, depth);
        }

        int whereIndex = -1;
        int whereEnd = -1;
        if (peekWord("WHERE")) {
            whereIndex = pos;
            pos++;
            parseExpression(scope, depth, Mode.CONDITION);
            whereEnd = pos;
        }
        int clauseEnd = pos;

        if (peekWord("GROUP")) {
            pos++;
            expectWord("BY");
            aggregates++;
            parseExpression(scope, depth, Mode.LIST);
        }
        if (peekWord("HAVING")) {
            pos++;
            parseExpression(scope, depth, Mode.CONDITION);
        }
        if (peekWord("WINDOW")) {
            pos++;
            while (true) {
                expectIdentifier("window name");
                expectWord("AS");
                parseParenGroup(scope, depth, Mode.WINDOW_SPEC);
                if (!peekType(SqlTokenType.COMMA)) break;
                pos++;
            }
        }
        if (peekWord("QUALIFY")) {
            pos++;
            parseExpression(scope, depth, Mode.CONDITION);
        }
        return new BlockInfo(scope, sole, whereIndex, whereEnd, clauseEnd);
    }

    // ---- FROM ----

    /** Returns the only FROM item when it is a plain base table, else null. */
    private TableReference parseFromList(Scope scope, int depth) {
        TableReference first = parseFromItem(scope, depth);
        boolean plain = first != null;
        while (true) {
            if (peekType(SqlTokenType.COMMA)) {
                pos++;
                joins++;
                plain = false;
                parseFromItem(scope, depth);
                continue;
            }
            if (peekWordIn(SqlKeywords.JOIN_WORDS)) {
                consumeJoinWords();
                joins++;
                plain = false;
                parseFromItem(scope, depth);
                if (peekWord("ON")) {
                    pos++;
                    parseExpression(scope, depth, Mode.JOIN_CONDITION);
                } else if (peekWord("USING")) {
                    pos++;
                    parseParenGroup(scope, depth, Mode.NESTED);
                }
                continue;
            }
            break;
        }
        SqlToken t = peek();
        if (t != null && !t.is(SqlTokenType.RPAREN)
                && !(t.is(SqlTokenType.WORD) && SqlKeywords.CLAUSE_TERMINATORS.contains(t.upper()))) {
            throw new SqlStructureException("Unsupported construct in FROM clause near '" + t.text() + "'");
        }
        return plain ? first : null;
    }

    private void consumeJoinWords() {
        while (peekWordIn(SqlKeywords.JOIN_WORDS)) {
            boolean join = peekWord("JOIN");
            pos++;
            if (join) return;
        }
        SqlToken t = peek();
        throw new SqlStructureException("Expected JOIN near '" + (t == null ? "end of statement" : t.text()) + "'");
    }

    private TableReference parseFromItem(Scope scope, int depth) {
        SqlToken t = peek();
        if (t == null) throw new SqlStructureException("Missing table name in FROM clause");
        if (t.is(SqlTokenType.LPAREN)) {
            if (!isQueryStart(pos + 1)) {
                throw new SqlStructureException("Parenthesized joins are not supported");
            }
            pos++;
            maxDepth = Math.max(maxDepth, depth + 1);
            parseQuery(scope, depth + 1, false);
            expect(SqlTokenType.RPAREN);
            int aliasIndex = parseAlias();
            if (aliasIndex >= 0) scope.derivedNames.add(tokens.get(aliasIndex).identifierName());
            if (peekType(SqlTokenType.LPAREN)) skipIdentifierList();
            return null;
        }
        if (!t.isIdentifier() || (t.is(SqlTokenType.WORD) && SqlKeywords.isReserved(t.text()))) {
            throw new SqlStructureException("Unsupported construct in FROM clause near '" + t.text() + "'");
        }

        int start = pos;
        List<String> parts = new ArrayList<>();
        parts.add(t.identifierName());
        pos++;
        while (peekType(SqlTokenType.DOT)) {
            pos++;
            SqlToken p = peek();
            if (p == null || !p.isIdentifier()) throw new SqlStructureException("Malformed table name");
            parts.add(p.identifierName());
            pos++;
        }
        int end = pos;
        if (parts.size() > 3) throw new SqlStructureException("Malformed table name");
        if (peekType(SqlTokenType.LPAREN)) {
            throw new SqlStructureException("Table functions are not supported: " + String.join(".", parts));
        }

        int aliasIndex = parseAlias();
        if (peekType(SqlTokenType.LPAREN)) {
            throw new SqlStructureException("Column alias lists on tables are not supported");
        }
        String alias = aliasIndex >= 0 ? tokens.get(aliasIndex).identifierName() : null;
        String table = parts.get(parts.size() - 1);

        if (parts.size() == 1 && scope.isCte(table)) {
            scope.derivedNames.add(alias != null ? alias : table);
            return null;
        }
        String schema = parts.size() >= 2 ? parts.get(parts.size() - 2) : null;
        TableReference ref = new TableReference(schema, table, alias, start, end, aliasIndex, depth);
        tables.add(ref);
        scope.tables.add(ref);
        return ref;
    }

    /** Consumes {@code [AS] alias} when present and returns the alias token index, or -1. */
    private int parseAlias() {
        if (peekWord("AS")) {
            pos++;
            SqlToken a = peek();
            if (a == null || !isPlainIdentifier(a)) throw new SqlStructureException("Missing alias after AS");
            return pos++;
        }
        SqlToken a = peek();
        if (a != null && isPlainIdentifier(a)) return pos++;
        return -1;
    }

    // ---- expressions ----

    private void parseExpression(Scope scope, int depth, Mode mode) {
        boolean operand = false;
        while (pos < tokens.size()) {
            SqlToken t = tokens.get(pos);
            switch (t.type()) {
                case RPAREN -> {
                    return;
                }
                case COMMA -> {
                    if (mode == Mode.JOIN_CONDITION) return;
                    pos++;
                    operand = false;
                    continue;
                }
                case LPAREN -> {
                    parseParenGroup(scope, depth, Mode.NESTED);
                    operand = true;
                    continue;
                }
                case STRING, NUMBER, PARAMETER -> {
                    pos++;
                    operand = true;
                    continue;
                }
                case OPERATOR -> {
                    pos++;
                    if (t.isOperator("*") && mode == Mode.SELECT_LIST && !operand) {
                        record(scope, List.of(), true);
                        operand = true;
                    } else if (t.isOperator("::")) {
                        skipTypeName();
                        operand = true;
                    } else {
                        operand = false;
                    }
                    continue;
                }
                case WORD, QUOTED_IDENTIFIER -> {
                }
                default -> throw unexpected(t);
            }

            if (t.is(SqlTokenType.WORD)) {
                String w = t.upper();
                if (w.equals("SELECT") || w.equals("TABLE")) throw unexpected(t);
                boolean nested = mode == Mode.NESTED || mode == Mode.WINDOW_SPEC;
                if (!nested && SqlKeywords.CLAUSE_TERMINATORS.contains(w)) return;
                if (mode == Mode.JOIN_CONDITION && SqlKeywords.JOIN_WORDS.contains(w)) return;
                if (mode == Mode.WINDOW_SPEC && SqlKeywords.WINDOW_FRAME.contains(w)) {
                    pos++;
                    operand = false;
                    continue;
                }
                if (handleSpecialWord(w, scope, depth, mode)) {
                    operand = !w.equals("NULLS") && !w.equals("WITHIN") && !w.equals("TIME");
                    continue;
                }
                if (SqlKeywords.isReserved(w)) {
                    pos++;
                    operand = switch (w) {
                        case "END", "NULL", "TRUE", "FALSE", "UNKNOWN", "CURRENT_DATE", "CURRENT_TIME",
                                "CURRENT_TIMESTAMP", "LOCALTIME", "LOCALTIMESTAMP", "CURRENT_USER",
                                "SESSION_USER" -> true;
                        default -> false;
                    };
                    continue;
                }
            }

            // identifier chain: a, a.b, a.b.c, a.*
            List<String> parts = new ArrayList<>();
            parts.add(t.identifierName());
            pos++;
            boolean wildcard = false;
            while (peekType(SqlTokenType.DOT)) {
                pos++;
                SqlToken p = peek();
                if (p != null && p.isOperator("*")) {
                    wildcard = true;
                    pos++;
                    break;
                }
                if (p == null || !p.isIdentifier()) throw new SqlStructureException("Malformed qualified name");
                parts.add(p.identifierName());
                pos++;
            }
            if (!wildcard && peekType(SqlTokenType.LPAREN)) {
                if (parts.size() == 1 && SqlKeywords.isAggregate(parts.get(0))) aggregates++;
                parseParenGroup(scope, depth, Mode.NESTED);
                operand = true;
                continue;
            }
            if (mode == Mode.SELECT_LIST && operand && parts.size() == 1 && !wildcard) {
                // implicit column alias: SELECT expr name
                scope.outputAliases.add(parts.get(0));
                continue;
            }
            record(scope, parts, wildcard);
            operand = true;
        }
    }

    /** Words whose following tokens are not column references. Returns true when the word was consumed. */
    private boolean handleSpecialWord(String w, Scope scope, int depth, Mode mode) {
        switch (w) {
            case "AS" -> {
                pos++;
                if (mode == Mode.NESTED) {
                    // CAST(x AS type)
                    skipTypeName();
                } else {
                    SqlToken a = peek();
                    if (a != null && isPlainIdentifier(a)) {
                        if (mode == Mode.SELECT_LIST) scope.outputAliases.add(a.identifierName());
                        pos++;
                    }
                }
                return true;
            }
            case "OVER" -> {
                pos++;
                if (peekType(SqlTokenType.LPAREN)) {
                    parseParenGroup(scope, depth, Mode.WINDOW_SPEC);
                } else {
                    expectIdentifier("window name");
                }
                return true;
            }
            case "WITHIN" -> {
                pos++;
                if (peekWord("GROUP")) pos++;
                return true;
            }
            case "NULLS" -> {
                pos++;
                if (peekWord("FIRST") || peekWord("LAST")) pos++;
                return true;
            }
            case "INTERVAL" -> {
                pos++;
                if (peekType(SqlTokenType.STRING)) {
                    pos++;
                    SqlToken unit = peek();
                    if (unit != null && isPlainIdentifier(unit) && unit.is(SqlTokenType.WORD)) pos++;
                }
                return true;
            }
            case "DATE", "TIME", "TIMESTAMP" -> {
                SqlToken next = peekAt(pos + 1);
                if (next != null && next.is(SqlTokenType.STRING)) {
                    pos += 2;
                    return true;
                }
                if (w.equals("TIME") && next != null && next.isWord("ZONE")) {
                    pos += 2;
                    return true;
                }
                return false;
            }
            case "EXTRACT" -> {
                SqlToken next = peekAt(pos + 1);
                SqlToken after = peekAt(pos + 3);
                if (next == null || !next.is(SqlTokenType.LPAREN) || after == null || !after.isWord("FROM")) {
                    return false;
                }
                // EXTRACT(field FROM expr)
                pos += 4;
                parseExpression(scope, depth, Mode.NESTED);
                expect(SqlTokenType.RPAREN);
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    private void parseParenGroup(Scope scope, int depth, Mode inner) {
        expect(SqlTokenType.LPAREN);
        if (isQueryStart(pos)) {
            maxDepth = Math.max(maxDepth, depth + 1);
            parseQuery(scope, depth + 1, false);
        } else {
            parseExpression(scope, depth, inner);
        }
        expect(SqlTokenType.RPAREN);
    }

    /** Skips a type name such as {@code int}, {@code varchar(20)} or {@code double precision}. */
    private void skipTypeName() {
        while (pos < tokens.size()) {
            SqlToken t = tokens.get(pos);
            if (t.is(SqlTokenType.WORD) && !SqlKeywords.CLAUSE_TERMINATORS.contains(t.upper())
                    && !SqlKeywords.isReserved(t.text())) {
                pos++;
                if (peekType(SqlTokenType.LPAREN)) skipBalanced();
                // a second word is part of the type only inside CAST(...)
                if (!peekType(SqlTokenType.WORD) || peekAtType(pos + 1) != SqlTokenType.RPAREN) return;
                continue;
            }
            return;
        }
    }

    private void skipIdentifierList() {
        expect(SqlTokenType.LPAREN);
        while (true) {
            expectIdentifier("column name");
            if (!peekType(SqlTokenType.COMMA)) break;
            pos++;
        }
        expect(SqlTokenType.RPAREN);
    }

    private void skipBalanced() {
        int level = 0;
        do {
            SqlToken t = peek();
            if (t == null) throw new SqlStructureException("Unbalanced parentheses");
            if (t.is(SqlTokenType.LPAREN)) level++;
            if (t.is(SqlTokenType.RPAREN)) level--;
            pos++;
        } while (level > 0);
    }

    // ---- column resolution ----

    private void record(Scope scope, List<String> parts, boolean wildcard) {
        if (scope.opaque) return;
        // ORDER BY may name a select-list alias instead of a column
        if (scope == orderByScope && parts.size() == 1 && !wildcard && scope.outputAliases.contains(parts.get(0))) {
            return;
        }
        pending.add(new PendingColumn(scope, List.copyOf(parts), wildcard));
    }

    private List<ColumnReference> resolveColumns() {
        List<ColumnReference> out = new ArrayList<>(pending.size());
        for (PendingColumn p : pending) {
            List<String> parts = p.parts();
            if (parts.isEmpty()) {
                out.add(new ColumnReference("*", false, p.scope().tables));
                continue;
            }
            if (parts.size() == 1 && !p.wildcard()) {
                out.add(new ColumnReference(parts.get(0), false, tablesInScope(p.scope())));
                continue;
            }
            List<String> qualifier = p.wildcard() ? parts : parts.subList(0, parts.size() - 1);
            String column = p.wildcard() ? "*" : parts.get(parts.size() - 1);
            out.add(new ColumnReference(column, true, resolveQualifier(p.scope(), qualifier)));
        }
        return out;
    }

    private static List<TableReference> tablesInScope(Scope scope) {
        List<TableReference> out = new ArrayList<>();
        for (Scope s = scope; s != null; s = s.parent) out.addAll(s.tables);
        return out;
    }

    private static List<TableReference> resolveQualifier(Scope scope, List<String> qualifier) {
        String table = qualifier.get(qualifier.size() - 1);
        String schema = qualifier.size() >= 2 ? qualifier.get(qualifier.size() - 2) : null;
        for (Scope s = scope; s != null; s = s.parent) {
            List<TableReference> matches = new ArrayList<>();
            for (TableReference t : s.tables) {
                if (schema == null) {
                    if (t.exposedName().equals(table)) matches.add(t);
                } else if (t.alias() == null && t.table().equals(table)
                        && (t.schema() == null || t.schema().equals(schema))) {
                    matches.add(t);
                }
            }
            if (!matches.isEmpty()) return matches;
            if (schema == null && s.derivedNames.contains(table)) return List.of();
        }
        throw new SqlStructureException("Unknown table qualifier '" + String.join(".", qualifier) + "'");
    }

    // ---- token helpers ----

    private SqlToken peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private SqlToken peekAt(int index) {
        return index < tokens.size() ? tokens.get(index) : null;
    }

    private SqlTokenType peekAtType(int index) {
        SqlToken t = peekAt(index);
        return t == null ? null : t.type();
    }

    private boolean peekType(SqlTokenType type) {
        SqlToken t = peek();
        return t != null && t.is(type);
    }

    private boolean peekWord(String word) {
        SqlToken t = peek();
        return t != null && t.isWord(word);
    }

    private boolean peekWordIn(Set<String> words) {
        SqlToken t = peek();
        return t != null && t.is(SqlTokenType.WORD) && words.contains(t.upper());
    }

    private boolean isQueryStart(int index) {
        SqlToken t = peekAt(index);
        return t != null && (t.isWord("SELECT") || t.isWord("WITH"));
    }

    private static boolean isPlainIdentifier(SqlToken t) {
        return t.is(SqlTokenType.QUOTED_IDENTIFIER) || (t.is(SqlTokenType.WORD) && !SqlKeywords.isReserved(t.text()));
    }

    private void expect(SqlTokenType type) {
        SqlToken t = peek();
        if (t == null) throw new SqlStructureException("Unexpected end of statement, expected " + describe(type));
        if (!t.is(type)) throw unexpected(t);
        pos++;
    }

    private void expectWord(String word) {
        SqlToken t = peek();
        if (t == null) throw new SqlStructureException("Unexpected end of statement, expected " + word);
        if (!t.isWord(word)) throw unexpected(t);
        pos++;
    }

    private SqlToken expectIdentifier(String what) {
        SqlToken t = peek();
        if (t == null || !isPlainIdentifier(t)) {
            throw new SqlStructureException("Expected " + what + (t == null ? "" : " near '" + t.text() + "'"));
        }
        pos++;
        return t;
    }

    private static String describe(SqlTokenType type) {
        return switch (type) {
            case LPAREN -> "'('";
            case RPAREN -> "')'";
            default -> type.name().toLowerCase();
        };
    }

    private static SqlStructureException unexpected(SqlToken t) {
        return new SqlStructureException("Unexpected '" + t.text() + "'");
    }
}
