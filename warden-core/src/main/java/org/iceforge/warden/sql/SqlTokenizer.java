package org.iceforge.warden.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Literal-aware SQL scanner.
 *
 * <p>Rules:
 * <ul>
 *   <li>{@code '...'} strings use doubled quotes as the only escape; a backslash is an ordinary character</li>
 *   <li>{@code $$...$$} and {@code $tag$...$tag$} are strings with no escapes at all</li>
 *   <li>{@code "..."} and {@code `...`} are quoted identifiers</li>
 *   <li>comments are kept as tokens so callers can decide what to do with them</li>
 *   <li>an unterminated string, identifier or block comment is an error, never silently closed</li>
 *   <li>any other {@code $} outside a word is an error</li>
 * </ul>
 */
public final class SqlTokenizer {
    private SqlTokenizer() {
    }

    public static List<SqlToken> tokenize(String sql) {
        if (sql == null) return List.of();
        List<SqlToken> out = new ArrayList<>();
        int n = sql.length();
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            char next = (i + 1) < n ? sql.charAt(i + 1) : '\0';

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '-' && next == '-') {
                int end = sql.indexOf('\n', i);
                if (end < 0) end = n;
                out.add(new SqlToken(SqlTokenType.LINE_COMMENT, sql.substring(i, end), i));
                i = end;
                continue;
            }
            if (c == '/' && next == '*') {
                int end = sql.indexOf("*/", i + 2);
                if (end < 0) throw new SqlScanException("Unterminated block comment", i);
                out.add(new SqlToken(SqlTokenType.BLOCK_COMMENT, sql.substring(i, end + 2), i));
                i = end + 2;
                continue;
            }
            if (c == '\'') {
                i = readQuoted(sql, i, '\'', SqlTokenType.STRING, out);
                continue;
            }
            if (c == '"' || c == '`') {
                i = readQuoted(sql, i, c, SqlTokenType.QUOTED_IDENTIFIER, out);
                continue;
            }
            if (Character.isDigit(c) || (c == '.' && Character.isDigit(next))) {
                i = readNumber(sql, i, out);
                continue;
            }
            if (isIdentifierStart(c)) {
                int j = i + 1;
                while (j < n && isIdentifierPart(sql.charAt(j))) j++;
                out.add(new SqlToken(SqlTokenType.WORD, sql.substring(i, j), i));
                i = j;
                continue;
            }
            if (c == '?') {
                out.add(new SqlToken(SqlTokenType.PARAMETER, "?", i));
                i++;
                continue;
            }
            if (c == ':' && next == ':') {
                out.add(new SqlToken(SqlTokenType.OPERATOR, "::", i));
                i += 2;
                continue;
            }
            if (c == ':' && isIdentifierStart(next)) {
                int j = i + 1;
                while (j < n && isIdentifierPart(sql.charAt(j))) j++;
                out.add(new SqlToken(SqlTokenType.PARAMETER, sql.substring(i, j), i));
                i = j;
                continue;
            }
            if (c == '$' && Character.isDigit(next)) {
                int j = i + 1;
                while (j < n && Character.isDigit(sql.charAt(j))) j++;
                out.add(new SqlToken(SqlTokenType.PARAMETER, sql.substring(i, j), i));
                i = j;
                continue;
            }
            if (c == '$') {
                String tag = dollarTagAt(sql, i);
                if (tag != null) {
                    int end = sql.indexOf(tag, i + tag.length());
                    if (end < 0) throw new SqlScanException("Unterminated dollar-quoted string", i);
                    out.add(new SqlToken(SqlTokenType.STRING, sql.substring(i, end + tag.length()), i));
                    i = end + tag.length();
                    continue;
                }
            }

            switch (c) {
                case ',' -> out.add(new SqlToken(SqlTokenType.COMMA, ",", i));
                case '.' -> out.add(new SqlToken(SqlTokenType.DOT, ".", i));
                case '(' -> out.add(new SqlToken(SqlTokenType.LPAREN, "(", i));
                case ')' -> out.add(new SqlToken(SqlTokenType.RPAREN, ")", i));
                case ';' -> out.add(new SqlToken(SqlTokenType.SEMICOLON, ";", i));
                default -> {
                    String op = operatorAt(sql, i);
                    if (op == null) throw new SqlScanException("Unexpected character '" + c + "'", i);
                    out.add(new SqlToken(SqlTokenType.OPERATOR, op, i));
                    i += op.length();
                    continue;
                }
            }
            i++;
        }
        return out;
    }

    private static int readQuoted(String sql, int start, char quote, SqlTokenType type, List<SqlToken> out) {
        int n = sql.length();
        int j = start + 1;
        while (j < n) {
            char c = sql.charAt(j);
            if (c == quote) {
                if (j + 1 < n && sql.charAt(j + 1) == quote) {
                    j += 2;
                    continue;
                }
                out.add(new SqlToken(type, sql.substring(start, j + 1), start));
                return j + 1;
            }
            j++;
        }
        throw new SqlScanException(type == SqlTokenType.STRING ? "Unbalanced quote" : "Unterminated quoted identifier", start);
    }

    private static int readNumber(String sql, int start, List<SqlToken> out) {
        int n = sql.length();
        int j = start;
        while (j < n && Character.isDigit(sql.charAt(j))) j++;
        if (j < n && sql.charAt(j) == '.') {
            j++;
            while (j < n && Character.isDigit(sql.charAt(j))) j++;
        }
        if (j < n && (sql.charAt(j) == 'e' || sql.charAt(j) == 'E')) {
            int k = j + 1;
            if (k < n && (sql.charAt(k) == '+' || sql.charAt(k) == '-')) k++;
            if (k < n && Character.isDigit(sql.charAt(k))) {
                while (k < n && Character.isDigit(sql.charAt(k))) k++;
                j = k;
            }
        }
        out.add(new SqlToken(SqlTokenType.NUMBER, sql.substring(start, j), start));
        return j;
    }

    /** {@code $$} or {@code $tag$} starting at {@code i}, or null. */
    private static String dollarTagAt(String sql, int i) {
        int n = sql.length();
        int j = i + 1;
        if (j < n && isIdentifierStart(sql.charAt(j))) {
            j++;
            while (j < n && (Character.isLetterOrDigit(sql.charAt(j)) || sql.charAt(j) == '_')) j++;
        }
        if (j < n && sql.charAt(j) == '$') return sql.substring(i, j + 1);
        return null;
    }

    private static String operatorAt(String sql, int i) {
        if (i + 1 < sql.length()) {
            String two = sql.substring(i, i + 2);
            switch (two) {
                case "<=", ">=", "<>", "!=", "||", "->", "<<", ">>" -> {
                    return two;
                }
                default -> {
                }
            }
        }
        char c = sql.charAt(i);
        return "=<>+-*/%!~^&|@#".indexOf(c) >= 0 ? String.valueOf(c) : null;
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
