package org.iceforge.warden.sql;

import java.util.List;

/**
 * Joins tokens back into SQL text with one canonical spacing, so that two statements that differ only in layout render
 * identically. Token text is never altered.
 */
public final class SqlRenderer {
    private SqlRenderer() {
    }

    public static String render(List<SqlToken> tokens) {
        StringBuilder sb = new StringBuilder(tokens.size() * 6);
        SqlToken prev = null;
        for (SqlToken t : tokens) {
            if (prev != null && needsSpace(prev, t)) sb.append(' ');
            sb.append(t.text());
            prev = t;
        }
        return sb.toString();
    }

    private static boolean needsSpace(SqlToken prev, SqlToken t) {
        switch (t.type()) {
            case COMMA, RPAREN, DOT, SEMICOLON -> {
                return false;
            }
            case LPAREN -> {
                // function call or column list: name(
                if (prev.is(SqlTokenType.QUOTED_IDENTIFIER)) return false;
                if (prev.is(SqlTokenType.WORD)) return SqlKeywords.isReserved(prev.text());
            }
            default -> {
            }
        }
        if (prev.is(SqlTokenType.LPAREN) || prev.is(SqlTokenType.DOT)) return false;
        if (prev.isOperator("::") || t.isOperator("::")) return false;
        return true;
    }
}
