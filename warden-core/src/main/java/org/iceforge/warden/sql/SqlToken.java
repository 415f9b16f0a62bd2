package org.iceforge.warden.sql;

import java.util.Locale;
import java.util.Objects;

/**
 * One lexical unit of a SQL statement.
 *
 * @param position character offset in the scanned text, or -1 for tokens synthesized by a rewrite
 */
public record SqlToken(SqlTokenType type, String text, int position) {

    public SqlToken {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    public boolean is(SqlTokenType t) {
        return type == t;
    }

    /** True for an unquoted word equal to {@code keyword}, ignoring case. */
    public boolean isWord(String keyword) {
        return type == SqlTokenType.WORD && text.equalsIgnoreCase(keyword);
    }

    public boolean isOperator(String op) {
        return type == SqlTokenType.OPERATOR && text.equals(op);
    }

    public boolean isComment() {
        return type == SqlTokenType.LINE_COMMENT || type == SqlTokenType.BLOCK_COMMENT;
    }

    public boolean isIdentifier() {
        return type == SqlTokenType.WORD || type == SqlTokenType.QUOTED_IDENTIFIER;
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    /**
     * Name this identifier resolves to when matched against catalog names: unquoted words are case-folded to lower
     * case, quoted identifiers lose their quotes.
     */
    public String identifierName() {
        if (type == SqlTokenType.QUOTED_IDENTIFIER) {
            char q = text.charAt(0);
            String inner = text.substring(1, text.length() - 1);
            return inner.replace(String.valueOf(q) + q, String.valueOf(q)).toLowerCase(Locale.ROOT);
        }
        return text.toLowerCase(Locale.ROOT);
    }
}
