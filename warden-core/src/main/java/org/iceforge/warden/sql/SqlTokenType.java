package org.iceforge.warden.sql;

public enum SqlTokenType {
    WORD,
    QUOTED_IDENTIFIER,
    STRING,
    NUMBER,
    /** {@code ?}, {@code :name} or {@code $1}. */
    PARAMETER,
    OPERATOR,
    COMMA,
    DOT,
    LPAREN,
    RPAREN,
    SEMICOLON,
    LINE_COMMENT,
    BLOCK_COMMENT
}
