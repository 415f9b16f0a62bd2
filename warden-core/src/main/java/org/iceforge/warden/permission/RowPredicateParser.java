package org.iceforge.warden.permission;

import org.iceforge.warden.sql.SqlScanException;
import org.iceforge.warden.sql.SqlToken;
import org.iceforge.warden.sql.SqlTokenType;
import org.iceforge.warden.sql.SqlTokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the row filter text stored with a permission record into a {@link RowPredicate}.
 *
 * <p>Grammar:
 * <pre>
 *   expr    := and (OR and)*
 *   and     := unary (AND unary)*
 *   unary   := NOT unary | '(' expr ')' | test
 *   test    := column op literal
 *            | column [NOT] IN '(' literal (',' literal)* ')'
 *            | column IS [NOT] NULL
 *            | column [NOT] BETWEEN literal AND literal
 *            | column [NOT] LIKE string
 *   literal := string | [-]number | TRUE | FALSE
 * </pre>
 * Anything outside this grammar (functions, subqueries, column-to-column comparisons) is rejected.
 */
public final class RowPredicateParser {

    private final List<SqlToken> tokens;
    private int pos;

    private RowPredicateParser(List<SqlToken> tokens) {
        this.tokens = tokens;
    }

    public static RowPredicate parse(String expression) {
        if (expression == null || expression.isBlank()) throw new InvalidRowFilterException("Empty row filter");
        List<SqlToken> tokens;
        try {
            tokens = SqlTokenizer.tokenize(expression);
        } catch (SqlScanException e) {
            throw new InvalidRowFilterException(e.getMessage());
        }
        for (SqlToken t : tokens) {
            if (t.isComment() || t.is(SqlTokenType.SEMICOLON) || t.is(SqlTokenType.PARAMETER)) {
                throw new InvalidRowFilterException("Unsupported token in row filter: " + t.text());
            }
        }
        RowPredicateParser p = new RowPredicateParser(tokens);
        try {
            RowPredicate result = p.parseOr();
            if (p.pos < tokens.size()) throw p.error("Unexpected '" + tokens.get(p.pos).text() + "'");
            return result;
        } catch (InvalidRowFilterException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new InvalidRowFilterException(e.getMessage());
        }
    }

    private RowPredicate parseOr() {
        List<RowPredicate> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (peekWord("OR")) {
            pos++;
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new RowPredicate.Or(operands);
    }

    private RowPredicate parseAnd() {
        List<RowPredicate> operands = new ArrayList<>();
        operands.add(parseUnary());
        while (peekWord("AND")) {
            pos++;
            operands.add(parseUnary());
        }
        return operands.size() == 1 ? operands.get(0) : new RowPredicate.And(operands);
    }

    private RowPredicate parseUnary() {
        if (peekWord("NOT")) {
            pos++;
            return new RowPredicate.Not(parseUnary());
        }
        if (peek(SqlTokenType.LPAREN)) {
            pos++;
            RowPredicate inner = parseOr();
            expect(SqlTokenType.RPAREN);
            return inner;
        }
        return parseTest();
    }

    private RowPredicate parseTest() {
        SqlToken col = next();
        if (!col.is(SqlTokenType.WORD) || isKeyword(col)) throw error("Expected column name, got '" + col.text() + "'");
        if (peek(SqlTokenType.DOT) || peek(SqlTokenType.LPAREN)) {
            throw error("Only bare column names are allowed in row filters");
        }
        String column = col.text();

        if (peekWord("IS")) {
            pos++;
            boolean negated = consumeWord("NOT");
            SqlToken n = next();
            if (!n.isWord("NULL")) throw error("Expected NULL after IS");
            return new RowPredicate.NullCheck(column, negated);
        }

        boolean negated = consumeWord("NOT");
        if (consumeWord("IN")) {
            expect(SqlTokenType.LPAREN);
            List<RowPredicate.Literal> values = new ArrayList<>();
            values.add(literal());
            while (peek(SqlTokenType.COMMA)) {
                pos++;
                values.add(literal());
            }
            expect(SqlTokenType.RPAREN);
            return new RowPredicate.InList(column, values, negated);
        }
        if (consumeWord("BETWEEN")) {
            RowPredicate.Literal low = literal();
            if (!consumeWord("AND")) throw error("Expected AND in BETWEEN");
            return new RowPredicate.Between(column, low, literal(), negated);
        }
        if (consumeWord("LIKE")) {
            return new RowPredicate.Like(column, literal(), negated);
        }
        if (negated) throw error("Expected IN, BETWEEN or LIKE after NOT");

        SqlToken op = next();
        if (!op.is(SqlTokenType.OPERATOR)) throw error("Expected comparison operator, got '" + op.text() + "'");
        return new RowPredicate.Comparison(column, RowPredicate.Operator.fromSymbol(op.text()), literal());
    }

    private RowPredicate.Literal literal() {
        SqlToken t = next();
        if (t.is(SqlTokenType.STRING)) {
            String text = t.text();
            if (text.startsWith("$")) {
                int tag = text.indexOf('$', 1) + 1;
                return RowPredicate.Literal.string(text.substring(tag, text.length() - tag));
            }
            return RowPredicate.Literal.string(text.substring(1, text.length() - 1).replace("''", "'"));
        }
        if (t.isOperator("-") && peek(SqlTokenType.NUMBER)) {
            return RowPredicate.Literal.number("-" + next().text());
        }
        if (t.is(SqlTokenType.NUMBER)) {
            return RowPredicate.Literal.number(t.text());
        }
        if (t.isWord("TRUE") || t.isWord("FALSE")) {
            return new RowPredicate.Literal(RowPredicate.Literal.Kind.BOOLEAN, t.text());
        }
        throw error("Expected literal value, got '" + t.text() + "'");
    }

    private static boolean isKeyword(SqlToken t) {
        return switch (t.upper()) {
            case "AND", "OR", "NOT", "IN", "IS", "NULL", "BETWEEN", "LIKE", "TRUE", "FALSE", "SELECT" -> true;
            default -> false;
        };
    }

    private SqlToken next() {
        if (pos >= tokens.size()) throw error("Unexpected end of row filter");
        return tokens.get(pos++);
    }

    private boolean peek(SqlTokenType type) {
        return pos < tokens.size() && tokens.get(pos).is(type);
    }

    private boolean peekWord(String word) {
        return pos < tokens.size() && tokens.get(pos).isWord(word);
    }

    private boolean consumeWord(String word) {
        if (!peekWord(word)) return false;
        pos++;
        return true;
    }

    private void expect(SqlTokenType type) {
        SqlToken t = next();
        if (!t.is(type)) throw error("Unexpected '" + t.text() + "'");
    }

    private InvalidRowFilterException error(String message) {
        return new InvalidRowFilterException(message);
    }
}
