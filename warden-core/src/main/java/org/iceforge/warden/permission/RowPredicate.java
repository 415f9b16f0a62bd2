package org.iceforge.warden.permission;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Row-level security predicate as a typed tree.
 *
 * <p>Column names are plain identifiers and literal values are re-quoted on rendering, so a rendered predicate can be
 * spliced into SQL text without further escaping.
 */
public interface RowPredicate {

    Pattern COLUMN_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * @param qualifier table name or alias prefixed to every column, or null for bare column names
     */
    String render(String qualifier);

    Set<String> columns();

    enum Operator {
        EQ("="), NE("<>"), LT("<"), LE("<="), GT(">"), GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Operator fromSymbol(String s) {
            return switch (s) {
                case "=" -> EQ;
                case "<>", "!=" -> NE;
                case "<" -> LT;
                case "<=" -> LE;
                case ">" -> GT;
                case ">=" -> GE;
                default -> throw new IllegalArgumentException("Unsupported operator: " + s);
            };
        }
    }

    record Literal(Kind kind, String value) {
        public enum Kind { STRING, NUMBER, BOOLEAN }

        private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

        public Literal {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(value, "value");
            if (kind == Kind.NUMBER && !NUMBER.matcher(value).matches()) {
                throw new IllegalArgumentException("Not a number: " + value);
            }
            if (kind == Kind.BOOLEAN) value = value.toUpperCase(Locale.ROOT);
        }

        public static Literal string(String v) {
            return new Literal(Kind.STRING, v);
        }

        public static Literal number(String v) {
            return new Literal(Kind.NUMBER, v);
        }

        public String render() {
            return kind == Kind.STRING ? "'" + value.replace("'", "''") + "'" : value;
        }
    }

    record Comparison(String column, Operator operator, Literal value) implements RowPredicate {
        public Comparison {
            column = checkColumn(column);
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render(String qualifier) {
            return qualify(qualifier, column) + " " + operator.symbol() + " " + value.render();
        }

        @Override
        public Set<String> columns() {
            return Set.of(column);
        }
    }

    record InList(String column, List<Literal> values, boolean negated) implements RowPredicate {
        public InList {
            column = checkColumn(column);
            values = List.copyOf(values);
            if (values.isEmpty()) throw new IllegalArgumentException("IN list must not be empty");
        }

        @Override
        public String render(String qualifier) {
            String list = values.stream().map(Literal::render).collect(Collectors.joining(", "));
            return qualify(qualifier, column) + (negated ? " NOT IN (" : " IN (") + list + ")";
        }

        @Override
        public Set<String> columns() {
            return Set.of(column);
        }
    }

    record NullCheck(String column, boolean negated) implements RowPredicate {
        public NullCheck {
            column = checkColumn(column);
        }

        @Override
        public String render(String qualifier) {
            return qualify(qualifier, column) + (negated ? " IS NOT NULL" : " IS NULL");
        }

        @Override
        public Set<String> columns() {
            return Set.of(column);
        }
    }

    record Between(String column, Literal low, Literal high, boolean negated) implements RowPredicate {
        public Between {
            column = checkColumn(column);
            Objects.requireNonNull(low, "low");
            Objects.requireNonNull(high, "high");
        }

        @Override
        public String render(String qualifier) {
            return qualify(qualifier, column) + (negated ? " NOT BETWEEN " : " BETWEEN ")
                    + low.render() + " AND " + high.render();
        }

        @Override
        public Set<String> columns() {
            return Set.of(column);
        }
    }

    record Like(String column, Literal pattern, boolean negated) implements RowPredicate {
        public Like {
            column = checkColumn(column);
            Objects.requireNonNull(pattern, "pattern");
            if (pattern.kind() != Literal.Kind.STRING) throw new IllegalArgumentException("LIKE needs a string pattern");
        }

        @Override
        public String render(String qualifier) {
            return qualify(qualifier, column) + (negated ? " NOT LIKE " : " LIKE ") + pattern.render();
        }

        @Override
        public Set<String> columns() {
            return Set.of(column);
        }
    }

    record And(List<RowPredicate> operands) implements RowPredicate {
        public And {
            operands = List.copyOf(operands);
            if (operands.size() < 2) throw new IllegalArgumentException("AND needs at least two operands");
        }

        @Override
        public String render(String qualifier) {
            return operands.stream()
                    .map(p -> p instanceof Or ? "(" + p.render(qualifier) + ")" : p.render(qualifier))
                    .collect(Collectors.joining(" AND "));
        }

        @Override
        public Set<String> columns() {
            return union(operands);
        }
    }

    record Or(List<RowPredicate> operands) implements RowPredicate {
        public Or {
            operands = List.copyOf(operands);
            if (operands.size() < 2) throw new IllegalArgumentException("OR needs at least two operands");
        }

        @Override
        public String render(String qualifier) {
            return operands.stream().map(p -> p.render(qualifier)).collect(Collectors.joining(" OR "));
        }

        @Override
        public Set<String> columns() {
            return union(operands);
        }
    }

    record Not(RowPredicate operand) implements RowPredicate {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public String render(String qualifier) {
            return "NOT (" + operand.render(qualifier) + ")";
        }

        @Override
        public Set<String> columns() {
            return operand.columns();
        }
    }

    private static String checkColumn(String column) {
        if (column == null || !COLUMN_NAME.matcher(column).matches()) {
            throw new IllegalArgumentException("Invalid column name in row filter: " + column);
        }
        return column.toLowerCase(Locale.ROOT);
    }

    private static String qualify(String qualifier, String column) {
        return qualifier == null ? column : qualifier + "." + column;
    }

    private static Set<String> union(List<RowPredicate> operands) {
        Set<String> out = new LinkedHashSet<>();
        for (RowPredicate p : operands) out.addAll(p.columns());
        return out;
    }
}
