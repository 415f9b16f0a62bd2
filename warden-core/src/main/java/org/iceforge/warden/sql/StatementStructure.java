package org.iceforge.warden.sql;

import java.util.List;

/**
 * Result of the structural scan.
 *
 * @param tokens   the tokens that were analyzed; all indexes in this structure refer to this list
 * @param topLevel null unless the statement is a single SELECT block
 */
public record StatementStructure(
        List<SqlToken> tokens,
        List<TableReference> tables,
        List<ColumnReference> columns,
        TopLevelBlock topLevel,
        ComplexityScore complexity) {

    public StatementStructure {
        tokens = List.copyOf(tokens);
        tables = List.copyOf(tables);
        columns = List.copyOf(columns);
    }
}
