package org.iceforge.warden.sql;

import java.util.Objects;

/**
 * A base table named in a FROM or JOIN clause.
 *
 * @param schema     lower-cased schema name, or null when the reference is unqualified
 * @param table      lower-cased table name
 * @param alias      lower-cased alias, or null
 * @param startIndex index of the first name token in the analyzed token list
 * @param endIndex   index one past the last name token
 * @param aliasIndex index of the alias token, or -1
 * @param depth      0 for the outermost query, incremented per nested query
 */
public record TableReference(String schema, String table, String alias,
                             int startIndex, int endIndex, int aliasIndex, int depth) {

    public TableReference {
        Objects.requireNonNull(table, "table");
    }

    /** The name other clauses use to qualify this table's columns. */
    public String exposedName() {
        return alias != null ? alias : table;
    }

    public boolean hasAlias() {
        return aliasIndex >= 0;
    }

    public String qualifiedName(String defaultSchema) {
        return (schema != null ? schema : defaultSchema) + "." + table;
    }
}
