package org.iceforge.warden.sql;

/**
 * Clause positions of the outermost SELECT when the statement is a single block (no set operation).
 *
 * @param soleTable        the block's only FROM item when it is a plain base table without joins, else null
 * @param whereIndex       index of the WHERE keyword, or -1
 * @param whereEndIndex    index one past the WHERE condition
 * @param clauseEndIndex   index where a new WHERE clause would be inserted (before GROUP BY / HAVING / ORDER BY / LIMIT)
 */
public record TopLevelBlock(TableReference soleTable, int whereIndex, int whereEndIndex, int clauseEndIndex) {

    public boolean hasWhere() {
        return whereIndex >= 0;
    }
}
