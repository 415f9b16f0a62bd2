package org.iceforge.warden.permission;

import java.util.List;
import java.util.Objects;

/**
 * @param rewrittenSql SQL to execute; equal to the input when no row filter applied
 * @param tables       qualified names of the base tables the statement reads
 * @param rewritten    whether any row filter was injected
 */
public record AuthorizedQuery(String rewrittenSql, List<String> tables, boolean rewritten) {

    public AuthorizedQuery {
        Objects.requireNonNull(rewrittenSql, "rewrittenSql");
        tables = List.copyOf(tables);
    }
}
