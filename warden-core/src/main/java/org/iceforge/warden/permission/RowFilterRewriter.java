package org.iceforge.warden.permission;

import org.iceforge.warden.sql.SqlRenderer;
import org.iceforge.warden.sql.SqlToken;
import org.iceforge.warden.sql.SqlTokenizer;
import org.iceforge.warden.sql.StatementStructure;
import org.iceforge.warden.sql.TableReference;
import org.iceforge.warden.sql.TopLevelBlock;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Injects row filters into an analyzed statement by token edits.
 *
 * <p>Two shapes:
 * <ul>
 *   <li>the outermost block reads a single base table: the predicate is conjoined into its WHERE clause
 *       ({@code WHERE (p) AND (original)}) or a new {@code WHERE p} is inserted before GROUP BY / HAVING /
 *       ORDER BY / LIMIT</li>
 *   <li>any other filtered reference: the table name is replaced by {@code (SELECT * FROM t WHERE p) alias}</li>
 * </ul>
 * Either way ORDER BY and LIMIT stay where the caller wrote them and apply to already-filtered rows.
 * The output depends only on the input, so rewriting the same statement twice gives identical text.
 */
public final class RowFilterRewriter {
    private RowFilterRewriter() {
    }

    private record Replacement(int end, List<SqlToken> tokens) {}

    public static String rewrite(StatementStructure structure, Map<TableReference, RowPredicate> filters) {
        List<SqlToken> tokens = structure.tokens();
        if (filters.isEmpty()) return SqlRenderer.render(tokens);

        Map<Integer, List<SqlToken>> inserts = new HashMap<>();
        Map<Integer, Replacement> replacements = new HashMap<>();
        TopLevelBlock top = structure.topLevel();

        for (Map.Entry<TableReference, RowPredicate> e : filters.entrySet()) {
            TableReference table = e.getKey();
            RowPredicate predicate = e.getValue();
            if (top != null && table.equals(top.soleTable())) {
                String qualifier = table.hasAlias()
                        ? tokens.get(table.aliasIndex()).text()
                        : SqlRenderer.render(tokens.subList(table.startIndex(), table.endIndex()));
                String condition = predicate.render(qualifier);
                if (top.hasWhere()) {
                    insert(inserts, top.whereIndex() + 1, "(" + condition + ") AND (");
                    insert(inserts, top.whereEndIndex(), ")");
                } else {
                    insert(inserts, top.clauseEndIndex(), "WHERE " + condition);
                }
            } else {
                String name = SqlRenderer.render(tokens.subList(table.startIndex(), table.endIndex()));
                String derived = "(SELECT * FROM " + name + " WHERE " + predicate.render(null) + ")";
                if (!table.hasAlias()) derived += " " + tokens.get(table.endIndex() - 1).text();
                replacements.put(table.startIndex(), new Replacement(table.endIndex(), SqlTokenizer.tokenize(derived)));
            }
        }

        List<SqlToken> out = new ArrayList<>(tokens.size() + 16);
        int i = 0;
        while (i < tokens.size()) {
            List<SqlToken> ins = inserts.get(i);
            if (ins != null) out.addAll(ins);
            Replacement r = replacements.get(i);
            if (r != null) {
                out.addAll(r.tokens());
                i = r.end();
            } else {
                out.add(tokens.get(i));
                i++;
            }
        }
        List<SqlToken> tail = inserts.get(tokens.size());
        if (tail != null) out.addAll(tail);
        return SqlRenderer.render(out);
    }

    private static void insert(Map<Integer, List<SqlToken>> inserts, int index, String sql) {
        inserts.computeIfAbsent(index, k -> new ArrayList<>()).addAll(SqlTokenizer.tokenize(sql));
    }
}
