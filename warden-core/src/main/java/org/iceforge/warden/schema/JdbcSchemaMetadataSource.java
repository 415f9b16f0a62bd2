package org.iceforge.warden.schema;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Describes tables through {@link DatabaseMetaData#getColumns}. Catalogs differ in how they store unquoted names, so
 * the lookup tries the name as given, then upper case, then lower case.
 * <p>
 * Names are passed as LIKE patterns, so {@code _} and {@code %} are escaped; rows of any other table are ignored.
 */
public class JdbcSchemaMetadataSource implements SchemaMetadataSource {

    private final DataSource dataSource;

    public JdbcSchemaMetadataSource(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public Optional<TableSchema> describe(String schema, String table) {
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData md = conn.getMetaData();
            for (String s : variants(schema)) {
                for (String t : variants(table)) {
                    List<String> columns = columns(md, s, t);
                    if (!columns.isEmpty()) {
                        return Optional.of(new TableSchema(schema.toLowerCase(Locale.ROOT), table.toLowerCase(Locale.ROOT), columns));
                    }
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new IllegalStateException("Schema metadata unavailable for " + schema + "." + table, e);
        }
    }

    private static List<String> columns(DatabaseMetaData md, String schema, String table) throws SQLException {
        String escape = md.getSearchStringEscape();
        List<String> out = new ArrayList<>();
        try (ResultSet rs = md.getColumns(null, escapePattern(schema, escape), escapePattern(table, escape), "%")) {
            while (rs.next()) {
                String rowSchema = rs.getString("TABLE_SCHEM");
                // catalog-only databases report no schema
                if (!table.equals(rs.getString("TABLE_NAME")) || (rowSchema != null && !schema.equals(rowSchema))) continue;
                out.add(rs.getString("COLUMN_NAME"));
            }
        }
        return out;
    }

    static String escapePattern(String name, String escape) {
        if (escape == null || escape.isEmpty()) return name;
        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            if (ch == '_' || ch == '%' || escape.indexOf(ch) >= 0) sb.append(escape);
            sb.append(ch);
        }
        return sb.toString();
    }

    private static Set<String> variants(String name) {
        Set<String> out = new LinkedHashSet<>();
        out.add(name);
        out.add(name.toUpperCase(Locale.ROOT));
        out.add(name.toLowerCase(Locale.ROOT));
        return out;
    }
}
