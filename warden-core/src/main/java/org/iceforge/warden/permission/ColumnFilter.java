package org.iceforge.warden.permission;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Column allow-list of a permission record. {@link #UNRESTRICTED} permits every column.
 *
 * @param allowed lower-cased column names, or null when unrestricted
 */
public record ColumnFilter(Set<String> allowed) {

    public static final ColumnFilter UNRESTRICTED = new ColumnFilter(null);

    public ColumnFilter {
        if (allowed != null) {
            Set<String> normalized = new TreeSet<>();
            for (String c : allowed) normalized.add(c.trim().toLowerCase(Locale.ROOT));
            allowed = Set.copyOf(normalized);
        }
    }

    public static ColumnFilter allowOnly(Collection<String> columns) {
        return new ColumnFilter(Set.copyOf(columns));
    }

    public boolean restricted() {
        return allowed != null;
    }

    public boolean permits(String column) {
        return allowed == null || allowed.contains(column.toLowerCase(Locale.ROOT));
    }

    public boolean permitsAll(Collection<String> columns) {
        if (allowed == null) return true;
        for (String c : columns) {
            if (!permits(c)) return false;
        }
        return true;
    }
}
