package org.iceforge.warden.permission;

import java.util.List;
import java.util.Objects;

/**
 * Tables one user may read.
 *
 * @param allTables true for admins, who read every table without restriction; {@code grants} is then empty
 * @param grants    SELECT grants ordered by schema and table
 */
public record AccessibleTables(String userId, boolean allTables, List<PermissionRecord> grants) {

    public AccessibleTables {
        Objects.requireNonNull(userId, "userId");
        grants = grants == null ? List.of() : List.copyOf(grants);
    }

    public static AccessibleTables none(String userId) {
        return new AccessibleTables(userId, false, List.of());
    }

    public static AccessibleTables everything(String userId) {
        return new AccessibleTables(userId, true, List.of());
    }
}
