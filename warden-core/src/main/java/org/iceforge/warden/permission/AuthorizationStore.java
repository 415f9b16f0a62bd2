package org.iceforge.warden.permission;

import java.util.Optional;

/**
 * Read-only source of permission records. An empty result means the user has no grant on the table.
 *
 * <p>Implementations throw {@link AuthorizationStoreException} when the store cannot be reached; callers treat that
 * as a failure, never as a grant.
 */
public interface AuthorizationStore {

    /**
     * @param schema lower-cased schema name
     * @param table  lower-cased table name
     */
    Optional<PermissionRecord> find(String userId, String schema, String table);

    /** Every table the user can SELECT from; unknown and inactive users get {@link AccessibleTables#none}. */
    AccessibleTables accessibleTables(String userId);
}
