package org.iceforge.warden.schema;

import java.util.Optional;

/** Read-only source of table definitions. Empty when the table is unknown. */
public interface SchemaMetadataSource {

    Optional<TableSchema> describe(String schema, String table);
}
