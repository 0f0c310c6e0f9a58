package org.carball.autoindex.catalog;

import org.carball.autoindex.model.schema.Table;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Read-only view of table structure and size estimates. Implementations return
 * a snapshot; callers may not mutate the returned table.
 */
public interface SchemaCatalog {

    Optional<Table> describeTable(String tenantId, String tableName) throws SQLException;
}
