package org.carball.autoindex.executor;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;

/**
 * The only path by which the engine changes a schema.
 */
public interface IndexDdlClient {

    /**
     * Builds the index online. Must give up by itself once {@code timeout} has
     * passed; the executor additionally interrupts the calling thread.
     */
    void createIndex(IndexDefinition definition, Duration timeout) throws MutationException;

    /**
     * @return empty when no index of that name exists, otherwise whether it is valid
     */
    Optional<Boolean> indexValidity(String schemaName, String indexName) throws SQLException;

    void dropIndex(String schemaName, String indexName) throws SQLException;
}
