package org.carball.autoindex.health;

import org.carball.autoindex.model.health.IndexHealthRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to index health, handed to the evaluator.
 */
public interface IndexHealthView {

    List<IndexHealthRecord> forTable(String table);

    Optional<IndexHealthRecord> find(String indexName);

    Collection<IndexHealthRecord> all();
}
