package org.carball.autoindex.health;

import org.carball.autoindex.model.health.IndexHealthRecord;

/**
 * Writable health store. Only the {@link HealthRecorder} holds this type;
 * everything else sees an {@link IndexHealthView}.
 */
public interface IndexHealthStore extends IndexHealthView {

    void upsert(IndexHealthRecord record);

    void remove(String indexName);
}
