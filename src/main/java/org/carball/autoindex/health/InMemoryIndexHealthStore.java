package org.carball.autoindex.health;

import org.carball.autoindex.model.health.IndexHealthRecord;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryIndexHealthStore implements IndexHealthStore {

    private final Map<String, IndexHealthRecord> records = new ConcurrentHashMap<>();

    @Override
    public void upsert(IndexHealthRecord record) {
        records.put(record.indexName(), record);
    }

    @Override
    public void remove(String indexName) {
        records.remove(indexName);
    }

    @Override
    public List<IndexHealthRecord> forTable(String table) {
        String wanted = table.toLowerCase(Locale.ROOT);
        return records.values().stream()
                .filter(r -> r.table().toLowerCase(Locale.ROOT).equals(wanted))
                .sorted(Comparator.comparing(IndexHealthRecord::indexName))
                .toList();
    }

    @Override
    public Optional<IndexHealthRecord> find(String indexName) {
        return Optional.ofNullable(records.get(indexName));
    }

    @Override
    public Collection<IndexHealthRecord> all() {
        return List.copyOf(records.values());
    }
}
