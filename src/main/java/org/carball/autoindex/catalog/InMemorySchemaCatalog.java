package org.carball.autoindex.catalog;

import org.carball.autoindex.model.schema.Index;
import org.carball.autoindex.model.schema.Table;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Schema catalog held in memory, shared by all tenants. Used for embedding and
 * in tests, where index builds register their result with {@link #addIndex}.
 */
public class InMemorySchemaCatalog implements SchemaCatalog {

    private final Map<String, Table> tables = new ConcurrentHashMap<>();

    public InMemorySchemaCatalog addTable(Table table) {
        tables.put(normalize(table.getName()), table.copy());
        return this;
    }

    public void addIndex(String tableName, Index index) {
        tables.computeIfPresent(normalize(tableName), (name, table) -> {
            Table updated = table.copy();
            updated.getIndexes().removeIf(i -> i.getName().equalsIgnoreCase(index.getName()));
            updated.addIndex(index);
            return updated;
        });
    }

    public void removeIndex(String tableName, String indexName) {
        tables.computeIfPresent(normalize(tableName), (name, table) -> {
            Table updated = table.copy();
            updated.getIndexes().removeIf(i -> i.getName().equalsIgnoreCase(indexName));
            return updated;
        });
    }

    @Override
    public Optional<Table> describeTable(String tenantId, String tableName) {
        if (tableName == null) {
            return Optional.empty();
        }
        Table table = tables.get(normalize(tableName));
        return table == null ? Optional.empty() : Optional.of(table.copy());
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
