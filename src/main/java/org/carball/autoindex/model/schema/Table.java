package org.carball.autoindex.model.schema;

import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@RequiredArgsConstructor
public class Table {
    private final String name;
    private long rowCountEstimate;
    private long writesPerWindowEstimate;
    // column holding the tenant id on shared tables, null for single-tenant tables
    private String tenantColumn;
    private List<Column> columns = new ArrayList<>();
    private List<Index> indexes = new ArrayList<>();

    public void addColumn(Column column) {
        columns.add(column);
    }

    public void addIndex(Index index) {
        indexes.add(index);
    }

    public Column findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.getName().equalsIgnoreCase(columnName))
                .findFirst()
                .orElse(null);
    }

    public Index findIndex(String indexName) {
        return indexes.stream()
                .filter(i -> i.getName().equalsIgnoreCase(indexName))
                .findFirst()
                .orElse(null);
    }

    public boolean hasIndexCovering(String field, String tenantId) {
        return indexes.stream().anyMatch(i -> i.covers(field, tenantColumn, tenantId));
    }

    public boolean isMultiTenant() {
        return tenantColumn != null;
    }

    public Table copy() {
        Table copy = new Table(name);
        copy.setRowCountEstimate(rowCountEstimate);
        copy.setWritesPerWindowEstimate(writesPerWindowEstimate);
        copy.setTenantColumn(tenantColumn);
        columns.forEach(c -> copy.addColumn(c.toBuilder().build()));
        indexes.forEach(i -> copy.addIndex(i.toBuilder()
                .columns(i.getColumns() == null ? new ArrayList<>() : new ArrayList<>(i.getColumns()))
                .build()));
        return copy;
    }
}
