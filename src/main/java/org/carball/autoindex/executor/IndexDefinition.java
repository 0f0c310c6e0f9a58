package org.carball.autoindex.executor;

import org.carball.autoindex.model.decision.IndexCandidate;
import org.carball.autoindex.model.schema.Table;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.zip.CRC32;

/**
 * Concrete DDL target for a candidate. On tables with a tenant column the index
 * is partial, restricted to the candidate's tenant, so one tenant's build never
 * changes another tenant's plans.
 */
public record IndexDefinition(String indexName,
                              String schemaName,
                              String table,
                              List<String> columns,
                              String tenantColumn,
                              String tenantId) {

    // PostgreSQL truncates identifiers at NAMEDATALEN - 1 bytes
    static final int MAX_IDENTIFIER_LENGTH = 63;
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public IndexDefinition {
        columns = columns == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public static IndexDefinition forCandidate(IndexCandidate candidate, Table table, String schemaName) {
        String tenantColumn = table.getTenantColumn();
        String tenantId = tenantColumn == null ? null : candidate.tenantId();
        String name = indexName(candidate.table(), candidate.fields(), tenantId);
        return new IndexDefinition(name, schemaName, candidate.table(), candidate.fields(), tenantColumn, tenantId);
    }

    /**
     * idx_&lt;table&gt;_&lt;fields&gt;[_t&lt;tenant hash&gt;], shortened with a hash
     * suffix when it would exceed the identifier limit.
     */
    static String indexName(String table, List<String> fields, String tenantId) {
        StringBuilder name = new StringBuilder("idx_").append(table);
        for (String field : fields) {
            name.append('_').append(field);
        }
        if (tenantId != null) {
            name.append("_t").append(hash(tenantId));
        }
        String full = name.toString().toLowerCase(Locale.ROOT);
        if (full.length() <= MAX_IDENTIFIER_LENGTH) {
            return full;
        }
        String suffix = "_" + hash(full);
        return full.substring(0, MAX_IDENTIFIER_LENGTH - suffix.length()) + suffix;
    }

    private static String hash(String value) {
        CRC32 crc = new CRC32();
        crc.update(value.getBytes(StandardCharsets.UTF_8));
        return String.format("%08x", crc.getValue());
    }

    /**
     * @throws MutationException (PERMANENT) naming every invalid part
     */
    public void validate() throws MutationException {
        List<String> problems = new ArrayList<>();
        checkIdentifier(problems, "index name", indexName);
        checkIdentifier(problems, "schema", schemaName);
        checkIdentifier(problems, "table", table);
        if (columns.isEmpty()) {
            problems.add("no columns");
        }
        for (String column : columns) {
            checkIdentifier(problems, "column", column);
        }
        if (tenantColumn != null) {
            checkIdentifier(problems, "tenant column", tenantColumn);
            if (tenantId == null || tenantId.isEmpty()) {
                problems.add("tenant column without tenant id");
            }
        }
        if (indexName != null && indexName.length() > MAX_IDENTIFIER_LENGTH) {
            problems.add("index name longer than " + MAX_IDENTIFIER_LENGTH + " characters");
        }
        if (!problems.isEmpty()) {
            throw new MutationException(FailureKind.PERMANENT, "invalid index definition: " + String.join(", ", problems));
        }
    }

    private static void checkIdentifier(List<String> problems, String what, String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            problems.add("invalid " + what + " '" + value + "'");
        }
    }

    public String predicate() {
        if (tenantColumn == null) {
            return null;
        }
        return quote(tenantColumn) + " = '" + tenantId.replace("'", "''") + "'";
    }

    public String qualifiedIndexName() {
        return quote(schemaName) + "." + quote(indexName);
    }

    public String createSql() {
        StringBuilder sql = new StringBuilder("CREATE INDEX CONCURRENTLY IF NOT EXISTS ")
                .append(quote(indexName))
                .append(" ON ").append(quote(schemaName)).append('.').append(quote(table))
                .append(" (");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sql.append(", ");
            sql.append(quote(columns.get(i)));
        }
        sql.append(')');
        if (tenantColumn != null) {
            sql.append(" WHERE ").append(predicate());
        }
        return sql.toString();
    }

    public String dropSql() {
        return dropSql(schemaName, indexName);
    }

    public static String dropSql(String schemaName, String indexName) {
        return "DROP INDEX CONCURRENTLY IF EXISTS " + quote(schemaName) + "." + quote(indexName);
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
