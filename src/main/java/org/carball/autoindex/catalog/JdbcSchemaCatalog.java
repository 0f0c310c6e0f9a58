package org.carball.autoindex.catalog;

import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.db.ConnectionProvider;
import org.carball.autoindex.model.schema.Column;
import org.carball.autoindex.model.schema.Index;
import org.carball.autoindex.model.schema.Table;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Describes tables from the PostgreSQL system catalogs.
 * <p>
 * Row counts come from {@code pg_class.reltuples}, cardinality from
 * {@code pg_stats.n_distinct} and indexes from {@code pg_index}. The write
 * estimate is a rate: the {@code pg_stat_user_tables} tuple counters are
 * sampled on each call and the delta since the previous sample is scaled to
 * one window. The first sample of a table has no rate yet and reports zero.
 */
@Slf4j
public class JdbcSchemaCatalog implements SchemaCatalog {

    private static final String TABLE_STATS = """
        SELECT GREATEST(c.reltuples, 0)::bigint AS row_estimate,
               COALESCE(s.n_tup_ins + s.n_tup_upd + s.n_tup_del, 0) AS write_counter
        FROM pg_class c
        JOIN pg_namespace n ON n.oid = c.relnamespace
        LEFT JOIN pg_stat_user_tables s ON s.relid = c.oid
        WHERE n.nspname = ? AND c.relname = ? AND c.relkind IN ('r', 'p')
    """;

    private static final String COLUMNS = """
        SELECT a.attname AS column_name,
               format_type(a.atttypid, a.atttypmod) AS data_type,
               NOT a.attnotnull AS nullable,
               st.n_distinct
        FROM pg_attribute a
        JOIN pg_class c ON c.oid = a.attrelid
        JOIN pg_namespace n ON n.oid = c.relnamespace
        LEFT JOIN pg_stats st ON st.schemaname = n.nspname AND st.tablename = c.relname AND st.attname = a.attname
        WHERE n.nspname = ? AND c.relname = ? AND a.attnum > 0 AND NOT a.attisdropped
        ORDER BY a.attnum
    """;

    private static final String INDEXES = """
        SELECT i.relname AS index_name,
               ix.indisunique AS is_unique,
               ix.indisvalid AS is_valid,
               pg_get_expr(ix.indpred, ix.indrelid) AS predicate,
               ARRAY(
                   SELECT a.attname
                   FROM unnest(ix.indkey) WITH ORDINALITY AS k(attnum, ord)
                   JOIN pg_attribute a ON a.attrelid = ix.indrelid AND a.attnum = k.attnum
                   ORDER BY k.ord
               ) AS column_names
        FROM pg_index ix
        JOIN pg_class i ON i.oid = ix.indexrelid
        JOIN pg_class t ON t.oid = ix.indrelid
        JOIN pg_namespace n ON n.oid = t.relnamespace
        WHERE n.nspname = ? AND t.relname = ?
        ORDER BY i.relname
    """;

    private final ConnectionProvider connections;
    private final String schemaName;
    private final String tenantColumnName;
    private final Duration windowSize;
    private final Clock clock;
    private final Map<String, WriteSample> writeSamples = new ConcurrentHashMap<>();

    public JdbcSchemaCatalog(ConnectionProvider connections, String schemaName, String tenantColumnName,
                             Duration windowSize, Clock clock) {
        this.connections = connections;
        this.schemaName = schemaName;
        this.tenantColumnName = tenantColumnName;
        this.windowSize = windowSize;
        this.clock = clock;
    }

    @Override
    public Optional<Table> describeTable(String tenantId, String tableName) throws SQLException {
        try (Connection conn = connections.getConnection()) {
            Table table = new Table(tableName);

            try (PreparedStatement stmt = conn.prepareStatement(TABLE_STATS)) {
                stmt.setString(1, schemaName);
                stmt.setString(2, tableName);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    table.setRowCountEstimate(rs.getLong("row_estimate"));
                    table.setWritesPerWindowEstimate(writesPerWindow(tableName, rs.getLong("write_counter")));
                }
            }

            try (PreparedStatement stmt = conn.prepareStatement(COLUMNS)) {
                stmt.setString(1, schemaName);
                stmt.setString(2, tableName);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        double nDistinct = rs.getDouble("n_distinct");
                        boolean known = !rs.wasNull();
                        table.addColumn(Column.builder()
                                .name(rs.getString("column_name"))
                                .dataType(rs.getString("data_type"))
                                .nullable(rs.getBoolean("nullable"))
                                .distinctEstimate(known ? distinctCount(nDistinct, table.getRowCountEstimate()) : 0)
                                .build());
                    }
                }
            }

            try (PreparedStatement stmt = conn.prepareStatement(INDEXES)) {
                stmt.setString(1, schemaName);
                stmt.setString(2, tableName);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        table.addIndex(Index.builder()
                                .name(rs.getString("index_name"))
                                .unique(rs.getBoolean("is_unique"))
                                .valid(rs.getBoolean("is_valid"))
                                .predicate(rs.getString("predicate"))
                                .columns(columnNames(rs.getArray("column_names")))
                                .build());
                    }
                }
            }

            if (tenantColumnName != null && table.findColumn(tenantColumnName) != null) {
                table.setTenantColumn(tenantColumnName);
            }

            log.debug("Described {}.{}: {} rows, {} writes/window, {} columns, {} indexes", schemaName, tableName,
                    table.getRowCountEstimate(), table.getWritesPerWindowEstimate(),
                    table.getColumns().size(), table.getIndexes().size());
            return Optional.of(table);
        }
    }

    // negative n_distinct is a fraction of the row count
    static long distinctCount(double nDistinct, long rows) {
        if (nDistinct >= 0) {
            return (long) nDistinct;
        }
        return Math.round(-nDistinct * rows);
    }

    long writesPerWindow(String tableName, long counter) {
        Instant now = clock.instant();
        WriteSample previous = writeSamples.get(tableName);

        if (previous == null || counter < previous.counter()) {
            // first sample, or counters were reset
            writeSamples.put(tableName, new WriteSample(counter, now, 0.0));
            return 0;
        }

        long elapsedMillis = Duration.between(previous.sampledAt(), now).toMillis();
        if (elapsedMillis < 1000) {
            return Math.round(previous.writesPerMilli() * windowSize.toMillis());
        }

        double rate = (counter - previous.counter()) / (double) elapsedMillis;
        writeSamples.put(tableName, new WriteSample(counter, now, rate));
        return Math.round(rate * windowSize.toMillis());
    }

    private static List<String> columnNames(Array array) throws SQLException {
        if (array == null) {
            return new ArrayList<>();
        }
        Object[] names = (Object[]) array.getArray();
        List<String> result = new ArrayList<>();
        Arrays.stream(names).forEach(n -> result.add(String.valueOf(n)));
        return result;
    }

    private record WriteSample(long counter, Instant sampledAt, double writesPerMilli) {
    }
}
