package org.carball.autoindex.health;

import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.db.ConnectionProvider;
import org.carball.autoindex.model.health.IndexHealthRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Health records written through to the {@code index_health} table for
 * dashboards. Reads are served from memory, so the evaluator never waits on
 * the database for health data.
 */
@Slf4j
public class JdbcIndexHealthStore implements IndexHealthStore {

    private static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS index_health (
            index_name     VARCHAR(255) PRIMARY KEY,
            schema_version INTEGER NOT NULL,
            table_name     VARCHAR(255) NOT NULL,
            bloat_ratio    DOUBLE PRECISION NOT NULL,
            size_bytes     BIGINT NOT NULL,
            usage_count    BIGINT NOT NULL,
            last_used_at   TIMESTAMPTZ,
            observed_at    TIMESTAMPTZ NOT NULL
        )
    """;

    private static final String UPSERT = """
        INSERT INTO index_health (index_name, schema_version, table_name, bloat_ratio, size_bytes,
                                  usage_count, last_used_at, observed_at)
        VALUES (?, 1, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (index_name) DO UPDATE SET
            table_name = EXCLUDED.table_name,
            bloat_ratio = EXCLUDED.bloat_ratio,
            size_bytes = EXCLUDED.size_bytes,
            usage_count = EXCLUDED.usage_count,
            last_used_at = EXCLUDED.last_used_at,
            observed_at = EXCLUDED.observed_at
    """;

    private static final String SELECT_ALL = """
        SELECT index_name, table_name, bloat_ratio, size_bytes, usage_count, last_used_at, observed_at
        FROM index_health
    """;

    private static final String DELETE = "DELETE FROM index_health WHERE index_name = ?";

    private final ConnectionProvider connections;
    private final InMemoryIndexHealthStore cache = new InMemoryIndexHealthStore();

    public JdbcIndexHealthStore(ConnectionProvider connections) {
        this.connections = connections;
    }

    public void createTableIfMissing() throws SQLException {
        try (Connection conn = connections.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
        }
    }

    /**
     * Loads existing rows into memory, typically once at startup.
     */
    public void load() throws SQLException {
        try (Connection conn = connections.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL);
             ResultSet rs = stmt.executeQuery()) {

            int count = 0;
            while (rs.next()) {
                Timestamp lastUsed = rs.getTimestamp("last_used_at");
                cache.upsert(new IndexHealthRecord(
                        rs.getString("index_name"),
                        rs.getString("table_name"),
                        rs.getDouble("bloat_ratio"),
                        rs.getLong("size_bytes"),
                        rs.getLong("usage_count"),
                        lastUsed == null ? null : lastUsed.toInstant(),
                        rs.getTimestamp("observed_at").toInstant()));
                count++;
            }
            log.info("Loaded {} index health records", count);
        }
    }

    @Override
    public void upsert(IndexHealthRecord record) {
        try (Connection conn = connections.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT)) {

            stmt.setString(1, record.indexName());
            stmt.setString(2, record.table());
            stmt.setDouble(3, record.bloatRatio());
            stmt.setLong(4, record.sizeBytes());
            stmt.setLong(5, record.usageCount());
            stmt.setTimestamp(6, timestamp(record.lastUsedAt()));
            stmt.setTimestamp(7, timestamp(record.observedAt()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            // the in-memory copy stays authoritative for this process
            log.warn("Failed to persist health of {}: {}", record.indexName(), e.getMessage());
        }
        cache.upsert(record);
    }

    @Override
    public void remove(String indexName) {
        try (Connection conn = connections.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE)) {
            stmt.setString(1, indexName);
            stmt.executeUpdate();
        } catch (SQLException e) {
            log.warn("Failed to delete health of {}: {}", indexName, e.getMessage());
        }
        cache.remove(indexName);
    }

    @Override
    public List<IndexHealthRecord> forTable(String table) {
        return cache.forTable(table);
    }

    @Override
    public Optional<IndexHealthRecord> find(String indexName) {
        return cache.find(indexName);
    }

    @Override
    public Collection<IndexHealthRecord> all() {
        return cache.all();
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
