package org.carball.autoindex.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.db.ConnectionProvider;
import org.carball.autoindex.model.telemetry.PredicateKind;
import org.carball.autoindex.model.telemetry.QueryRecord;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the {@code query_stats} table incrementally. The last id returned is
 * kept in memory, so each poll only sees rows appended since the previous one.
 */
@Slf4j
public class JdbcQueryTelemetrySource implements QueryTelemetrySource {

    private static final String NEXT_BATCH = """
        SELECT id, tenant_id, table_name, field_name, query_type, duration_ms, created_at
        FROM query_stats
        WHERE id > ?
        ORDER BY id
        LIMIT ?
    """;

    private final ConnectionProvider connections;
    private long lastSeenId;

    public JdbcQueryTelemetrySource(ConnectionProvider connections) {
        this(connections, 0L);
    }

    public JdbcQueryTelemetrySource(ConnectionProvider connections, long startAfterId) {
        this.connections = connections;
        this.lastSeenId = startAfterId;
    }

    @Override
    public synchronized List<QueryRecord> poll(int maxRecords) throws IOException {
        List<QueryRecord> results = new ArrayList<>();

        try (Connection conn = connections.getConnection();
             PreparedStatement stmt = conn.prepareStatement(NEXT_BATCH)) {

            stmt.setLong(1, lastSeenId);
            stmt.setInt(2, maxRecords);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    lastSeenId = rs.getLong("id");
                    Timestamp createdAt = rs.getTimestamp("created_at");
                    PredicateKind kind = PredicateKind.fromString(rs.getString("query_type"));

                    results.add(QueryRecord.of(
                            rs.getString("tenant_id"),
                            rs.getString("table_name"),
                            rs.getString("field_name"),
                            kind == null ? PredicateKind.EQUALITY : kind,
                            rs.getDouble("duration_ms"),
                            createdAt == null ? null : createdAt.toInstant()));
                }
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read query_stats after id " + lastSeenId + ": " + e.getMessage(), e);
        }

        log.debug("Read {} query_stats rows, cursor now at id {}", results.size(), lastSeenId);
        return results;
    }

    public synchronized long getLastSeenId() {
        return lastSeenId;
    }
}
