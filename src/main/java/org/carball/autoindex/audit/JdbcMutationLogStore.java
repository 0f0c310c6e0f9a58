package org.carball.autoindex.audit;

import org.carball.autoindex.db.ConnectionProvider;
import org.carball.autoindex.model.audit.MutationLogEntry;
import org.carball.autoindex.model.audit.MutationOutcome;
import org.carball.autoindex.model.decision.DecisionAction;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Mutation log in the {@code mutation_log} table. Each append is one INSERT
 * in autocommit mode, so it is atomic by construction.
 */
public class JdbcMutationLogStore implements MutationLogStore {

    private static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS mutation_log (
            entry_id             UUID PRIMARY KEY,
            schema_version       INTEGER NOT NULL,
            decision_id          UUID NOT NULL,
            tenant_id            VARCHAR(255) NOT NULL,
            table_name           VARCHAR(255) NOT NULL,
            field_names          TEXT NOT NULL,
            action               VARCHAR(16) NOT NULL,
            score                DOUBLE PRECISION NOT NULL,
            confidence           DOUBLE PRECISION NOT NULL,
            estimated_benefit    DOUBLE PRECISION NOT NULL,
            estimated_build_cost DOUBLE PRECISION NOT NULL,
            index_exists         BOOLEAN NOT NULL,
            reason_text          TEXT NOT NULL,
            query_count          BIGINT NOT NULL,
            window_start         TIMESTAMPTZ,
            window_end           TIMESTAMPTZ,
            evaluated_at         TIMESTAMPTZ,
            outcome              VARCHAR(32) NOT NULL,
            error_detail         TEXT,
            applied_at           TIMESTAMPTZ,
            recorded_at          TIMESTAMPTZ NOT NULL
        );
        CREATE INDEX IF NOT EXISTS idx_mutation_log_decision ON mutation_log (decision_id);
        CREATE INDEX IF NOT EXISTS idx_mutation_log_tenant ON mutation_log (tenant_id, recorded_at)
    """;

    private static final String INSERT = """
        INSERT INTO mutation_log (entry_id, schema_version, decision_id, tenant_id, table_name, field_names,
                                  action, score, confidence, estimated_benefit, estimated_build_cost, index_exists,
                                  reason_text, query_count, window_start, window_end, evaluated_at,
                                  outcome, error_detail, applied_at, recorded_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
    """;

    private static final String SELECT_ALL = "SELECT * FROM mutation_log ORDER BY recorded_at, entry_id";

    private static final String SELECT_BY_DECISION = "SELECT * FROM mutation_log WHERE decision_id = ? ORDER BY recorded_at";

    private final ConnectionProvider connections;

    public JdbcMutationLogStore(ConnectionProvider connections) {
        this.connections = connections;
    }

    public void createTableIfMissing() throws SQLException {
        try (Connection conn = connections.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String ddl : CREATE_TABLE.split(";")) {
                if (!ddl.isBlank()) {
                    stmt.execute(ddl);
                }
            }
        }
    }

    @Override
    public void append(MutationLogEntry entry) {
        MutationLogRow row = MutationLogRow.from(entry);

        try (Connection conn = connections.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT)) {

            stmt.setObject(1, row.entryId());
            stmt.setInt(2, row.schemaVersion());
            stmt.setObject(3, row.decisionId());
            stmt.setString(4, row.tenantId());
            stmt.setString(5, row.tableName());
            stmt.setString(6, String.join(",", row.fieldNames()));
            stmt.setString(7, row.action().name());
            stmt.setDouble(8, row.score());
            stmt.setDouble(9, row.confidence());
            stmt.setDouble(10, row.estimatedBenefit());
            stmt.setDouble(11, row.estimatedBuildCost());
            stmt.setBoolean(12, row.indexExists());
            stmt.setString(13, row.reasonText());
            stmt.setLong(14, row.queryCount());
            stmt.setTimestamp(15, timestamp(row.windowStart()));
            stmt.setTimestamp(16, timestamp(row.windowEnd()));
            stmt.setTimestamp(17, timestamp(row.evaluatedAt()));
            stmt.setString(18, row.outcome().name());
            stmt.setString(19, row.errorDetail());
            stmt.setTimestamp(20, timestamp(row.appliedAt()));
            stmt.setTimestamp(21, timestamp(row.recordedAt()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new AuditWriteException("Failed to insert mutation log entry " + entry.entryId(), e);
        }
    }

    @Override
    public List<MutationLogEntry> readAll() {
        try (Connection conn = connections.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL);
             ResultSet rs = stmt.executeQuery()) {
            return readRows(rs);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read mutation_log: " + e.getMessage(), e);
        }
    }

    @Override
    public List<MutationLogEntry> entriesFor(UUID decisionId) {
        try (Connection conn = connections.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_DECISION)) {
            stmt.setObject(1, decisionId);
            try (ResultSet rs = stmt.executeQuery()) {
                return readRows(rs);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read mutation_log for decision " + decisionId + ": " + e.getMessage(), e);
        }
    }

    private static List<MutationLogEntry> readRows(ResultSet rs) throws SQLException {
        List<MutationLogEntry> entries = new ArrayList<>();
        while (rs.next()) {
            MutationLogRow row = new MutationLogRow(
                    rs.getInt("schema_version"),
                    rs.getObject("entry_id", UUID.class),
                    rs.getObject("decision_id", UUID.class),
                    rs.getString("tenant_id"),
                    rs.getString("table_name"),
                    Arrays.asList(rs.getString("field_names").split(",")),
                    DecisionAction.valueOf(rs.getString("action")),
                    rs.getDouble("score"),
                    rs.getDouble("confidence"),
                    rs.getDouble("estimated_benefit"),
                    rs.getDouble("estimated_build_cost"),
                    rs.getBoolean("index_exists"),
                    rs.getString("reason_text"),
                    rs.getLong("query_count"),
                    instant(rs.getTimestamp("window_start")),
                    instant(rs.getTimestamp("window_end")),
                    instant(rs.getTimestamp("evaluated_at")),
                    MutationOutcome.valueOf(rs.getString("outcome")),
                    rs.getString("error_detail"),
                    instant(rs.getTimestamp("applied_at")),
                    instant(rs.getTimestamp("recorded_at")));
            entries.add(row.toEntry());
        }
        return entries;
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
