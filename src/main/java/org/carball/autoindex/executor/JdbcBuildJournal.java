package org.carball.autoindex.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.db.ConnectionProvider;
import org.carball.autoindex.model.decision.Decision;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Build journal in the {@code index_build_journal} table. The decision and
 * definition are stored as JSON so reconciliation can log a complete entry
 * after a restart.
 */
@Slf4j
public class JdbcBuildJournal implements BuildJournal {

    private static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS index_build_journal (
            decision_id     UUID PRIMARY KEY,
            status          VARCHAR(32) NOT NULL,
            started_at      TIMESTAMPTZ NOT NULL,
            detail          TEXT,
            decision_json   TEXT NOT NULL,
            definition_json TEXT NOT NULL
        )
    """;

    private static final String INSERT = """
        INSERT INTO index_build_journal (decision_id, status, started_at, detail, decision_json, definition_json)
        VALUES (?, ?, ?, ?, ?, ?)
        ON CONFLICT (decision_id) DO NOTHING
    """;

    private static final String UPDATE_STATUS = """
        UPDATE index_build_journal SET status = ?, detail = ? WHERE decision_id = ?
    """;

    private static final String DELETE = "DELETE FROM index_build_journal WHERE decision_id = ?";

    private static final String SELECT_OPEN = """
        SELECT status, started_at, detail, decision_json, definition_json
        FROM index_build_journal
        ORDER BY started_at
    """;

    private final ConnectionProvider connections;
    private final ObjectMapper objectMapper;

    public JdbcBuildJournal(ConnectionProvider connections) {
        this.connections = connections;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void createTableIfMissing() throws SQLException {
        try (Connection conn = connections.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
        }
    }

    @Override
    public void begin(BuildJournalEntry entry) {
        try (Connection conn = connections.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT)) {

            stmt.setObject(1, entry.decisionId());
            stmt.setString(2, entry.status().name());
            stmt.setTimestamp(3, Timestamp.from(entry.startedAt()));
            stmt.setString(4, entry.detail());
            stmt.setString(5, objectMapper.writeValueAsString(entry.decision()));
            stmt.setString(6, objectMapper.writeValueAsString(entry.definition()));
            stmt.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new BuildJournalException("Failed to journal build " + entry.decisionId(), e);
        }
    }

    @Override
    public void markNeedsCleanup(UUID decisionId, String detail) {
        try (Connection conn = connections.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_STATUS)) {

            stmt.setString(1, BuildJournalEntry.Status.NEEDS_CLEANUP.name());
            stmt.setString(2, detail);
            stmt.setObject(3, decisionId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new BuildJournalException("Failed to update journal entry " + decisionId, e);
        }
    }

    @Override
    public void complete(UUID decisionId) {
        try (Connection conn = connections.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE)) {

            stmt.setObject(1, decisionId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new BuildJournalException("Failed to close journal entry " + decisionId, e);
        }
    }

    @Override
    public List<BuildJournalEntry> openEntries() {
        List<BuildJournalEntry> entries = new ArrayList<>();

        try (Connection conn = connections.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_OPEN);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                try {
                    entries.add(new BuildJournalEntry(
                            objectMapper.readValue(rs.getString("decision_json"), Decision.class),
                            objectMapper.readValue(rs.getString("definition_json"), IndexDefinition.class),
                            BuildJournalEntry.Status.valueOf(rs.getString("status")),
                            rs.getTimestamp("started_at").toInstant(),
                            rs.getString("detail")));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    log.error("Unreadable build journal row, leaving it in place: {}", e.getMessage());
                }
            }
        } catch (SQLException e) {
            throw new BuildJournalException("Failed to read build journal", e);
        }

        return entries;
    }
}
