package org.carball.autoindex.executor;

import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.db.ConnectionProvider;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Optional;

/**
 * Issues index DDL against PostgreSQL. Builds use CREATE INDEX CONCURRENTLY,
 * which cannot run inside a transaction block, so every statement runs on an
 * autocommit connection with its own statement and lock timeouts.
 */
@Slf4j
public class PostgresIndexDdlClient implements IndexDdlClient {

    private static final String INDEX_VALIDITY = """
        SELECT ix.indisvalid
        FROM pg_class i
        JOIN pg_namespace n ON n.oid = i.relnamespace
        JOIN pg_index ix ON ix.indexrelid = i.oid
        WHERE n.nspname = ? AND i.relname = ?
    """;

    private final ConnectionProvider connections;
    private final Duration lockTimeout;

    public PostgresIndexDdlClient(ConnectionProvider connections) {
        this(connections, Duration.ofSeconds(10));
    }

    public PostgresIndexDdlClient(ConnectionProvider connections, Duration lockTimeout) {
        this.connections = connections;
        this.lockTimeout = lockTimeout;
    }

    @Override
    public void createIndex(IndexDefinition definition, Duration timeout) throws MutationException {
        String sql = definition.createSql();
        log.info("Executing: {}", sql);

        try (Connection conn = connections.getConnection();
             Statement stmt = conn.createStatement()) {

            conn.setAutoCommit(true);
            stmt.execute("SET statement_timeout = " + Math.max(1, timeout.toMillis()));
            stmt.execute("SET lock_timeout = " + Math.max(1, lockTimeout.toMillis()));
            stmt.setQueryTimeout((int) Math.max(1, (timeout.toMillis() + 999) / 1000));
            stmt.execute(sql);
        } catch (SQLException e) {
            throw SqlErrorClassifier.toMutationException("CREATE INDEX " + definition.indexName(), e);
        }
    }

    @Override
    public Optional<Boolean> indexValidity(String schemaName, String indexName) throws SQLException {
        try (Connection conn = connections.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INDEX_VALIDITY)) {

            stmt.setString(1, schemaName);
            stmt.setString(2, indexName);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getBoolean(1)) : Optional.empty();
            }
        }
    }

    @Override
    public void dropIndex(String schemaName, String indexName) throws SQLException {
        String sql = IndexDefinition.dropSql(schemaName, indexName);
        log.info("Executing: {}", sql);

        try (Connection conn = connections.getConnection();
             Statement stmt = conn.createStatement()) {
            conn.setAutoCommit(true);
            stmt.execute("SET lock_timeout = " + Math.max(1, lockTimeout.toMillis()));
            stmt.execute(sql);
        }
    }
}
