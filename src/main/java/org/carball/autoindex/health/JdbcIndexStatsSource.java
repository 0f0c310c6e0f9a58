package org.carball.autoindex.health;

import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.db.ConnectionProvider;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Samples index usage and size from {@code pg_stat_user_indexes}. Bloat comes
 * from {@code pgstatindex} when the pgstattuple extension is installed and is
 * reported as zero otherwise.
 */
@Slf4j
public class JdbcIndexStatsSource implements IndexStatsSource {

    private static final String INDEX_USAGE = """
        SELECT s.indexrelid, s.indexrelname, s.relname, s.idx_scan,
               pg_relation_size(s.indexrelid) AS size_bytes,
               am.amname
        FROM pg_stat_user_indexes s
        JOIN pg_class i ON i.oid = s.indexrelid
        JOIN pg_am am ON am.oid = i.relam
        WHERE s.schemaname = ?
        ORDER BY s.indexrelname
    """;

    private static final String HAS_PGSTATTUPLE = "SELECT 1 FROM pg_extension WHERE extname = 'pgstattuple'";

    private static final String LEAF_DENSITY = "SELECT avg_leaf_density FROM pgstatindex(?::oid::regclass)";

    private final ConnectionProvider connections;
    private final String schemaName;

    public JdbcIndexStatsSource(ConnectionProvider connections, String schemaName) {
        this.connections = connections;
        this.schemaName = schemaName;
    }

    @Override
    public List<ObservedIndexStats> collect() throws SQLException {
        List<ObservedIndexStats> results = new ArrayList<>();

        try (Connection conn = connections.getConnection()) {
            boolean bloatAvailable = hasPgStatTuple(conn);

            try (PreparedStatement stmt = conn.prepareStatement(INDEX_USAGE)) {
                stmt.setString(1, schemaName);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        long oid = rs.getLong("indexrelid");
                        boolean btree = "btree".equals(rs.getString("amname"));
                        double bloat = bloatAvailable && btree ? bloatRatio(conn, oid) : 0.0;
                        results.add(new ObservedIndexStats(
                                rs.getString("indexrelname"),
                                rs.getString("relname"),
                                rs.getLong("size_bytes"),
                                bloat,
                                rs.getLong("idx_scan")));
                    }
                }
            }
        }

        log.debug("Sampled {} indexes in schema {}", results.size(), schemaName);
        return results;
    }

    private static boolean hasPgStatTuple(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(HAS_PGSTATTUPLE);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next();
        }
    }

    /**
     * Share of leaf pages that is empty space, 0.0 for a freshly built index.
     */
    private static double bloatRatio(Connection conn, long indexOid) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(LEAF_DENSITY)) {
            stmt.setLong(1, indexOid);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return 0.0;
                }
                double density = rs.getDouble(1);
                // NaN for empty indexes
                return Double.isNaN(density) ? 0.0 : Math.max(0.0, Math.min(1.0, (100.0 - density) / 100.0));
            }
        }
    }
}
