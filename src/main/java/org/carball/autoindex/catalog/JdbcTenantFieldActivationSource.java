package org.carball.autoindex.catalog;

import org.carball.autoindex.db.ConnectionProvider;
import org.carball.autoindex.model.tenant.ActiveField;
import org.carball.autoindex.model.tenant.TenantFieldActivation;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.Set;

/**
 * Reads field activation from the {@code tenant_field_activation} table. The
 * version is the highest change sequence number recorded for the tenant.
 */
public class JdbcTenantFieldActivationSource implements TenantFieldActivationSource {

    private static final String ACTIVE_FIELDS = """
        SELECT table_name, field_name, is_enabled, version
        FROM tenant_field_activation
        WHERE tenant_id = ?
    """;

    private final ConnectionProvider connections;

    public JdbcTenantFieldActivationSource(ConnectionProvider connections) {
        this.connections = connections;
    }

    @Override
    public TenantFieldActivation activationFor(String tenantId) throws SQLException {
        Set<ActiveField> fields = new HashSet<>();
        long version = 0;

        try (Connection conn = connections.getConnection();
             PreparedStatement stmt = conn.prepareStatement(ACTIVE_FIELDS)) {

            stmt.setString(1, tenantId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    version = Math.max(version, rs.getLong("version"));
                    if (rs.getBoolean("is_enabled")) {
                        fields.add(new ActiveField(rs.getString("table_name"), rs.getString("field_name")));
                    }
                }
            }
        }

        return new TenantFieldActivation(tenantId, fields, version);
    }
}
