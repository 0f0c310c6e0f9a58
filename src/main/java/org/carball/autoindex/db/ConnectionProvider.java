package org.carball.autoindex.db;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Source of JDBC connections for the PostgreSQL-backed collaborators. Callers
 * close every connection they obtain.
 */
@FunctionalInterface
public interface ConnectionProvider {

    Connection getConnection() throws SQLException;

    static ConnectionProvider fromUrl(String connectionString) {
        return () -> DriverManager.getConnection(connectionString);
    }

    static ConnectionProvider fromDataSource(DataSource dataSource) {
        return dataSource::getConnection;
    }
}
