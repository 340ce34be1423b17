package io.github.yok.blogvault.db;

import java.sql.Connection;
import java.sql.SQLException;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;

/**
 * Connection/session related operations for each database dialect.
 */
public interface DbDialectConnectionOperations {

    /**
     * Applies dialect-specific session settings (time zone, character set).
     *
     * @param connection JDBC connection to initialize
     * @throws SQLException if session initialization fails
     */
    void prepareConnection(Connection connection) throws SQLException;

    /**
     * Wraps a JDBC connection in a DBUnit connection configured for the dialect.
     *
     * @param connection JDBC connection; ownership stays with the caller
     * @return configured DBUnit connection
     * @throws DatabaseUnitException if DBUnit rejects the connection
     */
    DatabaseConnection createDbUnitConnection(Connection connection) throws DatabaseUnitException;

    /**
     * Returns the engine name recorded in the archive manifest.
     *
     * @return lower-case engine name
     */
    String engineName();
}
