package io.github.yok.blogvault.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;

/**
 * MySQL dialect: backtick quoting, session-level foreign-key switch, error 1062 duplicates.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class MySqlDialectHandler implements DbDialectHandler {

    // MySQL/MariaDB "Duplicate entry" error number
    static final int ER_DUP_ENTRY = 1062;

    private final DbUnitConfigFactory configFactory;

    private final IDataTypeFactory dataTypeFactory = new MySqlDataTypeFactory();

    /**
     * Pins the session to UTC and utf8mb4 so time values and 4-byte characters round-trip.
     *
     * @param connection JDBC connection
     * @throws SQLException if a session statement fails
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET time_zone = '+00:00'");
            st.execute("SET NAMES utf8mb4");
        }
    }

    @Override
    public DatabaseConnection createDbUnitConnection(Connection jdbc)
            throws DatabaseUnitException {
        DatabaseConnection dbConn = new DatabaseConnection(jdbc);
        configFactory.configure(dbConn.getConfig(), dataTypeFactory, "`?`");
        return dbConn;
    }

    @Override
    public String engineName() {
        return "mysql";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    @Override
    public boolean supportsDeferredForeignKeys() {
        return true;
    }

    @Override
    public void disableForeignKeyChecks(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET FOREIGN_KEY_CHECKS = 0");
        }
        log.debug("FOREIGN_KEY_CHECKS disabled");
    }

    @Override
    public void enableForeignKeyChecks(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET FOREIGN_KEY_CHECKS = 1");
        }
        log.debug("FOREIGN_KEY_CHECKS enabled");
    }

    @Override
    public boolean isDuplicateKeyViolation(SQLException e) {
        if (e.getErrorCode() == ER_DUP_ENTRY) {
            return true;
        }
        return DbDialectHandler.super.isDuplicateKeyViolation(e);
    }
}
