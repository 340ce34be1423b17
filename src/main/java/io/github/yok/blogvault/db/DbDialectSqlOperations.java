package io.github.yok.blogvault.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * SQL grammar and capability operations for each database dialect.
 */
public interface DbDialectSqlOperations {

    /**
     * Quotes identifier in dialect style.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Returns whether foreign-key checking can be suspended inside an open transaction.
     *
     * @return true when {@link #disableForeignKeyChecks} has an effect
     */
    boolean supportsDeferredForeignKeys();

    /**
     * Suspends foreign-key checking for the current session or transaction.
     *
     * @param connection JDBC connection
     * @throws SQLException if the statement fails
     */
    default void disableForeignKeyChecks(Connection connection) throws SQLException {}

    /**
     * Re-enables foreign-key checking.
     *
     * @param connection JDBC connection
     * @throws SQLException if the statement fails
     */
    default void enableForeignKeyChecks(Connection connection) throws SQLException {}

    /**
     * Returns whether a failed statement aborts the whole transaction, so each insert must run
     * under its own savepoint.
     *
     * @return true when inserts need a savepoint
     */
    default boolean usesStatementSavepoints() {
        return false;
    }

    /**
     * Determines whether an insert failure is a unique-constraint or duplicate-key violation.
     *
     * @param e failure raised by an insert
     * @return true for duplicate-key violations
     */
    default boolean isDuplicateKeyViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if ("23505".equals(cur.getSQLState())) {
                return true;
            }
            String msg = cur.getMessage() == null ? "" : cur.getMessage().toLowerCase(Locale.ROOT);
            if (msg.contains("duplicate entry") || msg.contains("duplicate key")
                    || msg.contains("unique constraint")) {
                return true;
            }
        }
        return false;
    }
}
