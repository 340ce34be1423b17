package io.github.yok.blogvault.core;

import io.github.yok.blogvault.db.DbDialectHandler;
import io.github.yok.blogvault.model.ColumnDescriptor;
import io.github.yok.blogvault.model.RowValue;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Inserts normalized rows one at a time and classifies failures.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class RowInserter {

    /**
     * Result of a single insert.
     */
    public enum Outcome {
        INSERTED, DUPLICATE
    }

    private final DbDialectHandler dialect;

    /**
     * Deletes every row of a table.
     *
     * @param conn JDBC connection
     * @param table canonical table name
     * @return number of deleted rows
     * @throws SQLException if the delete fails
     */
    public int deleteAll(Connection conn, String table) throws SQLException {
        try (PreparedStatement ps =
                conn.prepareStatement("DELETE FROM " + dialect.quoteIdentifier(table))) {
            return ps.executeUpdate();
        }
    }

    /**
     * Inserts one row. A duplicate-key violation is reported as {@link Outcome#DUPLICATE} and
     * leaves the transaction usable; every other failure is rethrown.
     *
     * @param conn JDBC connection inside the restore transaction
     * @param table canonical table name
     * @param row normalized row; every key is a column of {@code columns}
     * @param columns live columns of the table
     * @return insert outcome
     * @throws SQLException for any failure other than a duplicate key
     */
    public Outcome insert(Connection conn, String table, Map<String, RowValue> row,
            Map<String, ColumnDescriptor> columns) throws SQLException {
        List<String> names = new ArrayList<>(row.keySet());
        String sql = "INSERT INTO " + dialect.quoteIdentifier(table) + " ("
                + names.stream().map(dialect::quoteIdentifier).collect(Collectors.joining(", "))
                + ") VALUES ("
                + names.stream().map(n -> "?").collect(Collectors.joining(", ")) + ")";

        Savepoint savepoint = dialect.usesStatementSavepoints() ? conn.setSavepoint() : null;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < names.size(); i++) {
                String name = names.get(i);
                dialect.bindValue(ps, i + 1, row.get(name), columns.get(name));
            }
            ps.executeUpdate();
        } catch (SQLException e) {
            if (savepoint != null) {
                conn.rollback(savepoint);
            }
            if (dialect.isDuplicateKeyViolation(e)) {
                log.debug("Table[{}] duplicate row skipped: {}", table, e.getMessage());
                return Outcome.DUPLICATE;
            }
            throw e;
        }
        if (savepoint != null) {
            conn.releaseSavepoint(savepoint);
        }
        return Outcome.INSERTED;
    }
}
