package io.github.yok.blogvault.db;

import io.github.yok.blogvault.model.ColumnCategory;
import io.github.yok.blogvault.model.ColumnDescriptor;
import io.github.yok.blogvault.model.RowValue;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;

/**
 * PostgreSQL dialect.
 *
 * <p>
 * Deferrable constraints are deferred for the restore transaction. A failed statement aborts the
 * whole transaction on this engine, so inserts run under per-statement savepoints.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class PostgresqlDialectHandler implements DbDialectHandler {

    private final DbUnitConfigFactory configFactory;

    private final IDataTypeFactory dataTypeFactory = new PostgresqlDataTypeFactory();

    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET TIME ZONE 'UTC'");
        }
    }

    @Override
    public DatabaseConnection createDbUnitConnection(Connection jdbc)
            throws DatabaseUnitException {
        DatabaseConnection dbConn = new DatabaseConnection(jdbc);
        configFactory.configure(dbConn.getConfig(), dataTypeFactory, "\"?\"");
        return dbConn;
    }

    @Override
    public String engineName() {
        return "postgresql";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public boolean supportsDeferredForeignKeys() {
        return true;
    }

    @Override
    public void disableForeignKeyChecks(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET CONSTRAINTS ALL DEFERRED");
        }
    }

    @Override
    public void enableForeignKeyChecks(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET CONSTRAINTS ALL IMMEDIATE");
        }
    }

    /**
     * Binds JSON-category text as {@link Types#OTHER} so the server casts it to json/jsonb.
     */
    @Override
    public void bindValue(PreparedStatement ps, int index, RowValue value,
            ColumnDescriptor column) throws SQLException {
        if (value.getKind() == RowValue.Kind.TEXT
                && column.getCategory() == ColumnCategory.JSON) {
            ps.setObject(index, value.asText(), Types.OTHER);
            return;
        }
        DbDialectHandler.super.bindValue(ps, index, value, column);
    }

    @Override
    public boolean usesStatementSavepoints() {
        return true;
    }
}
