package io.github.yok.blogvault.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.RequiredArgsConstructor;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;

/**
 * H2 dialect for embedded use and tests.
 *
 * <p>
 * Foreign-key checking is never toggled: {@code SET REFERENTIAL_INTEGRITY} commits the open
 * transaction.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class H2DialectHandler implements DbDialectHandler {

    private final DbUnitConfigFactory configFactory;

    private final IDataTypeFactory dataTypeFactory = new H2DataTypeFactory();

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
        return "h2";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public boolean supportsDeferredForeignKeys() {
        return false;
    }
}
