package io.github.yok.blogvault.core;

import io.github.yok.blogvault.db.DbDialectHandler;
import io.github.yok.blogvault.error.SchemaIntrospectionException;
import io.github.yok.blogvault.model.ColumnDescriptor;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Introspects the live columns of a target table and classifies them for coercion.
 *
 * <p>
 * Results are never cached across calls: the target schema may differ from the one that produced
 * the archive, and only the current target matters.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class ColumnMetadataLoader {

    private final DbDialectHandler dialect;

    /**
     * Loads column descriptors keyed by lower-cased column name.
     *
     * @param conn JDBC connection (inside the restore transaction)
     * @param table canonical table name
     * @return columns in ordinal order
     * @throws SchemaIntrospectionException if metadata cannot be read or the table has no columns
     */
    public Map<String, ColumnDescriptor> loadColumns(Connection conn, String table)
            throws SchemaIntrospectionException {
        try {
            DatabaseMetaData meta = conn.getMetaData();
            String lookup = dialect.metadataTableName(table);
            Map<String, ColumnDescriptor> columns = readColumns(conn, meta, lookup);
            if (columns.isEmpty()) {
                columns = readColumns(conn, meta, lookup.toUpperCase(Locale.ROOT));
            }
            if (columns.isEmpty()) {
                throw new SchemaIntrospectionException(
                        "Table[" + table + "] has no visible columns in the target database");
            }
            log.debug("Table[{}] columns: {}", table, columns.keySet());
            return columns;
        } catch (SQLException e) {
            throw new SchemaIntrospectionException(
                    "Failed to read columns of table " + table + ": " + e.getMessage(), e);
        }
    }

    private Map<String, ColumnDescriptor> readColumns(Connection conn, DatabaseMetaData meta,
            String table) throws SQLException {
        Map<String, ColumnDescriptor> columns = new LinkedHashMap<>();
        try (ResultSet rs = meta.getColumns(conn.getCatalog(), conn.getSchema(), table, null)) {
            while (rs.next()) {
                String name = rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT);
                String typeName = rs.getString("TYPE_NAME");
                boolean autoIncrement = "YES".equalsIgnoreCase(rs.getString("IS_AUTOINCREMENT"));
                columns.putIfAbsent(name, ColumnDescriptor.of(name, typeName, autoIncrement));
            }
        }
        return columns;
    }
}
