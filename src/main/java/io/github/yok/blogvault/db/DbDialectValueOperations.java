package io.github.yok.blogvault.db;

import io.github.yok.blogvault.model.ColumnDescriptor;
import io.github.yok.blogvault.model.RowValue;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;

/**
 * Value binding operations for each database dialect.
 */
public interface DbDialectValueOperations {

    /**
     * Binds a normalized value to an insert parameter.
     *
     * @param ps prepared insert statement
     * @param index 1-based parameter index
     * @param value normalized value; nested values must already be serialized
     * @param column target column
     * @throws SQLException if binding fails
     */
    default void bindValue(PreparedStatement ps, int index, RowValue value,
            ColumnDescriptor column) throws SQLException {
        switch (value.getKind()) {
            case NULL:
                ps.setNull(index, Types.NULL);
                break;
            case BOOL:
                ps.setBoolean(index, value.asBoolean());
                break;
            case INT:
                ps.setLong(index, value.asLong());
                break;
            case FLOAT:
                ps.setDouble(index, value.asDouble());
                break;
            case TEXT:
                ps.setString(index, value.asText());
                break;
            case BYTES:
                ps.setBytes(index, value.asBytes());
                break;
            case TIME:
                ps.setTimestamp(index, Timestamp.from(value.asInstant()));
                break;
            default:
                throw new SQLException("Unbindable " + value.getKind() + " value for column "
                        + column.getName());
        }
    }
}
