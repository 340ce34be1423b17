package io.github.yok.blogvault.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Key/value access to the {@code options} table on a caller-managed connection.
 *
 * <p>
 * No method commits; all writes belong to the caller's transaction.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class OptionStore {

    static final String TABLE = "options";

    private final DbDialectHandler dialect;

    /**
     * One named option row.
     */
    @Value
    public static class Option {
        String name;
        String value;
    }

    /**
     * Lists all options.
     *
     * @param conn JDBC connection
     * @return options in name order
     * @throws SQLException if the query fails
     */
    public List<Option> list(Connection conn) throws SQLException {
        String sql = "SELECT " + q("name") + ", " + q("value") + " FROM " + q(TABLE)
                + " ORDER BY " + q("name");
        List<Option> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new Option(rs.getString(1), rs.getString(2)));
            }
        }
        return out;
    }

    /**
     * Reads one option value.
     *
     * @param conn JDBC connection
     * @param name option name
     * @return value, or empty when the row is missing or its value is NULL
     * @throws SQLException if the query fails
     */
    public Optional<String> find(Connection conn, String name) throws SQLException {
        String sql = "SELECT " + q("value") + " FROM " + q(TABLE) + " WHERE " + q("name") + " = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    /**
     * Replaces an option: deletes any row with the name, then inserts the new value.
     *
     * @param conn JDBC connection
     * @param name option name
     * @param value new value
     * @throws SQLException if a statement fails
     */
    public void replace(Connection conn, String name, String value) throws SQLException {
        String delete = "DELETE FROM " + q(TABLE) + " WHERE " + q("name") + " = ?";
        try (PreparedStatement ps = conn.prepareStatement(delete)) {
            ps.setString(1, name);
            ps.executeUpdate();
        }
        String insert = "INSERT INTO " + q(TABLE) + " (" + q("name") + ", " + q("value")
                + ") VALUES (?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(insert)) {
            ps.setString(1, name);
            ps.setString(2, value);
            ps.executeUpdate();
        }
        log.debug("Option[{}] replaced ({} chars)", name, value.length());
    }

    private String q(String identifier) {
        return dialect.quoteIdentifier(identifier);
    }
}
