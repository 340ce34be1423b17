package io.github.yok.blogvault.db;

import io.github.yok.blogvault.config.ConnectionConfig;
import io.github.yok.blogvault.config.DataTypeFactoryMode;
import io.github.yok.blogvault.config.DbUnitConfig;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates the {@link DbDialectHandler} for the configured connection.
 *
 * <p>
 * The engine is resolved from {@code connection.driver-class} first, then from the JDBC URL, and
 * finally from {@code dbunit.data-type-factory-mode}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbDialectHandlerFactory {

    // Fallback engine selection
    private final DbUnitConfig dbUnitConfig;

    // Applies common settings to DBUnit's DatabaseConfig
    private final DbUnitConfigFactory configFactory;

    /**
     * Creates a handler for the given connection settings.
     *
     * @param connection connection settings
     * @return dialect handler
     */
    public DbDialectHandler create(ConnectionConfig connection) {
        DataTypeFactoryMode mode = resolveMode(connection);
        log.debug("Dialect resolved: {} (url={})", mode, connection.getUrl());
        return create(mode);
    }

    /**
     * Creates a handler for an explicit engine.
     *
     * @param mode engine
     * @return dialect handler
     */
    public DbDialectHandler create(DataTypeFactoryMode mode) {
        switch (mode) {
            case MYSQL:
                return new MySqlDialectHandler(configFactory);
            case POSTGRESQL:
                return new PostgresqlDialectHandler(configFactory);
            case H2:
                return new H2DialectHandler(configFactory);
            default:
                throw new IllegalArgumentException("Unsupported dialect: " + mode);
        }
    }

    DataTypeFactoryMode resolveMode(ConnectionConfig connection) {
        DataTypeFactoryMode fromDriverClass =
                resolveModeFromDriverClass(connection.getDriverClass());
        if (fromDriverClass != null) {
            return fromDriverClass;
        }
        DataTypeFactoryMode fromUrl = resolveModeFromJdbcUrl(connection.getUrl());
        if (fromUrl != null) {
            return fromUrl;
        }
        return dbUnitConfig.getDataTypeFactoryMode();
    }

    private DataTypeFactoryMode resolveModeFromDriverClass(String driverClass) {
        String normalized = normalizeLower(driverClass);
        if (normalized == null) {
            return null;
        }
        if ("org.postgresql.driver".equals(normalized)) {
            return DataTypeFactoryMode.POSTGRESQL;
        }
        if ("com.mysql.cj.jdbc.driver".equals(normalized)
                || "com.mysql.jdbc.driver".equals(normalized)
                || "org.mariadb.jdbc.driver".equals(normalized)) {
            return DataTypeFactoryMode.MYSQL;
        }
        if ("org.h2.driver".equals(normalized)) {
            return DataTypeFactoryMode.H2;
        }
        return null;
    }

    private DataTypeFactoryMode resolveModeFromJdbcUrl(String jdbcUrl) {
        String normalized = normalizeLower(jdbcUrl);
        if (normalized == null) {
            return null;
        }
        if (normalized.startsWith("jdbc:postgresql:")) {
            return DataTypeFactoryMode.POSTGRESQL;
        }
        if (normalized.startsWith("jdbc:mysql:") || normalized.startsWith("jdbc:mariadb:")) {
            return DataTypeFactoryMode.MYSQL;
        }
        if (normalized.startsWith("jdbc:h2:")) {
            return DataTypeFactoryMode.H2;
        }
        return null;
    }

    private String normalizeLower(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
