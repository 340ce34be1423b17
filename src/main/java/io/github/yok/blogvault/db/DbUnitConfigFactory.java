package io.github.yok.blogvault.db;

import io.github.yok.blogvault.config.DbUnitConfig;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Applies application-wide settings to DBUnit's {@link DatabaseConfig} in one place.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbUnitConfigFactory {

    // Externalized DBUnit settings
    private final DbUnitConfig props;

    @Autowired
    public DbUnitConfigFactory(DbUnitConfig props) {
        this.props = props;
    }

    /**
     * Creates a factory with default settings, for use outside the Spring container.
     */
    public DbUnitConfigFactory() {
        this.props = new DbUnitConfig();
    }

    /**
     * Applies settings to the specified {@link DatabaseConfig}.
     *
     * @param cfg DBUnit configuration
     * @param dataTypeFactory vendor-specific datatype factory
     * @param escapePattern identifier escape pattern, e.g. {@code "?"} with the dialect quote
     */
    public void configure(DatabaseConfig cfg, IDataTypeFactory dataTypeFactory,
            String escapePattern) {
        // 1) Set the data type factory
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dataTypeFactory);
        log.debug("DBUnit: DataTypeFactory set to {}", dataTypeFactory.getClass().getSimpleName());

        // 2) Escape identifiers in dialect style
        cfg.setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, escapePattern);
        log.debug("DBUnit: escape pattern = {}", escapePattern);

        // 3) Empty strings
        cfg.setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, props.isAllowEmptyFields());
        log.debug("DBUnit: allow empty fields = {}", props.isAllowEmptyFields());

        // 4) Fetch size for export reads
        cfg.setProperty(DatabaseConfig.PROPERTY_FETCH_SIZE, props.getFetchSize());
        log.debug("DBUnit: fetch size = {}", props.getFetchSize());
    }
}
