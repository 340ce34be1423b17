package io.github.yok.blogvault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code dbunit} section used when tables are read for export.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "dbunit")
@Data
public class DbUnitConfig {

    /**
     * Engine used when neither the driver class nor the JDBC URL identifies one.
     */
    private DataTypeFactoryMode dataTypeFactoryMode = DataTypeFactoryMode.MYSQL;

    /**
     * Whether empty strings are kept as-is rather than treated as missing.
     */
    private boolean allowEmptyFields = true;

    /**
     * JDBC fetch size for export queries.
     */
    private int fetchSize = 100;
}
