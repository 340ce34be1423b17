package io.github.yok.blogvault.config;

/**
 * Database engines supported by the dialect handlers.
 *
 * @author Yasuharu.Okawauchi
 */
public enum DataTypeFactoryMode {
    MYSQL, POSTGRESQL, H2
}
