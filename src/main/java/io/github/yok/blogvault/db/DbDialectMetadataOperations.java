package io.github.yok.blogvault.db;

/**
 * Metadata operations for each database dialect.
 */
public interface DbDialectMetadataOperations {

    /**
     * Returns the form of a table name that the engine's metadata lookup expects.
     *
     * @param table canonical lower-case table name
     * @return metadata lookup name
     */
    default String metadataTableName(String table) {
        return table;
    }
}
