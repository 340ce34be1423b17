package io.github.yok.blogvault.model;

import lombok.Value;

/**
 * Live-schema description of one target column, built per table per restore run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ColumnDescriptor {
    // Lower-cased column name
    String name;
    // Engine type name as reported by JDBC metadata
    String typeName;
    // Coercion category derived from typeName
    ColumnCategory category;
    // IS_AUTOINCREMENT flag
    boolean autoIncrement;

    /**
     * Builds a descriptor and classifies its type name.
     *
     * @param name lower-cased column name
     * @param typeName engine type name
     * @param autoIncrement whether the column is auto-incrementing
     * @return descriptor
     */
    public static ColumnDescriptor of(String name, String typeName, boolean autoIncrement) {
        return new ColumnDescriptor(name, typeName, ColumnCategory.fromTypeName(typeName),
                autoIncrement);
    }
}
