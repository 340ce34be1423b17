package io.github.yok.blogvault.model;

import java.util.Locale;

/**
 * Coercion category of a target column, derived from its engine type name.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ColumnCategory {
    TIME, JSON, TEXT, OPAQUE;

    /**
     * Classifies a database type name. Checks run in order: time-like, JSON, text-like.
     *
     * @param typeName engine type name such as {@code DATETIME(3)} or {@code varchar}
     * @return category, {@link #OPAQUE} when nothing matches or the name is {@code null}
     */
    public static ColumnCategory fromTypeName(String typeName) {
        if (typeName == null) {
            return OPAQUE;
        }
        String t = typeName.toLowerCase(Locale.ROOT);
        if (t.contains("time") || t.contains("date") || t.contains("year")) {
            return TIME;
        }
        if (t.contains("json")) {
            return JSON;
        }
        if (t.contains("char") || t.contains("text") || t.contains("clob") || t.contains("enum")
                || t.contains("set")) {
            return TEXT;
        }
        return OPAQUE;
    }

    /**
     * Returns whether nested values and byte blobs become text for this category.
     *
     * @return {@code true} for JSON and TEXT
     */
    public boolean isTextual() {
        return this == JSON || this == TEXT;
    }
}
