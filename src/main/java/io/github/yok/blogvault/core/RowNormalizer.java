package io.github.yok.blogvault.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import io.github.yok.blogvault.model.ColumnCategory;
import io.github.yok.blogvault.model.ColumnDescriptor;
import io.github.yok.blogvault.model.RowValue;
import io.github.yok.blogvault.registry.AliasTables;
import io.github.yok.blogvault.util.SnakeCaseUtil;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps decoded archive rows onto the live columns of a target table.
 *
 * <p>
 * This is where all format drift is absorbed: legacy field names are resolved to columns, values
 * are coerced by column category, and a few table-specific rewrites are applied. Fields whose
 * column does not exist in the target are dropped, never reported as errors.
 * </p>
 *
 * <p>
 * <strong>Column name resolution</strong>, first match wins:
 * </p>
 * <ol>
 * <li>per-table alias ({@code notes.password} to {@code password_hash})</li>
 * <li>global alias ({@code _id}, {@code created}, {@code refId} ...)</li>
 * <li>automatic camelCase to snake_case</li>
 * <li>verbatim lower case</li>
 * </ol>
 * <p>
 * The version marker {@code __v} is always dropped, and the legacy document id {@code _id} is
 * dropped for {@code options} and for tables whose {@code id} column auto-increments.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RowNormalizer {

    static final String MODIFIED_COLUMN = "updated_at";
    static final String VERSION_FIELD = "__v";
    static final String LEGACY_ID_FIELD = "_id";
    static final String COUNT_FIELD = "count";

    // table -> column holding a reference type that is canonicalized
    private static final ImmutableMap<String, String> REF_TYPE_COLUMNS =
            ImmutableMap.of("comments", "ref_type", "slug_trackers", "type");

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Normalizes one decoded row.
     *
     * @param table canonical table name
     * @param raw decoded row
     * @param columns live columns of the target table
     * @return normalized row, or empty when nothing survives
     */
    public Optional<Map<String, RowValue>> normalize(String table, Map<String, RowValue> raw,
            Map<String, ColumnDescriptor> columns) {
        if (raw == null || raw.isEmpty()) {
            return Optional.empty();
        }
        ColumnDescriptor idColumn = columns.get("id");
        boolean autoIncrementId = idColumn != null && idColumn.isAutoIncrement();

        Map<String, RowValue> result = new LinkedHashMap<>();
        for (Map.Entry<String, RowValue> field : raw.entrySet()) {
            String column = resolveColumnName(table, field.getKey(), autoIncrementId);
            if (column == null) {
                continue;
            }
            if (COUNT_FIELD.equals(column)) {
                splitCounters(table, field.getValue(), result, columns);
                continue;
            }
            ColumnDescriptor descriptor = columns.get(column);
            if (descriptor == null) {
                log.debug("Table[{}] field[{}] dropped: no column {}", table, field.getKey(),
                        column);
                continue;
            }
            coerce(table, descriptor, field.getValue())
                    .ifPresent(value -> result.put(column, value));
        }
        if (result.containsKey(MODIFIED_COLUMN)) {
            result.put(MODIFIED_COLUMN, RowValue.nullValue());
        }
        return result.isEmpty() ? Optional.empty() : Optional.of(result);
    }

    /**
     * Resolves a raw field name to a column name.
     *
     * @param table canonical table name
     * @param name raw field name
     * @param autoIncrementId whether the target {@code id} column auto-increments
     * @return column name, or {@code null} when the field is always dropped
     */
    public static String resolveColumnName(String table, String name, boolean autoIncrementId) {
        String raw = name == null ? "" : name.trim();
        String lower = raw.toLowerCase(Locale.ROOT);
        if (lower.isEmpty() || VERSION_FIELD.equals(lower)) {
            return null;
        }
        if (LEGACY_ID_FIELD.equals(lower) && ("options".equals(table) || autoIncrementId)) {
            return null;
        }
        String snake = SnakeCaseUtil.toSnakeCase(raw);
        Map<String, String> tableAliases = AliasTables.COLUMN_ALIASES_BY_TABLE.get(table);
        if (tableAliases != null) {
            for (String key : new String[] {lower, snake}) {
                if (tableAliases.containsKey(key)) {
                    return tableAliases.get(key);
                }
            }
        }
        for (String key : new String[] {lower, snake}) {
            if (AliasTables.COLUMN_ALIASES.containsKey(key)) {
                return AliasTables.COLUMN_ALIASES.get(key);
            }
        }
        return snake.isEmpty() ? lower : snake;
    }

    /**
     * Canonicalizes a reference type such as {@code Posts} to {@code post}.
     *
     * @param raw reference type
     * @return canonical term, or the lower-cased input when unknown
     */
    public static String canonicalRefType(String raw) {
        String key = raw.trim().toLowerCase(Locale.ROOT);
        return AliasTables.REF_TYPE_ALIASES.getOrDefault(key, key);
    }

    Optional<RowValue> coerce(String table, ColumnDescriptor column, RowValue value) {
        if (value.isNull()) {
            return Optional.of(value);
        }
        if (column.getCategory() == ColumnCategory.TIME) {
            return coerceTime(table, column.getName(), value);
        }
        if (column.getName().equals(REF_TYPE_COLUMNS.get(table))
                && value.getKind() == RowValue.Kind.TEXT) {
            return Optional.of(RowValue.of(canonicalRefType(value.asText())));
        }
        switch (value.getKind()) {
            case MAP:
            case LIST:
                if (!column.getCategory().isTextual()) {
                    log.debug("Table[{}] column[{}] nested value dropped for {} column", table,
                            column.getName(), column.getTypeName());
                    return Optional.empty();
                }
                return toJsonText(table, column.getName(), value);
            case BYTES:
                return column.getCategory().isTextual()
                        ? Optional.of(RowValue.of(
                                new String(value.asBytes(), StandardCharsets.UTF_8)))
                        : Optional.of(value);
            default:
                return Optional.of(value);
        }
    }

    private Optional<RowValue> coerceTime(String table, String column, RowValue value) {
        if (MODIFIED_COLUMN.equals(column)) {
            return Optional.of(RowValue.nullValue());
        }
        Optional<Instant> instant = TimeValueNormalizer.toInstant(value);
        if (instant.isPresent()) {
            return Optional.of(RowValue.of(instant.get()));
        }
        if (TimeValueNormalizer.isZeroLike(value)) {
            return Optional.of(RowValue.nullValue());
        }
        log.debug("Table[{}] column[{}] unparseable time {} dropped", table, column, value);
        return Optional.empty();
    }

    private Optional<RowValue> toJsonText(String table, String column, RowValue value) {
        try {
            return Optional.of(RowValue.of(mapper.writeValueAsString(value.toPlain())));
        } catch (JsonProcessingException e) {
            log.warn("Table[{}] column[{}] could not be serialized: {}", table, column,
                    e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void splitCounters(String table, RowValue value, Map<String, RowValue> row,
            Map<String, ColumnDescriptor> columns) {
        if (value.getKind() != RowValue.Kind.MAP) {
            return;
        }
        Map<String, RowValue> counts = value.asMap();
        putCounter(table, counts, row, columns.get("read_count"), "read", "reads");
        putCounter(table, counts, row, columns.get("like_count"), "like", "likes");
    }

    private void putCounter(String table, Map<String, RowValue> counts, Map<String, RowValue> row,
            ColumnDescriptor target, String key, String pluralKey) {
        if (target == null) {
            return;
        }
        RowValue count = counts.containsKey(key) ? counts.get(key) : counts.get(pluralKey);
        if (count == null) {
            return;
        }
        coerce(table, target, count).ifPresent(v -> row.put(target.getName(), v));
    }
}
