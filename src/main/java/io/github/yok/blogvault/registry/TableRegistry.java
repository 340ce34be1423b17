package io.github.yok.blogvault.registry;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Catalog of canonical tables and resolver for legacy table names.
 *
 * <p>
 * Resolution is permissive: names that are neither canonical nor a known alias resolve to
 * {@link Optional#empty()} and are expected to be dropped by the caller.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class TableRegistry {

    private static final TableRegistry DEFAULT = new TableRegistry(AliasTables.TABLES);

    private final ImmutableList<String> tables;
    private final ImmutableSet<String> tableSet;

    TableRegistry(List<String> tables) {
        this.tables = ImmutableList.copyOf(tables);
        this.tableSet = ImmutableSet.copyOf(tables);
    }

    /**
     * Returns the registry built from the canonical catalog.
     *
     * @return shared registry
     */
    public static TableRegistry getDefault() {
        return DEFAULT;
    }

    /**
     * Returns canonical tables in registry order.
     *
     * @return immutable list of table names
     */
    public ImmutableList<String> tables() {
        return tables;
    }

    /**
     * Resolves a raw name (entry base name or legacy collection name) to its canonical table.
     *
     * @param name raw name, may be {@code null}
     * @return canonical table name, or empty if unresolved
     */
    public Optional<String> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        String canonical = AliasTables.TABLE_ALIASES.getOrDefault(key, key);
        return tableSet.contains(canonical) ? Optional.of(canonical) : Optional.empty();
    }
}
