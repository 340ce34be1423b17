package io.github.yok.blogvault.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Outcome of a committed restore: per-table row counts plus migration results.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RestoreReport {

    /**
     * Counts for one table.
     */
    @Getter
    @RequiredArgsConstructor
    public static class TableResult {
        private final String table;
        // Archive entry the rows came from
        private final String entry;
        private final int decoded;
        private final int inserted;
        private final int duplicates;
    }

    private final Map<String, TableResult> tables = new LinkedHashMap<>();
    @Getter
    private final List<String> migratedSections = new ArrayList<>();
    @Getter
    private final List<String> importedTemplates = new ArrayList<>();

    void add(TableResult result) {
        tables.put(result.getTable(), result);
    }

    /**
     * Returns per-table results in import order.
     *
     * @return unmodifiable map keyed by canonical table
     */
    public Map<String, TableResult> getTables() {
        return Collections.unmodifiableMap(tables);
    }

    /**
     * Returns the total number of rows skipped as duplicates.
     *
     * @return duplicate count
     */
    public int totalDuplicates() {
        return tables.values().stream().mapToInt(TableResult::getDuplicates).sum();
    }

    /**
     * Logs the aligned per-table summary.
     */
    void logSummary() {
        log.info("===== Restore Summary =====");
        int maxNameLen = tables.keySet().stream().mapToInt(String::length).max().orElse(0);
        int maxCountDigits = tables.values().stream()
                .mapToInt(r -> String.valueOf(r.getDecoded()).length()).max().orElse(0);
        String fmt = "  Table[%-" + maxNameLen + "s] Decoded=%" + maxCountDigits
                + "d Inserted=%" + maxCountDigits + "d Duplicates=%" + maxCountDigits + "d";
        tables.values().forEach(r -> log.info(String.format(fmt, r.getTable(), r.getDecoded(),
                r.getInserted(), r.getDuplicates())));
        log.info("  Config sections migrated: {}", migratedSections);
        log.info("  Templates imported: {}", importedTemplates);
    }
}
