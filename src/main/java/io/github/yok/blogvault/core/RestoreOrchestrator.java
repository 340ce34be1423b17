package io.github.yok.blogvault.core;

import io.github.yok.blogvault.archive.BackupArchive;
import io.github.yok.blogvault.codec.DataFormat;
import io.github.yok.blogvault.codec.RowCodecFactory;
import io.github.yok.blogvault.config.BackupConfig;
import io.github.yok.blogvault.db.DbDialectHandler;
import io.github.yok.blogvault.db.OptionStore;
import io.github.yok.blogvault.error.BackupException;
import io.github.yok.blogvault.error.DecodeException;
import io.github.yok.blogvault.error.RestoreException;
import io.github.yok.blogvault.error.TransactionException;
import io.github.yok.blogvault.model.ColumnDescriptor;
import io.github.yok.blogvault.model.RowValue;
import io.github.yok.blogvault.registry.TableRegistry;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Restores a backup archive into the target database as one all-or-nothing transaction.
 *
 * <p>
 * Phases, in order: scan the archive, import every table that has an entry (registry order),
 * migrate legacy config rows, import legacy templates, commit. Any fatal error rolls the whole
 * transaction back, including table deletes and option rewrites already made. Duplicate-key
 * violations of single rows are counted and skipped.
 * </p>
 *
 * <p>
 * Scanning rules:
 * </p>
 * <ul>
 * <li>only {@code .bson} and {@code .json} entries are candidates, in any directory</li>
 * <li>{@code manifest.json}, {@code prelude.json} and {@code *.metadata.json} are ignored</li>
 * <li>the base name is resolved through {@link TableRegistry}; unresolved names are dropped</li>
 * <li>for two entries of one table, BSON beats JSON; within one format the first entry wins</li>
 * </ul>
 *
 * <p>
 * The caller owns the connection. Its auto-commit mode is restored on return.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RestoreOrchestrator {

    private static final Set<String> IGNORED_ENTRIES = Set.of("manifest.json", "prelude.json");
    private static final String METADATA_SUFFIX = ".metadata.json";

    private final DbDialectHandler dialect;
    private final TableRegistry registry;
    private final ColumnMetadataLoader metadataLoader;
    private final RowNormalizer normalizer;
    private final RowInserter inserter;
    private final LegacyConfigMigrator configMigrator;
    private final LegacyAssetImporter assetImporter;

    @Getter
    private RestoreState state = RestoreState.SCANNING;

    /**
     * Table entry selected during scanning.
     */
    @Getter
    @RequiredArgsConstructor
    static final class ScannedEntry {
        private final BackupArchive.Entry entry;
        private final DataFormat format;
    }

    /**
     * Creates an orchestrator wired with the default collaborators.
     *
     * @param dialect dialect of the target database
     * @param backupConfig archive layout settings
     */
    public RestoreOrchestrator(DbDialectHandler dialect, BackupConfig backupConfig) {
        this(dialect, TableRegistry.getDefault(), new ColumnMetadataLoader(dialect),
                new RowNormalizer(), new RowInserter(dialect),
                new LegacyConfigMigrator(new OptionStore(dialect),
                        backupConfig.getConfigOptionName()),
                new LegacyAssetImporter(new OptionStore(dialect),
                        backupConfig.getLegacyAssetDir()));
    }

    RestoreOrchestrator(DbDialectHandler dialect, TableRegistry registry,
            ColumnMetadataLoader metadataLoader, RowNormalizer normalizer, RowInserter inserter,
            LegacyConfigMigrator configMigrator, LegacyAssetImporter assetImporter) {
        this.dialect = dialect;
        this.registry = registry;
        this.metadataLoader = metadataLoader;
        this.normalizer = normalizer;
        this.inserter = inserter;
        this.configMigrator = configMigrator;
        this.assetImporter = assetImporter;
    }

    /**
     * Parses and restores an archive.
     *
     * @param conn JDBC connection to the target database
     * @param archiveBytes zip container bytes
     * @return per-table report of the committed restore
     * @throws BackupException if the archive is unreadable or the restore was rolled back
     */
    public RestoreReport restore(Connection conn, byte[] archiveBytes) throws BackupException {
        // Rejected before any transaction is opened
        BackupArchive archive = BackupArchive.read(archiveBytes);
        return restore(conn, archive);
    }

    /**
     * Restores an already parsed archive.
     *
     * @param conn JDBC connection to the target database
     * @param archive parsed archive
     * @return per-table report of the committed restore
     * @throws BackupException if the restore was rolled back
     */
    public RestoreReport restore(Connection conn, BackupArchive archive) throws BackupException {
        log.info("=== Restore started ({} archive entries) ===", archive.entries().size());
        state = RestoreState.SCANNING;
        Map<String, ScannedEntry> scanned = scan(archive);
        log.info("[restore] Tables found in archive: {}", scanned.keySet());

        boolean autoCommit = beginTransaction(conn);
        boolean foreignKeysDisabled = false;
        RestoreReport report = new RestoreReport();
        try {
            if (dialect.supportsDeferredForeignKeys()) {
                dialect.disableForeignKeyChecks(conn);
                foreignKeysDisabled = true;
                log.debug("[restore] Foreign key checks disabled");
            }

            state = RestoreState.IMPORTING;
            for (String table : registry.tables()) {
                ScannedEntry selected = scanned.get(table);
                if (selected != null) {
                    report.add(importTable(conn, table, selected));
                }
            }

            state = RestoreState.LEGACY_CONFIG_MIGRATION;
            report.getMigratedSections().addAll(configMigrator.migrate(conn));

            state = RestoreState.LEGACY_ASSET_IMPORT;
            report.getImportedTemplates().addAll(assetImporter.importTemplates(conn, archive));

            if (foreignKeysDisabled) {
                dialect.enableForeignKeyChecks(conn);
                foreignKeysDisabled = false;
            }
            commit(conn);
            state = RestoreState.COMMITTED;
        } catch (BackupException | SQLException | RuntimeException e) {
            rollback(conn, e);
            if (e instanceof BackupException) {
                throw (BackupException) e;
            }
            if (e instanceof SQLException) {
                throw new RestoreException("Restore failed: " + e.getMessage(), e);
            }
            throw (RuntimeException) e;
        } finally {
            if (foreignKeysDisabled) {
                reenableForeignKeys(conn);
            }
            restoreAutoCommit(conn, autoCommit);
        }

        report.logSummary();
        log.info("=== Restore finished: {} table(s), {} duplicate row(s) skipped ===",
                report.getTables().size(), report.totalDuplicates());
        return report;
    }

    /**
     * Selects one entry per canonical table.
     *
     * @param archive parsed archive
     * @return selected entries keyed by canonical table, in archive order
     */
    Map<String, ScannedEntry> scan(BackupArchive archive) {
        Map<String, ScannedEntry> selected = new LinkedHashMap<>();
        for (BackupArchive.Entry entry : archive.entries()) {
            String base = entry.baseName();
            if (IGNORED_ENTRIES.contains(base) || base.endsWith(METADATA_SUFFIX)) {
                continue;
            }
            Optional<DataFormat> format =
                    DataFormat.fromExtension(FilenameUtils.getExtension(base));
            if (format.isEmpty()) {
                continue;
            }
            Optional<String> table = registry.resolve(FilenameUtils.getBaseName(base));
            if (table.isEmpty()) {
                log.debug("[restore] Entry[{}] does not map to a known table; ignored",
                        entry.getName());
                continue;
            }
            ScannedEntry current = selected.get(table.get());
            if (current == null || format.get().preferredOver(current.getFormat())) {
                selected.put(table.get(), new ScannedEntry(entry, format.get()));
            } else {
                log.debug("[restore] Entry[{}] ignored; Table[{}] already taken by {}",
                        entry.getName(), table.get(), current.getEntry().getName());
            }
        }
        return selected;
    }

    private RestoreReport.TableResult importTable(Connection conn, String table,
            ScannedEntry selected) throws BackupException, SQLException {
        String entryName = selected.getEntry().getName();
        List<Map<String, RowValue>> rows;
        try {
            rows = RowCodecFactory.decoderFor(selected.getFormat())
                    .decode(selected.getEntry().getData());
        } catch (DecodeException e) {
            throw new DecodeException(
                    "Table[" + table + "] entry " + entryName + ": " + e.getMessage(), e);
        }

        Map<String, ColumnDescriptor> columns = metadataLoader.loadColumns(conn, table);
        List<Map<String, RowValue>> normalized = new ArrayList<>(rows.size());
        for (Map<String, RowValue> row : rows) {
            normalizer.normalize(table, row, columns).ifPresent(normalized::add);
        }

        int deleted = inserter.deleteAll(conn, table);
        log.debug("[restore] Table[{}] {} existing row(s) deleted", table, deleted);

        int inserted = 0;
        int duplicates = 0;
        for (int i = 0; i < normalized.size(); i++) {
            RowInserter.Outcome outcome;
            try {
                outcome = inserter.insert(conn, table, normalized.get(i), columns);
            } catch (SQLException e) {
                throw new RestoreException(String.format("insert row #%d into %s failed: %s",
                        i + 1, table, e.getMessage()), e);
            }
            if (outcome == RowInserter.Outcome.DUPLICATE) {
                duplicates++;
            } else {
                inserted++;
            }
        }
        if (duplicates > 0) {
            log.warn("[restore] Table[{}] {} duplicate row(s) skipped", table, duplicates);
        }
        log.info("[restore] Table[{}] entry={} decoded={} inserted={}", table, entryName,
                rows.size(), inserted);
        return new RestoreReport.TableResult(table, entryName, rows.size(), inserted, duplicates);
    }

    private boolean beginTransaction(Connection conn) throws TransactionException {
        try {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            return autoCommit;
        } catch (SQLException e) {
            throw new TransactionException("Failed to begin restore transaction", e);
        }
    }

    private void commit(Connection conn) throws TransactionException {
        try {
            conn.commit();
            log.info("[restore] Transaction committed");
        } catch (SQLException e) {
            throw new TransactionException("Failed to commit restore transaction", e);
        }
    }

    private void rollback(Connection conn, Exception cause) {
        log.warn("[restore] Rolling back in state {}: {}", state, cause.getMessage());
        try {
            conn.rollback();
            log.warn("[restore] Transaction rolled back due to error.");
        } catch (SQLException rollbackEx) {
            log.warn("[restore] Rollback failed: {}", rollbackEx.getMessage(), rollbackEx);
        }
        state = RestoreState.ROLLED_BACK;
    }

    private void reenableForeignKeys(Connection conn) {
        try {
            dialect.enableForeignKeyChecks(conn);
        } catch (SQLException e) {
            log.warn("[restore] Failed to re-enable foreign key checks: {}", e.getMessage(), e);
        }
    }

    private void restoreAutoCommit(Connection conn, boolean autoCommit) {
        try {
            conn.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("[restore] Failed to restore auto-commit: {}", e.getMessage(), e);
        }
    }
}
