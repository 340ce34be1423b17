package io.github.yok.blogvault.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.blogvault.archive.ArchiveWriter;
import io.github.yok.blogvault.archive.BackupManifest;
import io.github.yok.blogvault.codec.BsonRowCodec;
import io.github.yok.blogvault.codec.DataFormat;
import io.github.yok.blogvault.codec.RowCodecFactory;
import io.github.yok.blogvault.config.BackupConfig;
import io.github.yok.blogvault.db.DbDialectHandler;
import io.github.yok.blogvault.error.BackupException;
import io.github.yok.blogvault.model.RowValue;
import io.github.yok.blogvault.registry.TableRegistry;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Dumps every canonical table into a single backup archive.
 *
 * <p>
 * Tables are read in registry order through a DBUnit query table and written as
 * {@code <root>/db/<table>.bson}. A table that fails to query or encode is logged and skipped; it
 * is then absent from the manifest, which is written last and lists exactly the tables written.
 * The export is not wrapped in a transaction.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ArchiveExporter {

    private final DbDialectHandler dialect;
    private final BackupConfig backupConfig;
    private final TableRegistry registry;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Result of one export run.
     */
    @Getter
    @RequiredArgsConstructor
    public static class ExportResult {
        // Zip container bytes
        private final byte[] archive;
        private final BackupManifest manifest;
        // Row count per written table, registry order
        private final Map<String, Integer> rowCounts;
    }

    public ArchiveExporter(DbDialectHandler dialect, BackupConfig backupConfig) {
        this(dialect, backupConfig, TableRegistry.getDefault(), Clock.systemUTC());
    }

    ArchiveExporter(DbDialectHandler dialect, BackupConfig backupConfig, TableRegistry registry,
            Clock clock) {
        this.dialect = dialect;
        this.backupConfig = backupConfig;
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Exports all canonical tables.
     *
     * @param conn JDBC connection to the source database; not closed
     * @return archive bytes with its manifest and per-table counts
     * @throws BackupException if the DBUnit connection or the archive itself cannot be built
     */
    public ExportResult export(Connection conn) throws BackupException {
        log.info("=== Export started ({}) ===", dialect.engineName());
        DatabaseConnection dbConn;
        try {
            dbConn = dialect.createDbUnitConnection(conn);
        } catch (DatabaseUnitException e) {
            throw new BackupException("Failed to open DBUnit connection: " + e.getMessage(), e);
        }

        BsonRowCodec codec = RowCodecFactory.encoder();
        Map<String, Integer> rowCounts = new LinkedHashMap<>();
        try (ArchiveWriter writer = new ArchiveWriter()) {
            for (String table : registry.tables()) {
                List<Map<String, RowValue>> rows;
                try {
                    rows = readTable(dbConn, table);
                } catch (DataSetException | SQLException | RuntimeException e) {
                    log.warn("[export] Table[{}] skipped: {}", table, e.getMessage());
                    log.debug("[export] Table[{}] failure detail", table, e);
                    continue;
                }
                byte[] payload;
                try {
                    payload = codec.encode(rows);
                } catch (RuntimeException e) {
                    log.warn("[export] Table[{}] could not be encoded, skipped: {}", table,
                            e.getMessage());
                    continue;
                }
                writer.putEntry(entryPath(table), payload);
                rowCounts.put(table, rows.size());
                log.info("[export] Table[{}] rows={} bytes={}", table, rows.size(),
                        payload.length);
            }

            BackupManifest manifest = new BackupManifest();
            manifest.setFormat(backupConfig.getFormat());
            manifest.setVersion(backupConfig.getFormatVersion());
            manifest.setEngine(dialect.engineName());
            manifest.setCreatedAt(DateTimeFormatter.ISO_INSTANT
                    .format(clock.instant().truncatedTo(ChronoUnit.SECONDS)));
            manifest.setTables(new ArrayList<>(rowCounts.keySet()));
            writer.putEntry(backupConfig.getManifestPath(), mapper.writeValueAsBytes(manifest));

            byte[] archive = writer.finish();
            logTableSummary(rowCounts);
            log.info("=== Export finished: {} table(s), {} byte(s) ===", rowCounts.size(),
                    archive.length);
            return new ExportResult(archive, manifest, rowCounts);
        } catch (JsonProcessingException e) {
            throw new BackupException("Failed to serialize manifest: " + e.getOriginalMessage(),
                    e);
        } catch (IOException e) {
            throw new BackupException("Failed to write archive: " + e.getMessage(), e);
        }
    }

    /**
     * Returns the archive path of a table entry.
     *
     * @param table canonical table name
     * @return {@code <root>/db/<table>.bson}
     */
    String entryPath(String table) {
        return backupConfig.getDbDir() + "/" + table + "." + DataFormat.BSON.extension();
    }

    private List<Map<String, RowValue>> readTable(DatabaseConnection dbConn, String table)
            throws DataSetException, SQLException {
        ITable data = dbConn.createQueryTable(table,
                "SELECT * FROM " + dialect.quoteIdentifier(table));
        Column[] columns = data.getTableMetaData().getColumns();
        List<Map<String, RowValue>> rows = new ArrayList<>(data.getRowCount());
        for (int i = 0; i < data.getRowCount(); i++) {
            Map<String, RowValue> row = new LinkedHashMap<>();
            for (Column column : columns) {
                String name = column.getColumnName();
                row.put(name.toLowerCase(Locale.ROOT),
                        RowValue.fromJdbc(data.getValue(i, name)));
            }
            rows.add(row);
        }
        return rows;
    }

    private void logTableSummary(Map<String, Integer> tableCountMap) {
        log.info("===== Export Summary =====");
        int maxNameLen = tableCountMap.keySet().stream().mapToInt(String::length).max().orElse(0);
        int maxCountDigits =
                tableCountMap.values().stream().map(count -> String.valueOf(count).length())
                        .mapToInt(Integer::intValue).max().orElse(0);
        String fmt = "  Table[%-" + maxNameLen + "s] Total=%" + maxCountDigits + "d";
        tableCountMap.forEach((table, count) -> log.info(String.format(fmt, table, count)));
    }
}
