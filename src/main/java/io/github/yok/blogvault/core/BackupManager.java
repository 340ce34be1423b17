package io.github.yok.blogvault.core;

import io.github.yok.blogvault.config.BackupConfig;
import io.github.yok.blogvault.config.ConnectionConfig;
import io.github.yok.blogvault.config.PathsConfig;
import io.github.yok.blogvault.db.DbDialectHandler;
import io.github.yok.blogvault.db.DbDialectHandlerFactory;
import io.github.yok.blogvault.error.BackupException;
import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Runs export and restore against the configured database and manages local archives.
 *
 * <p>
 * Each operation opens its own JDBC connection and closes it before returning.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BackupManager {

    private final ConnectionConfig connectionConfig;
    private final BackupConfig backupConfig;
    private final DbDialectHandlerFactory dialectFactory;
    private final LocalBackupStore store;

    public BackupManager(ConnectionConfig connectionConfig, BackupConfig backupConfig,
            PathsConfig pathsConfig, DbDialectHandlerFactory dialectFactory) {
        this(connectionConfig, backupConfig, dialectFactory,
                new LocalBackupStore(backupConfig.resolveDir(pathsConfig),
                        backupConfig.getFileNamePattern()));
    }

    BackupManager(ConnectionConfig connectionConfig, BackupConfig backupConfig,
            DbDialectHandlerFactory dialectFactory, LocalBackupStore store) {
        this.connectionConfig = connectionConfig;
        this.backupConfig = backupConfig;
        this.dialectFactory = dialectFactory;
        this.store = store;
    }

    /**
     * Exports the database into a new local archive.
     *
     * @return written archive file
     * @throws BackupException if the export fails
     * @throws IOException if the archive cannot be stored
     */
    public File export() throws BackupException, IOException {
        DbDialectHandler dialect = dialectFactory.create(connectionConfig);
        ArchiveExporter.ExportResult result;
        try (Connection conn = openConnection(dialect)) {
            result = new ArchiveExporter(dialect, backupConfig).export(conn);
        } catch (SQLException e) {
            throw new BackupException("Failed to close connection: " + e.getMessage(), e);
        }
        return store.save(result.getArchive());
    }

    /**
     * Restores an archive given as a file path or as a name inside the backup directory.
     *
     * @param source file path or stored archive name
     * @return report of the committed restore
     * @throws BackupException if the restore was rolled back
     * @throws IOException if the archive cannot be read
     */
    public RestoreReport restore(String source) throws BackupException, IOException {
        if (StringUtils.isBlank(source)) {
            throw new IllegalArgumentException("Archive to restore is not specified");
        }
        File file = new File(source);
        byte[] archive = file.isFile() ? FileUtils.readFileToByteArray(file) : store.read(source);
        log.info("Restoring archive {} ({})", source, LocalBackupStore.formatSize(archive.length));

        DbDialectHandler dialect = dialectFactory.create(connectionConfig);
        try (Connection conn = openConnection(dialect)) {
            return new RestoreOrchestrator(dialect, backupConfig).restore(conn, archive);
        } catch (SQLException e) {
            throw new BackupException("Failed to close connection: " + e.getMessage(), e);
        }
    }

    public List<LocalBackupStore.BackupFile> list() {
        return store.list();
    }

    public List<String> delete(List<String> names) throws IOException {
        return store.delete(names);
    }

    Connection openConnection(DbDialectHandler dialect) throws BackupException {
        try {
            if (StringUtils.isNotBlank(connectionConfig.getDriverClass())) {
                Class.forName(connectionConfig.getDriverClass());
            }
            Connection conn = DriverManager.getConnection(connectionConfig.getUrl(),
                    connectionConfig.getUser(), connectionConfig.getPassword());
            try {
                dialect.prepareConnection(conn);
            } catch (SQLException e) {
                conn.close();
                throw e;
            }
            log.debug("Connected to {} ({})", connectionConfig.getUrl(), dialect.engineName());
            return conn;
        } catch (ClassNotFoundException e) {
            throw new BackupException(
                    "JDBC driver not found: " + connectionConfig.getDriverClass(), e);
        } catch (SQLException e) {
            throw new BackupException("Failed to connect to " + connectionConfig.getUrl() + ": "
                    + e.getMessage(), e);
        }
    }
}
