package io.github.yok.blogvault;

import io.github.yok.blogvault.config.BackupConfig;
import io.github.yok.blogvault.config.ConnectionConfig;
import io.github.yok.blogvault.config.PathsConfig;
import io.github.yok.blogvault.core.BackupManager;
import io.github.yok.blogvault.core.LocalBackupStore;
import io.github.yok.blogvault.core.RestoreReport;
import io.github.yok.blogvault.db.DbDialectHandlerFactory;
import io.github.yok.blogvault.util.ErrorHandler;
import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the application entry point.
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --export} or {@code -e} exports the database into a new archive in the backup
 * directory.</li>
 * <li>{@code --restore <file>} or {@code -r <file>} restores an archive, given as a path or as a
 * name inside the backup directory.</li>
 * <li>{@code --list} or {@code -l} lists stored archives. This is the default mode.</li>
 * <li>{@code --delete <a,b>} or {@code -D <a,b>} deletes stored archives.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 * @see BackupManager
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final PathsConfig pathsConfig;
    private final ConnectionConfig connectionConfig;
    private final BackupConfig backupConfig;
    private final DbDialectHandlerFactory dialectFactory;

    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        if (context != null) {
            System.exit(SpringApplication.exit(context));
        }
    }

    /**
     * Parses arguments and runs the selected operation.
     *
     * @param args command-line arguments
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String mode = null;
        String archive = null;
        List<String> names = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--export":
                case "-e":
                    mode = "export";
                    break;
                case "--restore":
                case "-r":
                    mode = "restore";
                    archive = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--list":
                case "-l":
                    mode = "list";
                    break;
                case "--delete":
                case "-D":
                    mode = "delete";
                    if (i + 1 < args.length) {
                        names = Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(s -> !s.isEmpty()).collect(Collectors.toList());
                    }
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (mode == null) {
            mode = "list";
        }
        if ("restore".equals(mode) && (archive == null || archive.isEmpty())) {
            exitCode = ErrorHandler.EXIT_FAILURE;
            ErrorHandler.errorAndExit("Archive is required in restore mode.");
            return;
        }
        if ("delete".equals(mode) && names.isEmpty()) {
            exitCode = ErrorHandler.EXIT_FAILURE;
            ErrorHandler.errorAndExit("Backup names are required in delete mode.");
            return;
        }
        log.info("Mode: {}", mode);

        BackupManager manager =
                new BackupManager(connectionConfig, backupConfig, pathsConfig, dialectFactory);
        try {
            switch (mode) {
                case "export": {
                    File file = manager.export();
                    log.info("Export completed: {}", file.getAbsolutePath());
                    break;
                }
                case "restore": {
                    RestoreReport report = manager.restore(archive);
                    log.info("Restore completed: {} table(s), {} duplicate row(s) skipped",
                            report.getTables().size(), report.totalDuplicates());
                    break;
                }
                case "delete": {
                    List<String> deleted = manager.delete(names);
                    log.info("Deleted {} of {} backup(s): {}", deleted.size(), names.size(),
                            deleted);
                    break;
                }
                default: {
                    List<LocalBackupStore.BackupFile> files = manager.list();
                    log.info("Stored backups: {}", files.size());
                    files.forEach(f -> log.info("  {}  {}", f.getName(), f.getSizeText()));
                }
            }
        } catch (Exception e) {
            log.error("Fatal error occurred (mode={}): {}", mode, e.getMessage(), e);
            exitCode = ErrorHandler.exitStatus(e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
