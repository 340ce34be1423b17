package io.github.yok.blogvault.core;

import io.github.yok.blogvault.archive.BackupArchive;
import io.github.yok.blogvault.db.OptionStore;
import io.github.yok.blogvault.registry.AliasTables;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Restores e-mail templates that legacy archives shipped as standalone files.
 *
 * <p>
 * Entries under the legacy asset directory whose file name is a known template become option rows
 * ({@code owner.template.ejs} to {@code email_template_owner} and so on). Blank files are ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LegacyAssetImporter {

    private final OptionStore optionStore;
    // Lower-case directory prefix ending with "/"
    private final String assetPrefix;

    public LegacyAssetImporter(OptionStore optionStore, String legacyAssetDir) {
        this.optionStore = optionStore;
        String dir = legacyAssetDir.replace('\\', '/').toLowerCase(Locale.ROOT);
        this.assetPrefix = dir.endsWith("/") ? dir : dir + "/";
    }

    /**
     * Imports every recognized template found in the archive.
     *
     * @param conn JDBC connection inside the restore transaction
     * @param archive source archive
     * @return option names written, in archive order
     * @throws SQLException if an option row cannot be written
     */
    public List<String> importTemplates(Connection conn, BackupArchive archive)
            throws SQLException {
        List<String> imported = new ArrayList<>();
        for (BackupArchive.Entry entry : archive.entries()) {
            String path = entry.getName().replace('\\', '/').toLowerCase(Locale.ROOT);
            if (!path.startsWith(assetPrefix)) {
                continue;
            }
            String optionName = AliasTables.LEGACY_TEMPLATE_OPTIONS.get(entry.baseName());
            if (optionName == null) {
                continue;
            }
            String content = entry.text().trim();
            if (content.isEmpty()) {
                log.info("[restore] Template[{}] is blank; skipped", entry.getName());
                continue;
            }
            optionStore.replace(conn, optionName, content);
            imported.add(optionName);
            log.info("[restore] Template[{}] -> Option[{}]", entry.getName(), optionName);
        }
        return imported;
    }
}
