package io.github.yok.blogvault.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code backup} section: archive layout constants and local store settings.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "backup")
@Data
public class BackupConfig {
    // Top-level directory inside the archive
    private String rootDir = "mx-space-go";
    // Manifest format identifier
    private String format = "mx-core-go-bson";
    // Manifest format version
    private int formatVersion = 1;
    // Local backup directory; blank falls back to <data-path>/backups
    private String dir;
    // Archive directory holding legacy template files
    private String legacyAssetDir = "backup_data/assets/email-template";
    // Option row holding the unified configuration blob
    private String configOptionName = "configs";
    // DateTimeFormatter pattern of local backup file names
    private String fileNamePattern = "'backup-'yyyy-MM-dd'T'HH-mm-ss'.zip'";

    /**
     * Returns the archive directory holding table entries.
     *
     * @return {@code <root-dir>/db}
     */
    public String getDbDir() {
        return rootDir + "/db";
    }

    /**
     * Returns the archive path of the manifest.
     *
     * @return {@code <root-dir>/manifest.json}
     */
    public String getManifestPath() {
        return rootDir + "/manifest.json";
    }

    /**
     * Resolves the local backup directory.
     *
     * @param paths path settings used when {@code dir} is blank
     * @return backup directory path
     */
    public String resolveDir(PathsConfig paths) {
        return StringUtils.isNotBlank(dir) ? dir : paths.getBackup();
    }
}
