package io.github.yok.blogvault.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Reads the root {@code data-path} property and derives the local backup directory from it.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base directory for all files written by the tool
    private String dataPath;

    /**
     * Returns the directory where local backups are stored.
     *
     * @return {@code <data-path>/backups}
     * @throws IllegalStateException if {@code data-path} is not configured
     */
    public String getBackup() {
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        return dataPath.endsWith("/") ? dataPath + "backups" : dataPath + "/backups";
    }
}
