package io.github.yok.blogvault.archive;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Informational provenance entry written at {@code <root>/manifest.json}.
 *
 * <p>
 * Restore never requires it; unknown fields are tolerated when it is read back.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"format", "version", "engine", "created_at", "tables"})
public class BackupManifest {
    // Format identifier, e.g. mx-core-go-bson
    private String format;
    // Format version
    private int version;
    // Source database engine, e.g. mysql
    private String engine;
    // RFC 3339 instant of the export
    @JsonProperty("created_at")
    private String createdAt;
    // Tables actually written, in registry order
    private List<String> tables = new ArrayList<>();
}
