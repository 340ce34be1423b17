package io.github.yok.blogvault.codec;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Wire formats of per-table archive entries.
 *
 * <p>
 * Enum order is the preference order when an archive carries the same table in more than one
 * format: {@link #BSON} wins over {@link #JSON}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum DataFormat {

    // Concatenated length-prefixed binary documents. Export always writes this.
    BSON("bson"),

    // Legacy fallback: one JSON array of row objects.
    JSON("json");

    // Recognized extensions, lower-case, without dot
    private final Set<String> extensions;

    DataFormat(String... exts) {
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext extension without dot, case-insensitive
     * @return {@code true} if the extension matches
     */
    public boolean matches(String ext) {
        return ext != null && extensions.contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the primary extension used when writing an entry.
     *
     * @return extension without dot
     */
    public String extension() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns {@code true} when this format is preferred over {@code other} for the same table.
     *
     * @param other competing format
     * @return whether this format wins
     */
    public boolean preferredOver(DataFormat other) {
        return ordinal() < other.ordinal();
    }

    /**
     * Looks up the format for a file extension.
     *
     * @param ext extension without dot
     * @return matching format, or empty
     */
    public static Optional<DataFormat> fromExtension(String ext) {
        return Arrays.stream(values()).filter(f -> f.matches(ext)).findFirst();
    }
}
