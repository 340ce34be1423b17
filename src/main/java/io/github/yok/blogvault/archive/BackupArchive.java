package io.github.yok.blogvault.archive;

import com.google.common.collect.ImmutableList;
import io.github.yok.blogvault.error.ArchiveFormatException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.apache.commons.io.IOUtils;

/**
 * Read-only view of a backup archive, fully loaded into memory.
 *
 * <p>
 * Entries keep their archive order. Directory entries are skipped. Entries are located through
 * the central directory, so an archive cut short before it is rejected.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class BackupArchive {

    private static final byte[] LOCAL_HEADER = {'P', 'K', 3, 4};
    private static final byte[] EMPTY_ARCHIVE = {'P', 'K', 5, 6};

    private final ImmutableList<Entry> entries;

    private BackupArchive(List<Entry> entries) {
        this.entries = ImmutableList.copyOf(entries);
    }

    /**
     * One file inside the archive.
     */
    @Getter
    @RequiredArgsConstructor
    public static final class Entry {
        // Path inside the archive as stored, forward slashes
        private final String name;
        private final byte[] data;

        /**
         * Returns the file name without directories, lower-cased.
         *
         * @return lower-case base name
         */
        public String baseName() {
            int slash = name.lastIndexOf('/');
            return name.substring(slash + 1).toLowerCase(Locale.ROOT);
        }

        /**
         * Returns the entry content decoded as UTF-8.
         *
         * @return text content
         */
        public String text() {
            return new String(data, StandardCharsets.UTF_8);
        }
    }

    /**
     * Parses an archive. Nothing is written anywhere.
     *
     * @param data zip container bytes
     * @return archive view
     * @throws ArchiveFormatException if the bytes are not a readable zip container
     */
    public static BackupArchive read(byte[] data) throws ArchiveFormatException {
        if (data == null || data.length < 4 || !(startsWith(data, LOCAL_HEADER)
                || startsWith(data, EMPTY_ARCHIVE))) {
            throw new ArchiveFormatException("Not a zip archive");
        }
        List<Entry> entries = new ArrayList<>();
        try (ZipFile zip = ZipFile.builder()
                .setSeekableByteChannel(new SeekableInMemoryByteChannel(data))
                .setCharset(StandardCharsets.UTF_8).get()) {
            Enumeration<ZipArchiveEntry> zipEntries = zip.getEntriesInPhysicalOrder();
            while (zipEntries.hasMoreElements()) {
                ZipArchiveEntry entry = zipEntries.nextElement();
                if (entry.isDirectory()) {
                    continue;
                }
                String name = entry.getName().replace('\\', '/');
                try (InputStream in = zip.getInputStream(entry)) {
                    entries.add(new Entry(name, IOUtils.toByteArray(in)));
                }
            }
        } catch (ZipException e) {
            throw new ArchiveFormatException("Corrupt zip archive: " + e.getMessage(), e);
        } catch (IOException | IllegalArgumentException e) {
            throw new ArchiveFormatException("Unreadable zip archive: " + e.getMessage(), e);
        }
        log.debug("Archive opened: {} entr(ies)", entries.size());
        return new BackupArchive(entries);
    }

    public ImmutableList<Entry> entries() {
        return entries;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
