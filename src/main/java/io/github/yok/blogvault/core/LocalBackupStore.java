package io.github.yok.blogvault.core;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

/**
 * Archive files kept in the local backup directory.
 *
 * <p>
 * Names passed to {@link #read(String)} and {@link #delete(List)} are reduced to their base name,
 * so only files directly inside the backup directory can be reached.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LocalBackupStore {

    private static final String ZIP_EXTENSION = "zip";

    private final File dir;
    private final DateTimeFormatter fileNameFormatter;
    private final Clock clock;

    /**
     * One stored archive.
     */
    @Getter
    @RequiredArgsConstructor
    public static class BackupFile {
        private final String name;
        private final long size;

        public String getSizeText() {
            return formatSize(size);
        }
    }

    public LocalBackupStore(String dir, String fileNamePattern) {
        this(new File(dir), fileNamePattern, Clock.systemDefaultZone());
    }

    LocalBackupStore(File dir, String fileNamePattern, Clock clock) {
        this.dir = dir;
        this.fileNameFormatter = DateTimeFormatter.ofPattern(fileNamePattern, Locale.ROOT);
        this.clock = clock;
    }

    /**
     * Writes an archive under a timestamped name.
     *
     * @param archive zip container bytes
     * @return written file
     * @throws IOException if the directory or file cannot be written
     */
    public File save(byte[] archive) throws IOException {
        FileUtils.forceMkdir(dir);
        File file = new File(dir, fileNameFormatter.format(LocalDateTime.now(clock)));
        FileUtils.writeByteArrayToFile(file, archive);
        log.info("Backup saved: {} ({})", file.getAbsolutePath(), formatSize(archive.length));
        return file;
    }

    /**
     * Lists stored archives, newest name first.
     *
     * @return stored {@code .zip} files; empty when the directory does not exist
     */
    public List<BackupFile> list() {
        File[] files = dir.listFiles((d, name) -> ZIP_EXTENSION
                .equalsIgnoreCase(FilenameUtils.getExtension(name)));
        List<BackupFile> out = new ArrayList<>();
        if (files == null) {
            return out;
        }
        Arrays.stream(files).filter(File::isFile)
                .sorted(Comparator.comparing(File::getName).reversed())
                .forEach(f -> out.add(new BackupFile(f.getName(), f.length())));
        return out;
    }

    /**
     * Reads a stored archive.
     *
     * @param name file name; directories are ignored
     * @return archive bytes
     * @throws IOException if the file does not exist or cannot be read
     */
    public byte[] read(String name) throws IOException {
        File file = resolve(name);
        if (!file.isFile()) {
            throw new FileNotFoundException("Backup not found: " + file.getName());
        }
        return FileUtils.readFileToByteArray(file);
    }

    /**
     * Deletes stored archives.
     *
     * @param names file names; directories are ignored
     * @return names that existed and were deleted
     * @throws IOException if an existing file cannot be deleted
     */
    public List<String> delete(List<String> names) throws IOException {
        List<String> deleted = new ArrayList<>();
        for (String name : names) {
            File file = resolve(name);
            if (!file.isFile()) {
                log.warn("Backup not found, nothing deleted: {}", file.getName());
                continue;
            }
            FileUtils.delete(file);
            deleted.add(file.getName());
            log.info("Backup deleted: {}", file.getName());
        }
        return deleted;
    }

    /**
     * Formats a byte size as {@code B}, {@code KB} or {@code MB}.
     *
     * @param bytes size in bytes
     * @return e.g. {@code 512 B}, {@code 1.50 KB}, {@code 2.00 MB}
     */
    public static String formatSize(long bytes) {
        if (bytes >= 1L << 20) {
            return String.format(Locale.ROOT, "%.2f MB", bytes / (double) (1L << 20));
        }
        if (bytes >= 1L << 10) {
            return String.format(Locale.ROOT, "%.2f KB", bytes / (double) (1L << 10));
        }
        return String.format(Locale.ROOT, "%d B", bytes);
    }

    private File resolve(String name) {
        return new File(dir, FilenameUtils.getName(name == null ? "" : name.trim()));
    }
}
