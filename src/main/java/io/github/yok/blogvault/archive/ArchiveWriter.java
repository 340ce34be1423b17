package io.github.yok.blogvault.archive;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds a backup archive in memory, one entry at a time.
 *
 * @author Yasuharu.Okawauchi
 */
public class ArchiveWriter implements Closeable {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ZipOutputStream zip = new ZipOutputStream(buffer, StandardCharsets.UTF_8);
    private boolean finished;

    /**
     * Adds a file entry.
     *
     * @param path path inside the archive
     * @param data entry content
     * @throws IOException if the entry cannot be written
     */
    public void putEntry(String path, byte[] data) throws IOException {
        zip.putNextEntry(new ZipEntry(path));
        zip.write(data);
        zip.closeEntry();
    }

    /**
     * Completes the archive and returns its bytes. Further entries are rejected.
     *
     * @return zip container bytes
     * @throws IOException if the central directory cannot be written
     */
    public byte[] finish() throws IOException {
        if (!finished) {
            zip.finish();
            finished = true;
        }
        return buffer.toByteArray();
    }

    @Override
    public void close() throws IOException {
        zip.close();
    }
}
