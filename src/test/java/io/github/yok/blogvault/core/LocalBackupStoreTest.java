package io.github.yok.blogvault.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.File;
import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalBackupStoreTest {

    private static final String PATTERN = "'backup-'yyyy-MM-dd'T'HH-mm-ss'.zip'";

    @TempDir
    Path tempDir;

    private File dir;
    private LocalBackupStore store;

    @BeforeEach
    void setUp() {
        dir = tempDir.resolve("backups").toFile();
        store = new LocalBackupStore(dir, PATTERN,
                Clock.fixed(Instant.parse("2024-03-04T05:06:07Z"), ZoneOffset.UTC));
    }

    @Test
    void save_正常ケース_日時付きのファイル名で保存されること() throws Exception {
        File saved = store.save(new byte[] {1, 2, 3});

        assertEquals("backup-2024-03-04T05-06-07.zip", saved.getName());
        assertEquals(dir, saved.getParentFile());
        assertArrayEquals(new byte[] {1, 2, 3}, Files.readAllBytes(saved.toPath()));
    }

    @Test
    void list_正常ケース_zipのみが名前の降順でサイズ付きで返ること() throws Exception {
        Files.createDirectories(dir.toPath());
        Files.write(dir.toPath().resolve("backup-2024-01-01T00-00-00.zip"), new byte[2048]);
        Files.write(dir.toPath().resolve("backup-2024-02-01T00-00-00.zip"), new byte[10]);
        Files.write(dir.toPath().resolve("notes.txt"),
                "x".getBytes(StandardCharsets.UTF_8));

        List<LocalBackupStore.BackupFile> files = store.list();

        assertEquals(2, files.size());
        assertEquals("backup-2024-02-01T00-00-00.zip", files.get(0).getName());
        assertEquals("10 B", files.get(0).getSizeText());
        assertEquals("2.00 KB", files.get(1).getSizeText());
    }

    @Test
    void list_正常ケース_ディレクトリが存在しない場合は空であること() {
        assertTrue(store.list().isEmpty());
    }

    @Test
    void read_正常ケース_パス指定はベース名に丸められること() throws Exception {
        File saved = store.save(new byte[] {7});

        assertArrayEquals(new byte[] {7}, store.read("../../" + saved.getName()));
    }

    @Test
    void read_異常ケース_存在しない名前は例外となること() {
        assertThrows(FileNotFoundException.class, () -> store.read("missing.zip"));
    }

    @Test
    void delete_正常ケース_存在したファイルのみが削除結果に含まれること() throws Exception {
        File saved = store.save(new byte[] {1});

        List<String> deleted = store.delete(List.of(saved.getName(), "missing.zip"));

        assertEquals(List.of(saved.getName()), deleted);
        assertFalse(saved.exists());
    }

    @Test
    void formatSize_正常ケース_単位が切り替わること() {
        assertEquals("0 B", LocalBackupStore.formatSize(0));
        assertEquals("1023 B", LocalBackupStore.formatSize(1023));
        assertEquals("1.00 KB", LocalBackupStore.formatSize(1024));
        assertEquals("1.50 KB", LocalBackupStore.formatSize(1536));
        assertEquals("1.00 MB", LocalBackupStore.formatSize(1L << 20));
        assertEquals("2.50 MB", LocalBackupStore.formatSize((5L << 20) / 2));
    }
}
