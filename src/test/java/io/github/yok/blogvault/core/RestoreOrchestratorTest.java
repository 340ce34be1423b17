package io.github.yok.blogvault.core;

import static io.github.yok.blogvault.support.H2TestSupport.archive;
import static io.github.yok.blogvault.support.H2TestSupport.bson;
import static io.github.yok.blogvault.support.H2TestSupport.column;
import static io.github.yok.blogvault.support.H2TestSupport.count;
import static io.github.yok.blogvault.support.H2TestSupport.row;
import static io.github.yok.blogvault.support.H2TestSupport.utf8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.blogvault.archive.BackupArchive;
import io.github.yok.blogvault.codec.RowCodecFactory;
import io.github.yok.blogvault.db.DbDialectHandler;
import io.github.yok.blogvault.error.ArchiveFormatException;
import io.github.yok.blogvault.error.DecodeException;
import io.github.yok.blogvault.error.RestoreException;
import io.github.yok.blogvault.model.RowValue;
import io.github.yok.blogvault.support.H2TestSupport;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RestoreOrchestratorTest {

    private static final String DB = "mx-space-go/db/";
    private static final String TEMPLATE_DIR = "backup_data/assets/email-template/";

    private Connection conn;
    private RestoreOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws SQLException {
        conn = H2TestSupport.openWithSchema();
        orchestrator =
                new RestoreOrchestrator(H2TestSupport.dialect(), H2TestSupport.backupConfig());
    }

    @AfterEach
    void tearDown() throws SQLException {
        conn.close();
    }

    @Test
    void restore_正常ケース_投稿3件とコメント0件が復元されること() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put(DB + "posts.bson",
                bson(row("_id", "5f0000000000000000000001", "title", "一つ目", "slug", "first",
                        "text", "本文1", "created",
                        RowValue.of(Instant.parse("2020-01-01T00:00:00Z"))),
                        row("_id", "5f0000000000000000000002", "title", "二つ目", "slug", "second",
                                "text", "本文2"),
                        row("_id", "5f0000000000000000000003", "title", "三つ目", "slug", "third",
                                "text", "本文3")));
        entries.put(DB + "comments.bson", new byte[0]);

        RestoreReport report = orchestrator.restore(conn, archive(entries));

        assertEquals(RestoreState.COMMITTED, orchestrator.getState());
        assertEquals(3, count(conn, "posts"));
        assertEquals(0, count(conn, "comments"));
        assertEquals(List.of("一つ目", "二つ目", "三つ目"), column(conn, "posts", "title"));
        assertEquals(List.of("first", "second", "third"), column(conn, "posts", "slug"));
        assertEquals(List.of("本文1", "本文2", "本文3"), column(conn, "posts", "text"));
        assertEquals(3, report.getTables().get("posts").getInserted());
        assertEquals(0, report.getTables().get("comments").getDecoded());
        assertTrue(conn.getAutoCommit());
    }

    @Test
    void restore_正常ケース_既存行は削除され同じアーカイブを2回復元しても件数が変わらないこと() throws Exception {
        execute("INSERT INTO \"posts\" (\"title\", \"slug\") VALUES ('old', 'old')");
        byte[] data = archive(Map.of(DB + "posts.bson",
                bson(row("title", "a", "slug", "a"), row("title", "b", "slug", "b"))));

        orchestrator.restore(conn, data);
        assertEquals(2, count(conn, "posts"));

        orchestrator.restore(conn, data);
        assertEquals(2, count(conn, "posts"));
        assertEquals(List.of("a", "b"), column(conn, "posts", "slug"));
    }

    @Test
    void restore_正常ケース_100行中1行の一意制約違反はスキップされ99行がコミットされること() throws Exception {
        List<Map<String, RowValue>> rows = new ArrayList<>();
        for (int i = 1; i <= 100; i++) {
            String slug = i == 50 ? "slug-10" : "slug-" + i;
            rows.add(row("title", "title-" + i, "slug", slug));
        }
        byte[] data = archive(Map.of(DB + "posts.bson", RowCodecFactory.encoder().encode(rows)));

        RestoreReport report = orchestrator.restore(conn, data);

        assertEquals(RestoreState.COMMITTED, orchestrator.getState());
        assertEquals(99, count(conn, "posts"));
        RestoreReport.TableResult posts = report.getTables().get("posts");
        assertEquals(100, posts.getDecoded());
        assertEquals(99, posts.getInserted());
        assertEquals(1, posts.getDuplicates());
        assertEquals(1, report.totalDuplicates());
    }

    @Test
    void restore_異常ケース_途中の挿入エラーで全テーブルがロールバックされること() throws Exception {
        execute("INSERT INTO \"posts\" (\"title\", \"slug\") VALUES ('existing', 'existing')");
        List<Map<String, RowValue>> says = new ArrayList<>();
        for (int i = 1; i <= 60; i++) {
            says.add(row("text", i == 50 ? null : "say-" + i, "author", "me"));
        }
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put(DB + "posts.bson",
                bson(row("title", "new1", "slug", "new1"), row("title", "new2", "slug", "new2")));
        entries.put(DB + "says.bson", RowCodecFactory.encoder().encode(says));

        RestoreException e = assertThrows(RestoreException.class,
                () -> orchestrator.restore(conn, archive(entries)));

        assertTrue(e.getMessage().contains("insert row #50 into says"), e.getMessage());
        assertEquals(RestoreState.ROLLED_BACK, orchestrator.getState());
        assertEquals(List.of("existing"), column(conn, "posts", "slug"));
        assertEquals(0, count(conn, "says"));
        assertTrue(conn.getAutoCommit());
    }

    @Test
    void restore_異常ケース_デコード失敗で先行テーブルもロールバックされること() throws Exception {
        execute("INSERT INTO \"posts\" (\"title\", \"slug\") VALUES ('existing', 'existing')");
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put(DB + "posts.bson", bson(row("title", "new", "slug", "new")));
        entries.put(DB + "comments.bson", new byte[] {1, 2, 3});

        DecodeException e = assertThrows(DecodeException.class,
                () -> orchestrator.restore(conn, archive(entries)));

        assertTrue(e.getMessage().contains("Table[comments]"), e.getMessage());
        assertEquals(List.of("existing"), column(conn, "posts", "slug"));
        assertEquals(RestoreState.ROLLED_BACK, orchestrator.getState());
    }

    @Test
    void restore_異常ケース_zipでない入力はトランザクション開始前に拒否されること() throws Exception {
        assertThrows(ArchiveFormatException.class,
                () -> orchestrator.restore(conn, utf8("not a zip archive")));
        assertTrue(conn.getAutoCommit());
        assertEquals(RestoreState.SCANNING, orchestrator.getState());
    }

    @Test
    void restore_異常ケース_途中で切れたアーカイブはトランザクション開始前に拒否されること() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put(DB + "says.bson", bson(row("text", "a")));
        entries.put(DB + "posts.bson", bson(row("title", "t", "slug", "s")));
        byte[] cut = H2TestSupport.cutBeforeCentralDirectory(archive(entries));

        assertThrows(ArchiveFormatException.class, () -> orchestrator.restore(conn, cut));
        assertTrue(conn.getAutoCommit());
        assertEquals(RestoreState.SCANNING, orchestrator.getState());
        assertEquals(0, count(conn, "says"));
    }

    @Test
    void restore_正常ケース_同一テーブルのBSONとJSONではBSONのみ取り込まれること() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("dump/sessions.json", utf8("[{\"_id\":\"s1\",\"userId\":\"u1\"},"
                + "{\"_id\":\"s2\",\"userId\":\"u2\"}]"));
        entries.put(DB + "user_sessions.bson", bson(row("id", "s9", "user_id", "u9")));

        RestoreReport report = orchestrator.restore(conn, archive(entries));

        assertEquals(1, count(conn, "user_sessions"));
        assertEquals(DB + "user_sessions.bson",
                report.getTables().get("user_sessions").getEntry());
        assertEquals("u9", queryString("SELECT \"user_id\" FROM \"user_sessions\""));
    }

    @Test
    void restore_正常ケース_JSONのみの旧形式エントリは拡張JSONを展開して取り込まれること() throws Exception {
        byte[] data = archive(Map.of("backup/sessions.json",
                utf8("[{\"_id\":{\"$oid\":\"5f50c1e2a1b2c3d4e5f60718\"},\"userId\":\"u1\","
                        + "\"created\":{\"$date\":\"2021-02-03T04:05:06Z\"}}]")));

        orchestrator.restore(conn, data);

        assertEquals("5f50c1e2a1b2c3d4e5f60718",
                queryString("SELECT \"id\" FROM \"user_sessions\""));
        assertEquals(Instant.parse("2021-02-03T04:05:06Z"),
                queryInstant("SELECT \"created_at\" FROM \"user_sessions\""));
    }

    @Test
    void restore_正常ケース_未知のエントリと未知の列は無視されること() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("mx-space-go/manifest.json", utf8("{broken"));
        entries.put(DB + "unknown_things.bson", bson(row("a", "b")));
        entries.put(DB + "posts.metadata.json", utf8("{}"));
        entries.put(DB + "readme.txt", utf8("hello"));
        entries.put(DB + "posts.bson",
                bson(row("title", "t", "slug", "s", "fooBar", "x", "__v", 3)));

        RestoreReport report = orchestrator.restore(conn, archive(entries));

        assertEquals(List.of("posts"), new ArrayList<>(report.getTables().keySet()));
        assertEquals(1, count(conn, "posts"));
    }

    @Test
    void restore_正常ケース_ゼロ相当の時刻はNULLとなりupdated_atは常にNULLとなること() throws Exception {
        byte[] data = archive(Map.of(DB + "notes.bson",
                bson(row("nid", 1, "created", "0000-00-00", "modified", "2021-01-01T00:00:00Z"),
                        row("nid", 2, "created", 0, "updated_at",
                                RowValue.of(Instant.parse("2022-01-01T00:00:00Z"))),
                        row("nid", 3, "created", 1600000000L),
                        row("nid", 4, "created", "2020-05-06 07:08:09"))));

        orchestrator.restore(conn, data);

        assertNull(queryInstant("SELECT \"created_at\" FROM \"notes\" WHERE \"n_id\" = 1"));
        assertNull(queryInstant("SELECT \"created_at\" FROM \"notes\" WHERE \"n_id\" = 2"));
        assertEquals(Instant.ofEpochSecond(1600000000L),
                queryInstant("SELECT \"created_at\" FROM \"notes\" WHERE \"n_id\" = 3"));
        assertEquals(Instant.parse("2020-05-06T07:08:09Z"),
                queryInstant("SELECT \"created_at\" FROM \"notes\" WHERE \"n_id\" = 4"));
        assertEquals(0,
                queryInt("SELECT COUNT(*) FROM \"notes\" WHERE \"updated_at\" IS NOT NULL"));
    }

    @Test
    void restore_正常ケース_参照種別が正規化されること() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put(DB + "comments.bson",
                bson(row("refType", "Posts", "ref", "p1", "author", "guest", "text", "hi")));
        entries.put(DB + "slug_trackers.bson", bson(row("slug", "old", "type", "Notes")));

        orchestrator.restore(conn, archive(entries));

        assertEquals("post", queryString("SELECT \"ref_type\" FROM \"comments\""));
        assertEquals("note", queryString("SELECT \"type\" FROM \"slug_trackers\""));
    }

    @Test
    void restore_正常ケース_カウンタ分割と入れ子値のJSON化とノートのパスワード別名が適用されること() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put(DB + "posts.bson", bson(row("title", "t", "slug", "s", "count",
                RowValue.ofMap(row("read", 5, "like", 2)), "tags",
                RowValue.ofList(List.of(RowValue.of("a"), RowValue.of("b"))))));
        entries.put(DB + "notes.bson", bson(row("nid", 7, "password", "secret")));

        orchestrator.restore(conn, archive(entries));

        assertEquals(5, queryInt("SELECT \"read_count\" FROM \"posts\""));
        assertEquals(2, queryInt("SELECT \"like_count\" FROM \"posts\""));
        assertEquals("[\"a\",\"b\"]", queryString("SELECT \"tags\" FROM \"posts\""));
        assertEquals("secret", queryString("SELECT \"password_hash\" FROM \"notes\""));
    }

    @Test
    void restore_正常ケース_旧MailOptions行が統合設定へ移行されること() throws Exception {
        byte[] data = archive(Map.of(DB + "options.bson",
                bson(row("_id", "o1", "name", "MailOptions", "value", "{\"enable\":true}"),
                        row("_id", "o2", "name", "theme", "value", "dark"))));

        RestoreReport report = orchestrator.restore(conn, data);

        assertEquals(List.of("mail_options"), report.getMigratedSections());
        JsonNode configs = new ObjectMapper().readTree(
                queryString("SELECT \"value\" FROM \"options\" WHERE \"name\" = 'configs'"));
        assertTrue(configs.path("mail_options").path("enable").asBoolean());
        assertFalse(configs.path("mail_options").has("provider"));
        assertEquals("我的小世界呀", configs.path("seo").path("title").asText());
        assertEquals(3, count(conn, "options"));
    }

    @Test
    void restore_正常ケース_旧テンプレートファイルがオプション行として取り込まれること() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put(TEMPLATE_DIR + "owner.template.ejs", utf8("  <p>owner</p>\n"));
        entries.put("Backup_Data\\Assets\\Email-Template\\Newsletter.Template.ejs",
                utf8("<p>news</p>"));
        entries.put(TEMPLATE_DIR + "guest.template.ejs", utf8("   \n"));
        entries.put(TEMPLATE_DIR + "other.ejs", utf8("ignored"));

        RestoreReport report = orchestrator.restore(conn, archive(entries));

        assertEquals(List.of("email_template_owner", "email_template_newsletter"),
                report.getImportedTemplates());
        assertEquals("<p>owner</p>", queryString(
                "SELECT \"value\" FROM \"options\" WHERE \"name\" = 'email_template_owner'"));
        assertEquals(2, count(conn, "options"));
    }

    @Test
    void restore_異常ケース_外部キー無効化に対応する方言ではエラー時も再有効化されること() throws Exception {
        DbDialectHandler dialect = spy(H2TestSupport.dialect());
        doReturn(true).when(dialect).supportsDeferredForeignKeys();
        RestoreOrchestrator sut = new RestoreOrchestrator(dialect, H2TestSupport.backupConfig());
        byte[] data = archive(Map.of(DB + "posts.bson", new byte[] {9, 9}));

        assertThrows(DecodeException.class, () -> sut.restore(conn, data));

        verify(dialect, times(1)).disableForeignKeyChecks(conn);
        verify(dialect, times(1)).enableForeignKeyChecks(conn);
    }

    @Test
    void scan_正常ケース_同一形式の重複は先勝ちとなること() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("a/says.bson", bson(row("text", "first")));
        entries.put("b/says.bson", bson(row("text", "second")));
        entries.put("c/prelude.json", utf8("[]"));

        Map<String, RestoreOrchestrator.ScannedEntry> scanned =
                orchestrator.scan(BackupArchive.read(archive(entries)));

        assertEquals(1, scanned.size());
        assertEquals("a/says.bson", scanned.get("says").getEntry().getName());
    }

    private void execute(String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }

    private String queryString(String sql) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
            assertTrue(rs.next());
            return rs.getString(1);
        }
    }

    private int queryInt(String sql) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
            assertTrue(rs.next());
            return rs.getInt(1);
        }
    }

    private Instant queryInstant(String sql) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
            assertTrue(rs.next());
            Timestamp ts = rs.getTimestamp(1);
            return ts == null ? null : ts.toInstant();
        }
    }
}
