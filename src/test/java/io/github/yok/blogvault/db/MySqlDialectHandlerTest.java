package io.github.yok.blogvault.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class MySqlDialectHandlerTest {

    private final MySqlDialectHandler handler = new MySqlDialectHandler(new DbUnitConfigFactory());

    @Test
    void quoteIdentifier_正常ケース_バッククォートで囲まれエスケープされること() {
        assertEquals("`options`", handler.quoteIdentifier("options"));
        assertEquals("`a``b`", handler.quoteIdentifier("a`b"));
    }

    @Test
    void isDuplicateKeyViolation_正常ケース_エラー番号1062が重複と判定されること() {
        SQLException duplicate = new SQLIntegrityConstraintViolationException(
                "Duplicate entry 'hello' for key 'posts.slug'", "23000", 1062);
        SQLException notNull = new SQLIntegrityConstraintViolationException(
                "Column 'text' cannot be null", "23000", 1048);

        assertTrue(handler.isDuplicateKeyViolation(duplicate));
        assertFalse(handler.isDuplicateKeyViolation(notNull));
    }

    @Test
    void isDuplicateKeyViolation_正常ケース_連鎖した例外のSQLStateでも判定されること() {
        SQLException head = new SQLException("batch failed", "HY000", 0);
        head.setNextException(new SQLException("unique violation", "23505", 0));

        assertTrue(handler.isDuplicateKeyViolation(head));
    }

    @Test
    void foreignKeyChecks_正常ケース_セッション変数が切り替えられること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);

        assertTrue(handler.supportsDeferredForeignKeys());
        handler.disableForeignKeyChecks(conn);
        handler.enableForeignKeyChecks(conn);

        InOrder order = inOrder(st);
        order.verify(st).execute("SET FOREIGN_KEY_CHECKS = 0");
        order.verify(st).execute("SET FOREIGN_KEY_CHECKS = 1");
    }

    @Test
    void prepareConnection_正常ケース_UTCとutf8mb4が設定されること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);

        handler.prepareConnection(conn);

        verify(st).execute("SET time_zone = '+00:00'");
        verify(st).execute("SET NAMES utf8mb4");
        verify(st).close();
        assertEquals("mysql", handler.engineName());
    }
}
