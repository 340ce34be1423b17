package io.github.yok.blogvault.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TableRegistryTest {

    private final TableRegistry registry = TableRegistry.getDefault();

    @Test
    void resolve_正常ケース_正規名と別名が解決されること() {
        assertEquals(Optional.of("posts"), registry.resolve("posts"));
        assertEquals(Optional.of("posts"), registry.resolve(" POSTS "));
        assertEquals(Optional.of("user_sessions"), registry.resolve("sessions"));
        assertEquals(Optional.of("meta_presets"), registry.resolve("MetaPresets"));
        assertEquals(Optional.of("recentlies"), registry.resolve("recently"));
        assertEquals(Optional.of("analyzes"), registry.resolve("analyze_logs"));
    }

    @Test
    void resolve_正常ケース_未知の名前は空となること() {
        assertEquals(Optional.empty(), registry.resolve("unknown_collection"));
        assertEquals(Optional.empty(), registry.resolve(""));
        assertEquals(Optional.empty(), registry.resolve(null));
    }

    @Test
    void tables_正常ケース_ユーザが先頭でoptionsが末尾となること() {
        List<String> tables = registry.tables();

        assertEquals("users", tables.get(0));
        assertEquals("options", tables.get(tables.size() - 1));
        assertTrue(tables.indexOf("categories") < tables.indexOf("posts"));
        assertTrue(tables.contains("says"));
        assertFalse(tables.contains("sessions"));
    }

    @Test
    void resolve_正常ケース_指定した一覧に含まれない別名先は空となること() {
        TableRegistry small = new TableRegistry(List.of("posts"));

        assertEquals(Optional.empty(), small.resolve("sessions"));
        assertEquals(Optional.of("posts"), small.resolve("Posts"));
    }
}
