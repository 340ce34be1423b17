package io.github.yok.blogvault.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.yok.blogvault.db.OptionStore;
import io.github.yok.blogvault.error.RestoreException;
import io.github.yok.blogvault.registry.AliasTables;
import io.github.yok.blogvault.util.SnakeCaseUtil;
import java.io.IOException;
import java.io.InputStream;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Folds legacy per-section option rows into the unified configuration row.
 *
 * <p>
 * Older archives stored each configuration section as its own {@code options} row
 * ({@code MailOptions}, {@code seo}, {@code comment_options} ...). After the table import this
 * step parses every row whose name maps to a known section, snake-cases its nested keys and puts
 * it into the unified blob under that section, replacing the whole section. Rows are processed in
 * lexicographic name order, so when two rows map to the same section the later name wins.
 * </p>
 *
 * <p>
 * The base document is the bundled defaults ({@value #DEFAULTS_RESOURCE}) overlaid key by key with
 * the unified row already present in the target. Nothing is written when no legacy row matched.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LegacyConfigMigrator {

    static final String DEFAULTS_RESOURCE = "default-configs.json";

    private final OptionStore optionStore;
    private final String configOptionName;
    private final ObjectMapper mapper =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public LegacyConfigMigrator(OptionStore optionStore, String configOptionName) {
        this.optionStore = optionStore;
        this.configOptionName = configOptionName;
    }

    /**
     * Migrates legacy option rows on the restore connection.
     *
     * @param conn JDBC connection inside the restore transaction
     * @return migrated section names, in processing order; empty when nothing was written
     * @throws SQLException if the options table cannot be read or written
     * @throws RestoreException if the defaults cannot be loaded or the result cannot be serialized
     */
    public List<String> migrate(Connection conn) throws SQLException, RestoreException {
        List<OptionStore.Option> options = new ArrayList<>(optionStore.list(conn));
        options.sort(Comparator.comparing(OptionStore.Option::getName));

        ObjectNode sections = mapper.createObjectNode();
        List<String> migrated = new ArrayList<>();
        for (OptionStore.Option option : options) {
            Optional<String> section = resolveSection(option.getName());
            if (section.isEmpty()) {
                continue;
            }
            JsonNode value = normalizeKeys(parseValue(option.getValue()));
            sections.set(section.get(), value);
            if (!migrated.contains(section.get())) {
                migrated.add(section.get());
            }
            log.info("[restore] Legacy option[{}] -> config section[{}]", option.getName(),
                    section.get());
        }
        if (migrated.isEmpty()) {
            log.info("[restore] No legacy config options found");
            return migrated;
        }

        ObjectNode merged = loadDefaults();
        overlayExisting(conn, merged);
        merged.setAll(sections);

        String json;
        try {
            json = mapper.writeValueAsString(merged);
        } catch (JsonProcessingException e) {
            throw new RestoreException(
                    "Failed to serialize migrated config: " + e.getOriginalMessage(), e);
        }
        optionStore.replace(conn, configOptionName, json);
        log.info("[restore] Option[{}] rewritten with {} migrated section(s)", configOptionName,
                migrated.size());
        return migrated;
    }

    /**
     * Maps a legacy option name to its config section.
     *
     * @param name option name in any casing convention
     * @return section name, or empty when the option is not a legacy section
     */
    static Optional<String> resolveSection(String name) {
        String snake = SnakeCaseUtil.toSnakeCase(name).toLowerCase(Locale.ROOT);
        if (snake.isEmpty()) {
            return Optional.empty();
        }
        String section = AliasTables.LEGACY_OPTION_SECTIONS.get(snake);
        if (section == null) {
            section = AliasTables.LEGACY_OPTION_SECTIONS.get(SnakeCaseUtil.squash(snake));
        }
        return Optional.ofNullable(section);
    }

    /**
     * Parses a stored option value: JSON, then integer, then float, then boolean, then raw text.
     *
     * @param raw stored value, may be {@code null}
     * @return parsed node
     */
    JsonNode parseValue(String raw) {
        String s = raw == null ? "" : raw.trim();
        if (s.isEmpty()) {
            return TextNode.valueOf("");
        }
        try {
            JsonNode node = mapper.readTree(s);
            if (node != null && !node.isMissingNode()) {
                return node;
            }
        } catch (JsonProcessingException e) {
            log.debug("Option value is not JSON: {}", e.getOriginalMessage());
        }
        try {
            return LongNode.valueOf(Long.parseLong(s));
        } catch (NumberFormatException e) {
            log.trace("Option value is not an integer");
        }
        try {
            return DoubleNode.valueOf(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            log.trace("Option value is not a float");
        }
        switch (s.toLowerCase(Locale.ROOT)) {
            case "t":
            case "true":
                return BooleanNode.TRUE;
            case "f":
            case "false":
                return BooleanNode.FALSE;
            default:
                return TextNode.valueOf(s);
        }
    }

    /**
     * Recursively snake-cases object keys. Keys that become empty are dropped.
     *
     * @param node parsed value
     * @return copy with normalized keys
     */
    JsonNode normalizeKeys(JsonNode node) {
        if (node.isObject()) {
            ObjectNode out = mapper.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = SnakeCaseUtil.toSnakeCase(field.getKey());
                if (!key.isEmpty()) {
                    out.set(key, normalizeKeys(field.getValue()));
                }
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = mapper.createArrayNode();
            node.forEach(item -> out.add(normalizeKeys(item)));
            return out;
        }
        return node;
    }

    private ObjectNode loadDefaults() throws RestoreException {
        try (InputStream in = LegacyConfigMigrator.class.getClassLoader()
                .getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new RestoreException("Classpath resource not found: " + DEFAULTS_RESOURCE);
            }
            JsonNode node = mapper.readTree(in);
            if (!node.isObject()) {
                throw new RestoreException(DEFAULTS_RESOURCE + " must hold a JSON object");
            }
            return (ObjectNode) node;
        } catch (IOException e) {
            throw new RestoreException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
    }

    private void overlayExisting(Connection conn, ObjectNode merged) throws SQLException {
        Optional<String> existing = optionStore.find(conn, configOptionName);
        if (existing.isEmpty() || existing.get().isBlank()) {
            return;
        }
        try {
            JsonNode stored = mapper.readTree(existing.get());
            if (stored.isObject()) {
                merged.setAll((ObjectNode) stored);
            } else {
                log.warn("[restore] Option[{}] is not a JSON object; defaults used",
                        configOptionName);
            }
        } catch (JsonProcessingException e) {
            log.warn("[restore] Option[{}] is not valid JSON; defaults used: {}",
                    configOptionName, e.getOriginalMessage());
        }
    }
}
