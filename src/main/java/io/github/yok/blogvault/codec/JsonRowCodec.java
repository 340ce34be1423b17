package io.github.yok.blogvault.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.blogvault.error.DecodeException;
import io.github.yok.blogvault.model.LegacyValue;
import io.github.yok.blogvault.model.RowValue;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Decoder for legacy JSON table dumps: one array of row objects.
 *
 * <p>
 * Single-key extended-JSON wrappers ({@code $oid}, {@code $date}, {@code $numberLong},
 * {@code $numberInt}, {@code $numberDouble}, {@code $numberDecimal}) are unwrapped into the
 * matching legacy primitive. A blank payload decodes to zero rows.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JsonRowCodec implements RowDecoder {

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public List<Map<String, RowValue>> decode(byte[] payload) throws DecodeException {
        String text = new String(payload, StandardCharsets.UTF_8);
        if (text.isBlank()) {
            return new ArrayList<>();
        }
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Malformed JSON payload: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            return new ArrayList<>();
        }
        if (!root.isArray()) {
            throw new DecodeException("JSON payload must be an array, got " + root.getNodeType());
        }
        List<Map<String, RowValue>> rows = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            index++;
            if (!node.isObject()) {
                throw new DecodeException(
                        "Element #" + index + " is not an object: " + node.getNodeType());
            }
            rows.add(toRow(node));
        }
        log.debug("Decoded {} JSON row(s)", rows.size());
        return rows;
    }

    private Map<String, RowValue> toRow(JsonNode object) {
        Map<String, RowValue> row = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            row.put(field.getKey(), toValue(field.getValue()));
        }
        return row;
    }

    private RowValue toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return RowValue.nullValue();
        }
        if (node.isBoolean()) {
            return RowValue.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? RowValue.of(node.longValue())
                    : RowValue.of(node.asText());
        }
        if (node.isNumber()) {
            return RowValue.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return RowValue.of(node.textValue());
        }
        if (node.isBinary()) {
            try {
                return RowValue.of(node.binaryValue());
            } catch (IOException e) {
                return RowValue.of(node.asText());
            }
        }
        if (node.isArray()) {
            List<RowValue> items = new ArrayList<>();
            for (JsonNode item : node) {
                items.add(toValue(item));
            }
            return RowValue.ofList(items);
        }
        if (node.size() == 1) {
            RowValue unwrapped = unwrapExtended(node);
            if (unwrapped != null) {
                return unwrapped;
            }
        }
        return RowValue.ofMap(toRow(node));
    }

    /**
     * Unwraps a single-key extended-JSON object.
     *
     * @return unwrapped value, or {@code null} when the object is not a recognized wrapper
     */
    private RowValue unwrapExtended(JsonNode node) {
        String key = node.fieldNames().next();
        JsonNode inner = node.get(key);
        try {
            switch (key) {
                case "$oid":
                    return inner.isTextual() && inner.textValue().length() == 24
                            ? LegacyValue.ObjectId.fromHex(inner.textValue()).normalize()
                            : null;
                case "$date":
                    return unwrapDate(inner);
                case "$numberLong":
                case "$numberInt":
                    return RowValue.of(Long.parseLong(inner.asText().trim()));
                case "$numberDouble":
                    return RowValue.of(Double.parseDouble(inner.asText().trim()));
                case "$numberDecimal":
                    return new LegacyValue.Decimal(inner.asText().trim()).normalize();
                default:
                    return null;
            }
        } catch (IllegalArgumentException e) {
            log.debug("Unrecognized extended JSON wrapper {}: {}", key, e.getMessage());
            return null;
        }
    }

    private RowValue unwrapDate(JsonNode inner) {
        if (inner.isIntegralNumber()) {
            return new LegacyValue.DateTime(inner.longValue()).normalize();
        }
        if (inner.isObject() && inner.has("$numberLong")) {
            return new LegacyValue.DateTime(Long.parseLong(inner.get("$numberLong").asText()))
                    .normalize();
        }
        if (inner.isTextual()) {
            try {
                Instant instant = OffsetDateTime.parse(inner.textValue()).toInstant();
                return new LegacyValue.DateTime(instant.toEpochMilli()).normalize();
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(e.getMessage(), e);
            }
        }
        return null;
    }
}
