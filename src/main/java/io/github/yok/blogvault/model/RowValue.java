package io.github.yok.blogvault.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.io.IOUtils;

/**
 * Loosely-typed value of one row field, modelled as an explicit tagged variant.
 *
 * <p>
 * Decoded archive rows, normalized rows and rows read from the database all carry their values as
 * {@code RowValue}. Conversions from JDBC objects and back to JDBC-bindable objects are defined
 * once here.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class RowValue {

    /**
     * Variant tag.
     */
    public enum Kind {
        NULL, BOOL, INT, FLOAT, TEXT, BYTES, TIME, LIST, MAP
    }

    private static final RowValue NULL_VALUE = new RowValue(Kind.NULL, null);
    private static final RowValue TRUE_VALUE = new RowValue(Kind.BOOL, Boolean.TRUE);
    private static final RowValue FALSE_VALUE = new RowValue(Kind.BOOL, Boolean.FALSE);

    private final Kind kind;
    // Scalar payload; null for NULL, LIST and MAP
    private final Object payload;
    private final List<RowValue> items;
    private final Map<String, RowValue> entries;

    private RowValue(Kind kind, Object payload) {
        this(kind, payload, null, null);
    }

    private RowValue(Kind kind, Object payload, List<RowValue> items,
            Map<String, RowValue> entries) {
        this.kind = kind;
        this.payload = payload;
        this.items = items;
        this.entries = entries;
    }

    public static RowValue nullValue() {
        return NULL_VALUE;
    }

    public static RowValue of(boolean value) {
        return value ? TRUE_VALUE : FALSE_VALUE;
    }

    public static RowValue of(long value) {
        return new RowValue(Kind.INT, value);
    }

    public static RowValue of(double value) {
        return new RowValue(Kind.FLOAT, value);
    }

    /**
     * Creates a text value.
     *
     * @param value text; {@code null} yields the NULL variant
     * @return text value
     */
    public static RowValue of(String value) {
        return value == null ? NULL_VALUE : new RowValue(Kind.TEXT, value);
    }

    /**
     * Creates a byte-blob value. The array is copied.
     *
     * @param value bytes; {@code null} yields the NULL variant
     * @return bytes value
     */
    public static RowValue of(byte[] value) {
        return value == null ? NULL_VALUE : new RowValue(Kind.BYTES, value.clone());
    }

    /**
     * Creates a time value.
     *
     * @param value instant; {@code null} yields the NULL variant
     * @return time value
     */
    public static RowValue of(Instant value) {
        return value == null ? NULL_VALUE : new RowValue(Kind.TIME, value);
    }

    /**
     * Creates a list value.
     *
     * @param items elements, which must not be {@code null}
     * @return list value
     */
    public static RowValue ofList(List<RowValue> items) {
        Preconditions.checkNotNull(items, "items must not be null");
        return new RowValue(Kind.LIST, null, ImmutableList.copyOf(items), null);
    }

    /**
     * Creates a nested map value. Key order is preserved.
     *
     * @param entries entries, which must not be {@code null}
     * @return map value
     */
    public static RowValue ofMap(Map<String, RowValue> entries) {
        Preconditions.checkNotNull(entries, "entries must not be null");
        return new RowValue(Kind.MAP, null, null,
                Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    /**
     * Converts an object obtained from JDBC (directly or through DBUnit) into a row value.
     *
     * @param value JDBC value
     * @return row value
     * @throws SQLException if a LOB cannot be read
     */
    public static RowValue fromJdbc(Object value) throws SQLException {
        if (value == null) {
            return NULL_VALUE;
        }
        if (value instanceof RowValue) {
            return (RowValue) value;
        }
        if (value instanceof Boolean) {
            return of(((Boolean) value).booleanValue());
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer
                || value instanceof Long) {
            return of(((Number) value).longValue());
        }
        if (value instanceof Float || value instanceof Double) {
            return of(((Number) value).doubleValue());
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            return big.bitLength() < Long.SIZE ? of(big.longValue()) : of(big.toString());
        }
        if (value instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) value;
            if (decimal.scale() <= 0 && decimal.toBigInteger().bitLength() < Long.SIZE) {
                return of(decimal.longValueExact());
            }
            return of(decimal.toPlainString());
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return of(value.toString());
        }
        if (value instanceof byte[]) {
            return of((byte[]) value);
        }
        if (value instanceof Date) {
            // java.sql.Date/Time do not support toInstant()
            return of(Instant.ofEpochMilli(((Date) value).getTime()).plusNanos(
                    value instanceof Timestamp ? ((Timestamp) value).getNanos() % 1_000_000 : 0));
        }
        if (value instanceof Instant) {
            return of((Instant) value);
        }
        if (value instanceof OffsetDateTime) {
            return of(((OffsetDateTime) value).toInstant());
        }
        if (value instanceof ZonedDateTime) {
            return of(((ZonedDateTime) value).toInstant());
        }
        if (value instanceof LocalDateTime) {
            return of(((LocalDateTime) value).atZone(ZoneId.systemDefault()).toInstant());
        }
        if (value instanceof LocalDate) {
            return of(((LocalDate) value).atStartOfDay(ZoneId.systemDefault()).toInstant());
        }
        if (value instanceof Clob) {
            Clob clob = (Clob) value;
            try (Reader reader = clob.getCharacterStream()) {
                return of(IOUtils.toString(reader));
            } catch (IOException e) {
                throw new SQLException("Failed to read CLOB value", e);
            }
        }
        if (value instanceof Blob) {
            Blob blob = (Blob) value;
            try (InputStream in = blob.getBinaryStream()) {
                return of(IOUtils.toByteArray(in));
            } catch (IOException e) {
                throw new SQLException("Failed to read BLOB value", e);
            }
        }
        return of(value.toString());
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isNumeric() {
        return kind == Kind.INT || kind == Kind.FLOAT;
    }

    public boolean asBoolean() {
        checkKind(Kind.BOOL);
        return (Boolean) payload;
    }

    public long asLong() {
        checkKind(Kind.INT);
        return (Long) payload;
    }

    /**
     * Returns the numeric payload as a double; valid for INT and FLOAT.
     *
     * @return numeric value
     */
    public double asDouble() {
        Preconditions.checkState(isNumeric(), "Not a numeric value: %s", kind);
        return ((Number) payload).doubleValue();
    }

    public String asText() {
        checkKind(Kind.TEXT);
        return (String) payload;
    }

    public byte[] asBytes() {
        checkKind(Kind.BYTES);
        return ((byte[]) payload).clone();
    }

    public Instant asInstant() {
        checkKind(Kind.TIME);
        return (Instant) payload;
    }

    public List<RowValue> asList() {
        checkKind(Kind.LIST);
        return items;
    }

    public Map<String, RowValue> asMap() {
        checkKind(Kind.MAP);
        return entries;
    }

    /**
     * Converts this value into a plain Java object tree (maps, lists, scalars) suitable for JSON
     * serialization. Time values become ISO-8601 instants.
     *
     * @return plain object, or {@code null} for the NULL variant
     */
    public Object toPlain() {
        switch (kind) {
            case NULL:
                return null;
            case BYTES:
                return ((byte[]) payload).clone();
            case TIME:
                return payload.toString();
            case LIST: {
                List<Object> out = new ArrayList<>();
                for (RowValue item : items) {
                    out.add(item.toPlain());
                }
                return out;
            }
            case MAP: {
                Map<String, Object> out = new LinkedHashMap<>();
                entries.forEach((key, item) -> out.put(key, item.toPlain()));
                return out;
            }
            default:
                return payload;
        }
    }

    /**
     * Converts this value into an object for {@link java.sql.PreparedStatement#setObject}.
     * Nested values must be serialized by the caller beforehand.
     *
     * @return JDBC-bindable object, or {@code null} for the NULL variant
     * @throws IllegalStateException for LIST and MAP values
     */
    public Object toJdbc() {
        switch (kind) {
            case NULL:
                return null;
            case BYTES:
                return ((byte[]) payload).clone();
            case TIME:
                return Timestamp.from((Instant) payload);
            case LIST:
            case MAP:
                throw new IllegalStateException("Nested value cannot be bound directly: " + kind);
            default:
                return payload;
        }
    }

    private void checkKind(Kind expected) {
        Preconditions.checkState(kind == expected, "Expected %s but was %s", expected, kind);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RowValue)) {
            return false;
        }
        RowValue that = (RowValue) other;
        if (kind != that.kind) {
            return false;
        }
        if (kind == Kind.BYTES) {
            return Arrays.equals((byte[]) payload, (byte[]) that.payload);
        }
        return Objects.equals(payload, that.payload) && Objects.equals(items, that.items)
                && Objects.equals(entries, that.entries);
    }

    @Override
    public int hashCode() {
        if (kind == Kind.BYTES) {
            return 31 * kind.hashCode() + Arrays.hashCode((byte[]) payload);
        }
        return Objects.hash(kind, payload, items, entries);
    }

    @Override
    public String toString() {
        if (kind == Kind.BYTES) {
            return "BYTES(" + new String((byte[]) payload, StandardCharsets.UTF_8) + ")";
        }
        switch (kind) {
            case LIST:
                return "LIST(" + items + ")";
            case MAP:
                return "MAP(" + entries + ")";
            default:
                return kind + "(" + payload + ")";
        }
    }
}
