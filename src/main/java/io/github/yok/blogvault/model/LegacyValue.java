package io.github.yok.blogvault.model;

import java.time.Instant;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

/**
 * Closed set of primitive wrappers found only in legacy document-database dumps.
 *
 * <p>
 * Each subtype converts itself into a {@link RowValue} through {@link #normalize()}; decoders map
 * wire-level types onto these wrappers and never expose library-specific runtime types.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class LegacyValue {

    private LegacyValue() {}

    /**
     * Converts this legacy primitive into a row value.
     *
     * @return normalized row value
     */
    public abstract RowValue normalize();

    /**
     * 12-byte document id, normalized to lower-case hex text.
     */
    public static final class ObjectId extends LegacyValue {
        private final byte[] bytes;

        public ObjectId(byte[] bytes) {
            this.bytes = bytes.clone();
        }

        /**
         * Parses a 24-character hex id.
         *
         * @param hex hex text
         * @return object id
         * @throws IllegalArgumentException if the text is not valid hex
         */
        public static ObjectId fromHex(String hex) {
            try {
                return new ObjectId(Hex.decodeHex(hex));
            } catch (DecoderException e) {
                throw new IllegalArgumentException("Invalid object id: " + hex, e);
            }
        }

        @Override
        public RowValue normalize() {
            return RowValue.of(Hex.encodeHexString(bytes));
        }
    }

    /**
     * UTC datetime in epoch milliseconds.
     */
    public static final class DateTime extends LegacyValue {
        private final long epochMillis;

        public DateTime(long epochMillis) {
            this.epochMillis = epochMillis;
        }

        @Override
        public RowValue normalize() {
            return RowValue.of(Instant.ofEpochMilli(epochMillis));
        }
    }

    /**
     * Internal replication timestamp: seconds plus an ordinal that is discarded.
     */
    public static final class Timestamp extends LegacyValue {
        private final long seconds;

        public Timestamp(long seconds, long increment) {
            this.seconds = seconds;
        }

        @Override
        public RowValue normalize() {
            return RowValue.of(Instant.ofEpochSecond(seconds));
        }
    }

    /**
     * 128-bit decimal, kept as its canonical text form.
     */
    public static final class Decimal extends LegacyValue {
        private final String text;

        public Decimal(String text) {
            this.text = text;
        }

        @Override
        public RowValue normalize() {
            return RowValue.of(text);
        }
    }

    /**
     * Regular expression; the options are dropped.
     */
    public static final class Regex extends LegacyValue {
        private final String pattern;

        public Regex(String pattern, String options) {
            this.pattern = pattern;
        }

        @Override
        public RowValue normalize() {
            return RowValue.of(pattern);
        }
    }

    /**
     * JavaScript code, with or without scope.
     */
    public static final class JavaScript extends LegacyValue {
        private final String code;

        public JavaScript(String code) {
            this.code = code;
        }

        @Override
        public RowValue normalize() {
            return RowValue.of(code);
        }
    }

    /**
     * Deprecated symbol type.
     */
    public static final class Symbol extends LegacyValue {
        private final String symbol;

        public Symbol(String symbol) {
            this.symbol = symbol;
        }

        @Override
        public RowValue normalize() {
            return RowValue.of(symbol);
        }
    }

    /**
     * Binary payload with a subtype tag; only the bytes survive.
     */
    public static final class Binary extends LegacyValue {
        private final byte[] data;

        public Binary(byte subtype, byte[] data) {
            this.data = data.clone();
        }

        @Override
        public RowValue normalize() {
            return RowValue.of(data);
        }
    }

    /**
     * Undefined, min-key and max-key markers. All normalize to NULL.
     */
    public static final class Undefined extends LegacyValue {
        public static final Undefined INSTANCE = new Undefined();

        private Undefined() {}

        @Override
        public RowValue normalize() {
            return RowValue.nullValue();
        }
    }
}
