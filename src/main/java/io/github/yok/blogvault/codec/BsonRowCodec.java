package io.github.yok.blogvault.codec;

import io.github.yok.blogvault.error.DecodeException;
import io.github.yok.blogvault.model.LegacyValue;
import io.github.yok.blogvault.model.RowValue;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonBinaryWriter;
import org.bson.BsonBoolean;
import org.bson.BsonDateTime;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonTimestamp;
import org.bson.BsonValue;
import org.bson.RawBsonDocument;
import org.bson.codecs.BsonDocumentCodec;
import org.bson.codecs.EncoderContext;
import org.bson.io.BasicOutputBuffer;

/**
 * Codec for the primary entry format: a flat concatenation of BSON documents.
 *
 * <p>
 * Each document starts with its own little-endian int32 total length, so the stream is decoded by
 * reading the length, decoding exactly that many bytes, and advancing. No outer wrapper exists; an
 * empty row set encodes to zero bytes.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BsonRowCodec implements RowDecoder {

    private static final BsonDocumentCodec DOCUMENT_CODEC = new BsonDocumentCodec();

    /**
     * Encodes rows into concatenated documents.
     *
     * @param rows rows to encode
     * @return encoded bytes; empty for an empty list
     */
    public byte[] encode(List<Map<String, RowValue>> rows) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Map<String, RowValue> row : rows) {
            BsonDocument doc = new BsonDocument();
            row.forEach((key, value) -> doc.append(key, toBson(value)));
            BasicOutputBuffer buffer = new BasicOutputBuffer();
            try (BsonBinaryWriter writer = new BsonBinaryWriter(buffer)) {
                DOCUMENT_CODEC.encode(writer, doc, EncoderContext.builder().build());
            }
            byte[] bytes = buffer.toByteArray();
            out.write(bytes, 0, bytes.length);
        }
        return out.toByteArray();
    }

    @Override
    public List<Map<String, RowValue>> decode(byte[] payload) throws DecodeException {
        List<Map<String, RowValue>> rows = new ArrayList<>();
        int cursor = 0;
        while (cursor < payload.length) {
            if (payload.length - cursor < 4) {
                throw new DecodeException("Truncated document length at offset " + cursor);
            }
            int length =
                    ByteBuffer.wrap(payload, cursor, 4).order(ByteOrder.LITTLE_ENDIAN).getInt();
            if (length <= 0 || length > payload.length - cursor) {
                throw new DecodeException(
                        "Invalid document length " + length + " at offset " + cursor);
            }
            try {
                RawBsonDocument doc = new RawBsonDocument(payload, cursor, length);
                rows.add(toRow(doc));
            } catch (RuntimeException e) {
                // BsonException, buffer underflow and argument checks of the raw reader
                throw new DecodeException("Malformed document at offset " + cursor, e);
            }
            cursor += length;
        }
        log.debug("Decoded {} document(s) from {} byte(s)", rows.size(), payload.length);
        return rows;
    }

    private static Map<String, RowValue> toRow(BsonDocument doc) {
        Map<String, RowValue> row = new LinkedHashMap<>();
        for (Map.Entry<String, BsonValue> e : doc.entrySet()) {
            row.put(e.getKey(), fromBson(e.getValue()));
        }
        return row;
    }

    /**
     * Maps a wire value to a row value. Library types end at this boundary: anything that is not a
     * plain scalar or container goes through {@link LegacyValue}.
     */
    static RowValue fromBson(BsonValue value) {
        switch (value.getBsonType()) {
            case NULL:
            case END_OF_DOCUMENT:
                return RowValue.nullValue();
            case BOOLEAN:
                return RowValue.of(value.asBoolean().getValue());
            case INT32:
                return RowValue.of((long) value.asInt32().getValue());
            case INT64:
                return RowValue.of(value.asInt64().getValue());
            case DOUBLE:
                return RowValue.of(value.asDouble().getValue());
            case STRING:
                return RowValue.of(value.asString().getValue());
            case DOCUMENT:
                return RowValue.ofMap(toRow(value.asDocument()));
            case ARRAY: {
                List<RowValue> items = new ArrayList<>();
                for (BsonValue item : value.asArray()) {
                    items.add(fromBson(item));
                }
                return RowValue.ofList(items);
            }
            case BINARY:
                return new LegacyValue.Binary(value.asBinary().getType(),
                        value.asBinary().getData()).normalize();
            case OBJECT_ID:
                return new LegacyValue.ObjectId(value.asObjectId().getValue().toByteArray())
                        .normalize();
            case DB_POINTER:
                return new LegacyValue.ObjectId(value.asDBPointer().getId().toByteArray())
                        .normalize();
            case DATE_TIME:
                return new LegacyValue.DateTime(value.asDateTime().getValue()).normalize();
            case TIMESTAMP: {
                BsonTimestamp ts = value.asTimestamp();
                return new LegacyValue.Timestamp(Integer.toUnsignedLong(ts.getTime()),
                        Integer.toUnsignedLong(ts.getInc())).normalize();
            }
            case DECIMAL128:
                return new LegacyValue.Decimal(value.asDecimal128().getValue().toString())
                        .normalize();
            case REGULAR_EXPRESSION:
                return new LegacyValue.Regex(value.asRegularExpression().getPattern(),
                        value.asRegularExpression().getOptions()).normalize();
            case JAVASCRIPT:
                return new LegacyValue.JavaScript(value.asJavaScript().getCode()).normalize();
            case JAVASCRIPT_WITH_SCOPE:
                return new LegacyValue.JavaScript(value.asJavaScriptWithScope().getCode())
                        .normalize();
            case SYMBOL:
                return new LegacyValue.Symbol(value.asSymbol().getSymbol()).normalize();
            default:
                // UNDEFINED, MIN_KEY, MAX_KEY
                return LegacyValue.Undefined.INSTANCE.normalize();
        }
    }

    static BsonValue toBson(RowValue value) {
        switch (value.getKind()) {
            case NULL:
                return BsonNull.VALUE;
            case BOOL:
                return BsonBoolean.valueOf(value.asBoolean());
            case INT:
                return new BsonInt64(value.asLong());
            case FLOAT:
                return new BsonDouble(value.asDouble());
            case TEXT:
                return new BsonString(value.asText());
            case BYTES:
                return new BsonBinary(value.asBytes());
            case TIME:
                return new BsonDateTime(value.asInstant().toEpochMilli());
            case LIST: {
                BsonArray array = new BsonArray();
                for (RowValue item : value.asList()) {
                    array.add(toBson(item));
                }
                return array;
            }
            case MAP: {
                BsonDocument doc = new BsonDocument();
                value.asMap().forEach((key, item) -> doc.append(key, toBson(item)));
                return doc;
            }
            default:
                throw new IllegalStateException("Unhandled kind: " + value.getKind());
        }
    }
}
