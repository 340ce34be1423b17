package io.github.yok.blogvault.codec;

import static io.github.yok.blogvault.support.H2TestSupport.row;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.blogvault.error.DecodeException;
import io.github.yok.blogvault.model.RowValue;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.bson.BsonBinaryWriter;
import org.bson.BsonDateTime;
import org.bson.BsonDecimal128;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonMaxKey;
import org.bson.BsonObjectId;
import org.bson.BsonRegularExpression;
import org.bson.BsonString;
import org.bson.BsonTimestamp;
import org.bson.BsonUndefined;
import org.bson.codecs.BsonDocumentCodec;
import org.bson.codecs.EncoderContext;
import org.bson.io.BasicOutputBuffer;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

class BsonRowCodecTest {

    private final BsonRowCodec codec = new BsonRowCodec();

    private static byte[] raw(BsonDocument doc) {
        BasicOutputBuffer buffer = new BasicOutputBuffer();
        try (BsonBinaryWriter writer = new BsonBinaryWriter(buffer)) {
            new BsonDocumentCodec().encode(writer, doc, EncoderContext.builder().build());
        }
        return buffer.toByteArray();
    }

    @Test
    void decode_正常ケース_空のペイロードは0行となること() throws Exception {
        assertTrue(codec.decode(new byte[0]).isEmpty());
        assertEquals(0, codec.encode(List.of()).length);
    }

    @Test
    void decode_正常ケース_連結された文書が順序を保って復元されること() throws Exception {
        List<Map<String, RowValue>> rows = List.of(
                row("title", "a", "count", RowValue.ofMap(row("read", 1)), "tags",
                        RowValue.ofList(List.of(RowValue.of("x"), RowValue.of("y")))),
                row("title", "b", "copyright", true, "ratio", 0.5, "body", null),
                row("created", RowValue.of(Instant.ofEpochMilli(1_700_000_000_123L)), "bin",
                        RowValue.of(new byte[] {1, 2, 3})));

        List<Map<String, RowValue>> decoded = codec.decode(codec.encode(rows));

        assertEquals(3, decoded.size());
        assertEquals(rows.get(0), decoded.get(0));
        assertEquals(rows.get(1), decoded.get(1));
        assertEquals(Instant.ofEpochMilli(1_700_000_000_123L),
                decoded.get(2).get("created").asInstant());
        assertArrayEquals(new byte[] {1, 2, 3}, decoded.get(2).get("bin").asBytes());
        assertEquals(Arrays.asList("title", "count", "tags"),
                List.copyOf(decoded.get(0).keySet()));
    }

    @Test
    void decode_正常ケース_レガシー型が汎用値に変換されること() throws Exception {
        ObjectId id = new ObjectId("5f8d0d55b54764421b7156c3");
        BsonDocument doc = new BsonDocument()
                .append("_id", new BsonObjectId(id))
                .append("n", new BsonInt32(7))
                .append("created", new BsonDateTime(1_600_000_000_000L))
                .append("ts", new BsonTimestamp(1_600_000_000, 5))
                .append("price", new BsonDecimal128(Decimal128.parse("12.50")))
                .append("re", new BsonRegularExpression("^a.*", "i"))
                .append("undef", new BsonUndefined())
                .append("max", new BsonMaxKey())
                .append("text", new BsonString("hello"));

        Map<String, RowValue> row = codec.decode(raw(doc)).get(0);

        assertEquals("5f8d0d55b54764421b7156c3", row.get("_id").asText());
        assertEquals(7L, row.get("n").asLong());
        assertEquals(Instant.ofEpochMilli(1_600_000_000_000L), row.get("created").asInstant());
        assertEquals(Instant.ofEpochSecond(1_600_000_000L), row.get("ts").asInstant());
        assertEquals("12.50", row.get("price").asText());
        assertEquals("^a.*", row.get("re").asText());
        assertTrue(row.get("undef").isNull());
        assertTrue(row.get("max").isNull());
        assertEquals("hello", row.get("text").asText());
    }

    @Test
    void decode_正常ケース_タイムスタンプの秒は符号なしとして扱われること() throws Exception {
        BsonDocument doc = new BsonDocument("ts", new BsonTimestamp((int) 3_000_000_000L, 1));

        Map<String, RowValue> row = codec.decode(raw(doc)).get(0);

        assertEquals(Instant.ofEpochSecond(3_000_000_000L), row.get("ts").asInstant());
    }

    @Test
    void decode_異常ケース_長さ欄が途中で切れている場合はDecodeExceptionとなること() {
        byte[] one = raw(new BsonDocument("a", new BsonString("b")));
        byte[] payload = Arrays.copyOf(one, one.length + 2);

        DecodeException ex = assertThrows(DecodeException.class, () -> codec.decode(payload));
        assertTrue(ex.getMessage().contains("Truncated document length at offset " + one.length));
    }

    @Test
    void decode_異常ケース_長さが残りを超える場合はDecodeExceptionとなること() {
        byte[] one = raw(new BsonDocument("a", new BsonString("b")));
        byte[] payload = Arrays.copyOf(one, one.length - 1);

        DecodeException ex = assertThrows(DecodeException.class, () -> codec.decode(payload));
        assertTrue(ex.getMessage().startsWith("Invalid document length"));
    }

    @Test
    void decode_異常ケース_長さが0以下の場合はDecodeExceptionとなること() {
        byte[] payload = {0, 0, 0, 0, 0};

        assertThrows(DecodeException.class, () -> codec.decode(payload));
    }

    @Test
    void decode_異常ケース_文書本体が壊れている場合はDecodeExceptionとなること() {
        byte[] one = raw(new BsonDocument("a", new BsonString("b")));
        // string length field of "a"
        one[7] = 0x7f;

        assertThrows(DecodeException.class, () -> codec.decode(one));
    }
}
