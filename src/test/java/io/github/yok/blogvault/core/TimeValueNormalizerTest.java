package io.github.yok.blogvault.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.blogvault.model.RowValue;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TimeValueNormalizerTest {

    @Test
    void toInstant_正常ケース_エポック値の桁で秒とミリ秒が判定されること() {
        assertEquals(Optional.of(Instant.ofEpochMilli(1_600_000_000_000L)),
                TimeValueNormalizer.toInstant(RowValue.of(1_600_000_000_000L)));
        assertEquals(Optional.of(Instant.ofEpochSecond(1_600_000_000L)),
                TimeValueNormalizer.toInstant(RowValue.of(1_600_000_000L)));
        assertEquals(Optional.of(Instant.ofEpochSecond(1_600_000_000L)),
                TimeValueNormalizer.toInstant(RowValue.of(1.6e9)));
        assertEquals(Optional.empty(), TimeValueNormalizer.toInstant(RowValue.of(12345L)));
    }

    @Test
    void toInstant_正常ケース_文字列の各書式が解釈されること() {
        assertEquals(Optional.of(Instant.parse("2024-01-02T03:04:05Z")),
                TimeValueNormalizer.toInstant(RowValue.of("2024-01-02T12:04:05+09:00")));
        assertEquals(Optional.of(Instant.parse("2024-01-02T03:04:05.250Z")),
                TimeValueNormalizer.toInstant(RowValue.of("2024-01-02 03:04:05.25")));
        assertEquals(Optional.of(Instant.parse("2024-01-02T03:04:05Z")),
                TimeValueNormalizer.toInstant(RowValue.of("2024-01-02T03:04:05")));
        assertEquals(Optional.of(Instant.parse("2024-01-02T00:00:00Z")),
                TimeValueNormalizer.toInstant(RowValue.of(" 2024-01-02 ")));
        assertEquals(Optional.of(Instant.ofEpochMilli(1_600_000_000_000L)),
                TimeValueNormalizer.toInstant(RowValue.of("1600000000000")));
    }

    @Test
    void toInstant_正常ケース_解釈できない値は空となること() {
        assertEquals(Optional.empty(), TimeValueNormalizer.toInstant(RowValue.of("yesterday")));
        assertEquals(Optional.empty(), TimeValueNormalizer.toInstant(RowValue.of("")));
        assertEquals(Optional.empty(), TimeValueNormalizer.toInstant(RowValue.of(true)));
        assertEquals(Optional.empty(), TimeValueNormalizer.toInstant(RowValue.nullValue()));
    }

    @Test
    void toInstant_正常ケース_十進表記以外の数値文字列は空となること() {
        assertEquals(Optional.of(Instant.ofEpochSecond(1_000_000_000L)),
                TimeValueNormalizer.toInstant(RowValue.of("1e9")));
        assertEquals(Optional.of(Instant.ofEpochSecond(1_600_000_000L)),
                TimeValueNormalizer.toInstant(RowValue.of("1600000000.5")));
        assertEquals(Optional.empty(), TimeValueNormalizer.toInstant(RowValue.of("1e9d")));
        assertEquals(Optional.empty(), TimeValueNormalizer.toInstant(RowValue.of("1600000000f")));
        assertEquals(Optional.empty(), TimeValueNormalizer.toInstant(RowValue.of("0x1p30")));
        assertEquals(Optional.empty(), TimeValueNormalizer.toInstant(RowValue.of("Infinity")));
    }

    @Test
    void isZeroLike_正常ケース_タイムスタンプなしを表す値が判定されること() {
        assertTrue(TimeValueNormalizer.isZeroLike(RowValue.of(0L)));
        assertTrue(TimeValueNormalizer.isZeroLike(RowValue.of("0000-00-00 00:00:00")));
        assertTrue(TimeValueNormalizer.isZeroLike(RowValue.of(" NULL ")));
        assertTrue(TimeValueNormalizer.isZeroLike(RowValue.of("")));
        assertFalse(TimeValueNormalizer.isZeroLike(RowValue.of("yesterday")));
        assertFalse(TimeValueNormalizer.isZeroLike(RowValue.of(5L)));
    }
}
