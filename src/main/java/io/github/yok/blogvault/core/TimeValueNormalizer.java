package io.github.yok.blogvault.core;

import io.github.yok.blogvault.model.RowValue;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalQuery;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Coerces loosely-typed values bound for time-like columns into instants.
 *
 * <p>
 * Accepted inputs, in order:
 * </p>
 * <ul>
 * <li>native time values, unchanged</li>
 * <li>numeric epoch values: magnitude {@code >= 1e11} is milliseconds, {@code >= 1e8} is seconds,
 * anything smaller is rejected. The thresholds come from observed legacy exports.</li>
 * <li>strings: RFC 3339 (with or without fraction), {@code yyyy-MM-dd HH:mm:ss[.fraction]},
 * {@code yyyy-MM-dd}, then numeric-epoch parsing of the string. Strings without an offset are
 * read as UTC.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public final class TimeValueNormalizer {

    private static final double MILLIS_THRESHOLD = 1e11;
    private static final double SECONDS_THRESHOLD = 1e8;
    // Decimal digits with optional fraction and exponent
    private static final Pattern DECIMAL_NUMBER =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Set<String> ZERO_LIKE_TEXT =
            Set.of("", "0", "null", "0000-00-00", "0000-00-00 00:00:00");

    // "yyyy-MM-dd HH:mm:ss" with 0-9 digit optional fraction
    private static final DateTimeFormatter SPACED_DATE_TIME = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private static final List<DateTimeFormatter> LOCAL_DATE_TIME_FORMATS =
            List.of(SPACED_DATE_TIME, DateTimeFormatter.ISO_LOCAL_DATE_TIME);

    private TimeValueNormalizer() {}

    /**
     * Converts a value to an instant.
     *
     * @param value raw value
     * @return instant, or empty when the value is not a recognizable time
     */
    public static Optional<Instant> toInstant(RowValue value) {
        switch (value.getKind()) {
            case TIME:
                return Optional.of(value.asInstant());
            case INT:
            case FLOAT:
                return fromEpochNumber(value.asDouble());
            case TEXT:
                return parseText(value.asText());
            default:
                return Optional.empty();
        }
    }

    /**
     * Returns whether a value encodes "no timestamp" in some legacy convention.
     *
     * @param value raw value
     * @return {@code true} for 0, blank, {@code "0"}, {@code "null"} and MySQL zero dates
     */
    public static boolean isZeroLike(RowValue value) {
        switch (value.getKind()) {
            case INT:
            case FLOAT:
                return value.asDouble() == 0d;
            case TEXT:
                return ZERO_LIKE_TEXT.contains(value.asText().trim().toLowerCase(Locale.ROOT));
            default:
                return false;
        }
    }

    /**
     * Applies the epoch magnitude heuristic.
     *
     * @param epoch epoch value in seconds or milliseconds
     * @return instant, or empty when the magnitude is below both thresholds
     */
    static Optional<Instant> fromEpochNumber(double epoch) {
        if (Double.isNaN(epoch) || Double.isInfinite(epoch)) {
            return Optional.empty();
        }
        double abs = Math.abs(epoch);
        if (abs >= MILLIS_THRESHOLD) {
            return Optional.of(Instant.ofEpochMilli((long) epoch));
        }
        if (abs >= SECONDS_THRESHOLD) {
            return Optional.of(Instant.ofEpochSecond((long) epoch));
        }
        return Optional.empty();
    }

    static Optional<Instant> parseText(String raw) {
        String s = raw.trim();
        if (s.isEmpty()) {
            return Optional.empty();
        }
        Optional<Instant> parsed =
                tryParse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME, OffsetDateTime::from)
                        .map(OffsetDateTime::toInstant);
        for (DateTimeFormatter f : LOCAL_DATE_TIME_FORMATS) {
            parsed = parsed.or(() -> tryParse(s, f, LocalDateTime::from)
                    .map(t -> t.toInstant(ZoneOffset.UTC)));
        }
        parsed = parsed.or(() -> tryParse(s, DateTimeFormatter.ISO_LOCAL_DATE, LocalDate::from)
                .map(d -> d.atStartOfDay(ZoneOffset.UTC).toInstant()));
        return parsed.or(() -> parseEpochText(s));
    }

    private static <T> Optional<T> tryParse(String s, DateTimeFormatter f, TemporalQuery<T> query) {
        try {
            return Optional.of(f.parse(s, query));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseEpochText(String s) {
        if (!DECIMAL_NUMBER.matcher(s).matches()) {
            return Optional.empty();
        }
        return fromEpochNumber(Double.parseDouble(s));
    }
}
