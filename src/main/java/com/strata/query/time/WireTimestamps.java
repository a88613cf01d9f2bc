package com.strata.query.time;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;

/**
 * Conversions between Java time values and the backend's timestamp strings.
 * The backend works in naive UTC.
 */
public final class WireTimestamps {

    private static final DateTimeFormatter NAIVE = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    // Date and time separated by 'T' or a space, offset optional.
    private static final DateTimeFormatter WIRE = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart().appendOffsetId().optionalEnd()
        .toFormatter();

    private WireTimestamps() {
    }

    public static boolean isTimestamp(Object value) {
        return value instanceof LocalDateTime
            || value instanceof OffsetDateTime
            || value instanceof ZonedDateTime
            || value instanceof Instant;
    }

    /**
     * Converts to naive UTC, truncated to microseconds.
     */
    public static LocalDateTime toNaiveUtc(TemporalAccessor value) {
        LocalDateTime naive;
        if (value instanceof LocalDateTime) {
            naive = (LocalDateTime) value;
        } else if (value instanceof OffsetDateTime) {
            naive = ((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } else if (value instanceof ZonedDateTime) {
            naive = ((ZonedDateTime) value).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } else if (value instanceof Instant) {
            naive = LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        } else {
            throw new IllegalArgumentException("Unsupported time value: " + value);
        }
        return naive.truncatedTo(ChronoUnit.MICROS);
    }

    public static String format(TemporalAccessor value) {
        return NAIVE.format(toNaiveUtc(value));
    }

    /**
     * Parses a backend timestamp to Unix epoch seconds. Strings without an
     * offset are read as UTC.
     *
     * @throws DateTimeParseException when {@code wire} is not a timestamp
     */
    public static long toEpochSeconds(String wire) {
        TemporalAccessor parsed = WIRE.parseBest(wire, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toEpochSecond();
        }
        return ((LocalDateTime) parsed).toEpochSecond(ZoneOffset.UTC);
    }
}
