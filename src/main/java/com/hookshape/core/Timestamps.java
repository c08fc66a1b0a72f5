package com.hookshape.core;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Lenient parsing of the upstream date/time values.
 *
 * Accepted:
 *   1718000000000               → epoch millis (number or numeric string)
 *   "2024-06-10T22:30:00Z"      → instant
 *   "2024-06-10T17:30:00-05:00" → offset date-time
 *   "2024-06-10T22:30:00"       → local date-time, read as UTC
 *   "2024-06-10"                → start of day UTC
 * Anything else is empty.
 */
public final class Timestamps {

    private static final DateTimeFormatter ISO_LENIENT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private Timestamps() {}

    public static Optional<Instant> parse(Object value) {
        Object normalized = EmptinessNormalizer.normalize(value);
        if (normalized instanceof Number n) {
            return Optional.of(Instant.ofEpochMilli(n.longValue()));
        }
        if (!(normalized instanceof String s)) {
            return Optional.empty();
        }
        String text = s.trim();
        try {
            if (text.chars().allMatch(Character::isDigit)) {
                return Optional.of(Instant.ofEpochMilli(Long.parseLong(text)));
            }
            TemporalAccessor parsed = ISO_LENIENT.parseBest(text,
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offset) {
                return Optional.of(offset.toInstant());
            }
            if (parsed instanceof LocalDateTime local) {
                return Optional.of(local.toInstant(ZoneOffset.UTC));
            }
            return Optional.of(((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException | NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static Optional<Long> toEpochMillis(Object value) {
        return parse(value).map(Instant::toEpochMilli);
    }

    /** UTC ISO-8601 with millisecond precision, e.g. 2024-06-10T22:30:00.000Z. */
    public static String toIso(long epochMillis) {
        return ISO_MILLIS.format(Instant.ofEpochMilli(epochMillis));
    }
}
