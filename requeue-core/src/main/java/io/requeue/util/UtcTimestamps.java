package io.requeue.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;

/**
 * Parses the timestamp strings delivered by queue runtimes.
 *
 * <p>Runtimes are inconsistent about zone information: some send {@code 2024-01-01T00:05:00Z},
 * others {@code 2024-01-01T00:05:00+01:00} or a bare local date-time. A bare value is read
 * as UTC.
 */
public final class UtcTimestamps {
    private static final DateTimeFormatter OPTIONAL_OFFSET = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .toFormatter();

    private UtcTimestamps() {
    }

    /**
     * Parses an ISO-8601 timestamp, treating zone-less values as UTC.
     *
     * @param text the timestamp text
     * @return the instant it denotes
     * @throws NullPointerException     if {@code text} is null
     * @throws IllegalArgumentException if {@code text} is not an ISO-8601 date-time
     */
    public static Instant parse(String text) {
        Objects.requireNonNull(text, "text");
        TemporalAccessor parsed;
        try {
            parsed = OPTIONAL_OFFSET.parseBest(text.trim(), OffsetDateTime::from, LocalDateTime::from);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not an ISO-8601 timestamp: " + text, e);
        }
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }

    /**
     * Formats an instant as an ISO-8601 UTC timestamp ({@code ...Z}).
     */
    public static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(Objects.requireNonNull(instant, "instant"));
    }
}
