package com.shardmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Date coercion for transformation chains. Dates travel between operators as ISO-8601 instant strings.
 * <p>
 * Accepted inputs: epoch milliseconds, ISO instants, offset and zoned date-times, local date-times
 * (read in the configured zone), plain dates (read as UTC midnight) and RFC 1123 strings.
 */
final class JsDates {
    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final double MAX_EPOCH_MILLIS = 8.64e15;

    private JsDates() {
    }

    static Optional<Instant> parse(JsonNode value, ZoneId zone) {
        if (JsValues.isNullish(value)) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            double millis = value.doubleValue();
            if (!Double.isFinite(millis) || Math.abs(millis) > MAX_EPOCH_MILLIS) {
                return Optional.empty();
            }
            return Optional.of(Instant.ofEpochMilli((long) millis));
        }
        if (value.isTextual()) {
            return parseText(value.textValue().trim(), zone);
        }
        return Optional.empty();
    }

    private static Optional<Instant> parseText(String text, ZoneId zone) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        return attempt(() -> Instant.parse(text))
                .or(() -> attempt(() -> OffsetDateTime.parse(text).toInstant()))
                .or(() -> attempt(() -> ZonedDateTime.parse(text).toInstant()))
                .or(() -> attempt(() -> LocalDateTime.parse(text.replace(' ', 'T')).atZone(zone).toInstant()))
                .or(() -> attempt(() -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant()))
                .or(() -> attempt(() -> ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant()));
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static String toIsoString(Instant instant) {
        return ISO_MILLIS.format(instant);
    }

    static ZonedDateTime inZone(Instant instant, ZoneId zone) {
        return instant.atZone(zone);
    }

    /**
     * Substitutes the first occurrence of each of {@code YYYY MM DD HH mm ss}.
     */
    static String format(Instant instant, String pattern, ZoneId zone) {
        ZonedDateTime at = inZone(instant, zone);
        return pattern
                .replaceFirst("YYYY", Integer.toString(at.getYear()))
                .replaceFirst("MM", pad(at.getMonthValue()))
                .replaceFirst("DD", pad(at.getDayOfMonth()))
                .replaceFirst("HH", pad(at.getHour()))
                .replaceFirst("mm", pad(at.getMinute()))
                .replaceFirst("ss", pad(at.getSecond()));
    }

    static Optional<Instant> plusDays(Instant instant, long days, ZoneId zone) {
        try {
            return Optional.of(inZone(instant, zone).plusDays(days).toInstant());
        } catch (DateTimeException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    private static String pad(int n) {
        return n < 10 ? "0" + n : Integer.toString(n);
    }
}
