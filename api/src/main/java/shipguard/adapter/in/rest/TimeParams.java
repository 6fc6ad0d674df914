package shipguard.adapter.in.rest;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Parses time-range query parameters. Accepts ISO-8601 instants and plain
 * dates; a plain date as a range end covers the whole day.
 */
final class TimeParams {

    private TimeParams() {}

    static Instant parseStart(String name, String value) {
        return parse(name, value, false);
    }

    static Instant parseEnd(String name, String value) {
        return parse(name, value, true);
    }

    private static Instant parse(String name, String value, boolean endOfDay) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            if (value.length() == 10) {
                final var date = LocalDate.parse(value);
                return endOfDay
                        ? date.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC).minusMillis(1)
                        : date.atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }
}
