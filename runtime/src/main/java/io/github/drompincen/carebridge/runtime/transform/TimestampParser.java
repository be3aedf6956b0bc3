package io.github.drompincen.carebridge.runtime.transform;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Normalizes the timestamp shapes devices write into UTC instants. Values without a zone are
 * read as UTC.
 */
public final class TimestampParser {

    private static final DateTimeFormatter SQL_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<Function<String, Instant>> PARSERS = List.of(
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> ZonedDateTime.parse(s).toInstant(),
            Instant::parse,
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
            s -> LocalDateTime.parse(s, SQL_DATE_TIME).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private TimestampParser() {}

    public static Instant fromEpochMillis(long millis) {
        return Instant.ofEpochMilli(millis);
    }

    /**
     * @return the instant, or null for a null or blank value
     * @throws DateTimeParseException when no supported format matches
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        if (isDigits(text)) {
            try {
                return fromEpochMillis(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw new DateTimeParseException("Epoch value out of range", text, 0, e);
            }
        }
        DateTimeParseException lastFailure = null;
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        throw new DateTimeParseException("Unsupported timestamp format", text, 0, lastFailure);
    }

    private static boolean isDigits(String text) {
        int start = text.startsWith("-") ? 1 : 0;
        if (start == text.length()) return false;
        for (int i = start; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) return false;
        }
        return true;
    }
}
