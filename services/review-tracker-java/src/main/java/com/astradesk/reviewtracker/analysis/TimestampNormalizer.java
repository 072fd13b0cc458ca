package com.astradesk.reviewtracker.analysis;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parses the ISO-8601 flavours emitted by Jira ({@code 2024-01-15T10:30:00.000+0000},
 * {@code ...Z}, {@code ...+00:00}) into comparable instants.
 */
public final class TimestampNormalizer {

    private static final Pattern COMPACT_OFFSET = Pattern.compile("([+-])(\\d{2})(\\d{2})$");

    private TimestampNormalizer() {
    }

    public static OffsetDateTime parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedTimestampException(raw);
        }
        String value = normalize(raw.trim());
        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeParseException ex) {
            throw new MalformedTimestampException(raw, ex);
        }
    }

    public static Instant toInstant(String raw) {
        return parse(raw).toInstant();
    }

    static String normalize(String value) {
        if (value.endsWith("Z") || value.endsWith("z")) {
            return value.substring(0, value.length() - 1) + "+00:00";
        }
        return COMPACT_OFFSET.matcher(value).replaceFirst("$1$2:$3");
    }
}
