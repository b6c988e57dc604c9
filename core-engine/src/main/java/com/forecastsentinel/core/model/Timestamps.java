package com.forecastsentinel.core.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parsing and rendering of the date strings exchanged with callers.
 *
 * <h3>Accepted forms</h3>
 * <ul>
 * <li>{@code 2024-01-31}</li>
 * <li>{@code 2024-01-31T13:45}, {@code 2024-01-31T13:45:10.250}</li>
 * <li>{@code 2024-01-31 13:45:10}</li>
 * <li>{@code 2024-01-31T13:45:10Z}, {@code 2024-01-31T13:45:10+02:00},
 * {@code 2024-01-31T13:45:10+01:00[Europe/Paris]} (normalized to UTC)</li>
 * </ul>
 *
 * <p>
 * Parsing normalizes every form to a {@link LocalDateTime}, so
 * {@code 2024-01-31} and {@code 2024-01-31T00:00} denote the same instant.
 * </p>
 *
 * @since 1.0.0
 */
public final class Timestamps {

    private Timestamps() {
        // utility class, not instantiable
    }

    /**
     * Parse a caller-supplied date string.
     *
     * @param text the date string
     * @return the normalized local date-time
     * @throws DateTimeParseException if no accepted form matches
     */
    public static LocalDateTime parse(String text) {
        if (text == null || text.isBlank()) {
            throw new DateTimeParseException("Date must not be blank", String.valueOf(text), 0);
        }
        String trimmed = text.trim();

        if (trimmed.length() == 10) {
            return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay();
        }

        String isoLike = trimmed.length() > 10 && trimmed.charAt(10) == ' '
                ? trimmed.substring(0, 10) + 'T' + trimmed.substring(11)
                : trimmed;

        try {
            return LocalDateTime.parse(isoLike, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        } catch (DateTimeParseException localFailure) {
            try {
                return OffsetDateTime.parse(isoLike, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                        .withOffsetSameInstant(ZoneOffset.UTC)
                        .toLocalDateTime();
            } catch (DateTimeParseException offsetFailure) {
                return ZonedDateTime.parse(isoLike, DateTimeFormatter.ISO_ZONED_DATE_TIME)
                        .withZoneSameInstant(ZoneOffset.UTC)
                        .toLocalDateTime();
            }
        }
    }

    /**
     * Render a timestamp as a date label: {@code yyyy-MM-dd} at midnight,
     * ISO local date-time otherwise.
     *
     * @param timestamp the timestamp; must not be {@code null}
     * @return the label
     */
    public static String label(LocalDateTime timestamp) {
        if (timestamp.toLocalTime().equals(LocalTime.MIDNIGHT)) {
            return timestamp.toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        return timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
