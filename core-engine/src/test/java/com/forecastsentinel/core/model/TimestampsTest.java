package com.forecastsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Timestamps}.
 */
class TimestampsTest {

    @Test
    @DisplayName("Should parse a plain date as midnight")
    void shouldParsePlainDate() {
        assertThat(Timestamps.parse("2024-03-05")).isEqualTo(LocalDateTime.of(2024, 3, 5, 0, 0));
    }

    @Test
    @DisplayName("Should treat a date and its midnight date-time as the same instant")
    void shouldNormalizeMidnight() {
        assertThat(Timestamps.parse("2024-01-01T00:00")).isEqualTo(Timestamps.parse("2024-01-01"));
    }

    @Test
    @DisplayName("Should accept a space between date and time")
    void shouldAcceptSpaceSeparator() {
        assertThat(Timestamps.parse("2024-01-01 13:45:10"))
                .isEqualTo(LocalDateTime.of(2024, 1, 1, 13, 45, 10));
    }

    @Test
    @DisplayName("Should convert offset and zoned forms to UTC")
    void shouldConvertOffsetsToUtc() {
        assertThat(Timestamps.parse("2024-01-01T02:00:00+02:00"))
                .isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));
        assertThat(Timestamps.parse("2024-01-01T10:00:00Z"))
                .isEqualTo(LocalDateTime.of(2024, 1, 1, 10, 0));
    }

    @Test
    @DisplayName("Should reject malformed and blank dates")
    void shouldRejectMalformedDates() {
        assertThatThrownBy(() -> Timestamps.parse("05/03/2024")).isInstanceOf(DateTimeParseException.class);
        assertThatThrownBy(() -> Timestamps.parse("2024-13-01")).isInstanceOf(DateTimeParseException.class);
        assertThatThrownBy(() -> Timestamps.parse(" ")).isInstanceOf(DateTimeParseException.class);
    }

    @Test
    @DisplayName("Should label midnight as a date and other times as date-time")
    void shouldRenderLabels() {
        assertThat(Timestamps.label(LocalDateTime.of(2024, 2, 29, 0, 0))).isEqualTo("2024-02-29");
        assertThat(Timestamps.label(LocalDateTime.of(2024, 2, 29, 6, 30))).isEqualTo("2024-02-29T06:30:00");
    }
}
