package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.model.Frequency;
import com.forecastsentinel.core.model.TimeSeries;
import com.forecastsentinel.core.prepare.SeriesPreparer;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Timestamps of the future rows of a forecast.
 *
 * <p>
 * Calendar frequencies are anchored to period ends: weeks end on Sunday,
 * months, quarters and years on their last day. The first future date is the
 * first anchor strictly after the last observation. Time of day is kept.
 * </p>
 *
 * @since 1.0.0
 */
public final class FutureDates {

    private FutureDates() {
        // utility class, not instantiable
    }

    /**
     * @param series    the observed series, at least one point
     * @param frequency inferred frequency
     * @param horizon   number of dates, &gt;= 1
     * @return {@code horizon} strictly increasing dates after the last observation
     */
    public static List<LocalDateTime> after(TimeSeries series, Frequency frequency, int horizon) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(frequency, "frequency must not be null");
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be >= 1, got: " + horizon);
        }

        LocalDateTime last = series.last().getTimestamp();
        List<LocalDateTime> dates = new ArrayList<>(horizon);
        Duration step = frequency == Frequency.SUB_HOURLY ? subHourlyStep(series) : Duration.ZERO;
        LocalDateTime current = last;
        for (int i = 0; i < horizon; i++) {
            current = next(current, frequency, step);
            dates.add(current);
        }
        return dates;
    }

    private static LocalDateTime next(LocalDateTime current, Frequency frequency, Duration step) {
        return switch (frequency) {
            case SUB_HOURLY -> current.plus(step);
            case HOURLY -> current.plusHours(1);
            case DAILY -> current.plusDays(1);
            case WEEKLY -> current.with(TemporalAdjusters.next(DayOfWeek.SUNDAY));
            case MONTHLY -> withDate(current, monthEndAfter(current.toLocalDate()));
            case QUARTERLY -> withDate(current, quarterEndAfter(current.toLocalDate()));
            case YEARLY -> withDate(current, yearEndAfter(current.toLocalDate()));
        };
    }

    private static Duration subHourlyStep(TimeSeries series) {
        Duration gap = SeriesPreparer.medianGap(series);
        return gap.isZero() || gap.isNegative() ? Duration.ofMinutes(1) : gap;
    }

    private static LocalDateTime withDate(LocalDateTime current, LocalDate date) {
        return date.atTime(current.toLocalTime());
    }

    static LocalDate monthEndAfter(LocalDate date) {
        LocalDate end = date.with(TemporalAdjusters.lastDayOfMonth());
        return end.isAfter(date) ? end : date.plusMonths(1).with(TemporalAdjusters.lastDayOfMonth());
    }

    static LocalDate quarterEndAfter(LocalDate date) {
        int quarterEndMonth = ((date.getMonthValue() - 1) / 3 + 1) * 3;
        LocalDate end = date.withMonth(quarterEndMonth).with(TemporalAdjusters.lastDayOfMonth());
        return end.isAfter(date) ? end : date.plusMonths(3).with(TemporalAdjusters.lastDayOfMonth());
    }

    static LocalDate yearEndAfter(LocalDate date) {
        LocalDate end = date.with(TemporalAdjusters.lastDayOfYear());
        return end.isAfter(date) ? end : date.plusYears(1).with(TemporalAdjusters.lastDayOfYear());
    }
}
