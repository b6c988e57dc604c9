package com.forecastsentinel.core.prepare;

import com.forecastsentinel.core.error.DataValidationException;
import com.forecastsentinel.core.model.DataPoint;
import com.forecastsentinel.core.model.Timestamps;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural gate for raw input series.
 *
 * <p>
 * Rejects a candidate series when any of the following holds:
 * </p>
 * <ul>
 * <li>fewer than {@value #MIN_POINTS} points</li>
 * <li>a value is missing (non-numeric), NaN or infinite</li>
 * <li>a date fails to parse, see {@link Timestamps#parse(String)}</li>
 * <li>two points share the same normalized date</li>
 * </ul>
 *
 * <p>
 * Produces no output and has no side effects.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesValidator {

    /** Smallest series any computation accepts. */
    public static final int MIN_POINTS = 2;

    private SeriesValidator() {
        // utility class, not instantiable
    }

    /**
     * @param data candidate series
     * @throws DataValidationException if the series violates an invariant
     */
    public static void validate(List<DataPoint> data) {
        if (data == null || data.size() < MIN_POINTS) {
            throw new DataValidationException("Need at least " + MIN_POINTS + " data points");
        }

        for (DataPoint point : data) {
            if (point == null) {
                throw new DataValidationException("Data point must not be null");
            }
            Double value = point.getValue();
            if (value == null || value.isNaN() || value.isInfinite()) {
                throw new DataValidationException(
                        "Invalid value at " + point.getDate() + ": " + value);
            }
        }

        Set<LocalDateTime> seen = new HashSet<>();
        for (DataPoint point : data) {
            LocalDateTime timestamp;
            try {
                timestamp = Timestamps.parse(point.getDate());
            } catch (DateTimeParseException e) {
                throw new DataValidationException("Invalid date format: " + e.getMessage(), e);
            }
            if (!seen.add(timestamp)) {
                throw new DataValidationException("Duplicate dates found in data: " + point.getDate());
            }
        }
    }
}
