package com.forecastsentinel.core.model;

/**
 * Coarse classification of the median spacing between observations.
 *
 * <p>
 * This is a heuristic label for noisy real-world gaps, not a calendar unit:
 * a series with a median gap of 31 days is {@link #MONTHLY} even though months
 * differ in length.
 * </p>
 *
 * @since 1.0.0
 */
public enum Frequency {
    SUB_HOURLY,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY,
    QUARTERLY,
    YEARLY
}
