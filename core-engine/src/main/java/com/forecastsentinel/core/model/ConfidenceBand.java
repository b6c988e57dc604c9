package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Acceptance band of one historical point, emitted when confidence bands are
 * requested.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"date", "lower", "upper"})
public final class ConfidenceBand implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String date;
    private final double lower;
    private final double upper;

    public ConfidenceBand(String date, double lower, double upper) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.lower = lower;
        this.upper = upper;
    }

    public String getDate() {
        return date;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ConfidenceBand that))
            return false;
        return date.equals(that.date)
                && Double.compare(lower, that.lower) == 0
                && Double.compare(upper, that.upper) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, lower, upper);
    }

    @Override
    public String toString() {
        return "ConfidenceBand{" + date + " [" + lower + ", " + upper + "]}";
    }
}
