package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Objects;

/**
 * Closed acceptance band {@code [lower, upper]} for one observation.
 *
 * @since 1.0.0
 */
public final class ExpectedRange implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double lower;
    private final double upper;

    public ExpectedRange(double lower, double upper) {
        this.lower = lower;
        this.upper = upper;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    @JsonIgnore
    public double midpoint() {
        return (upper + lower) / 2;
    }

    /** Half of the band width; zero for a degenerate band. */
    @JsonIgnore
    public double halfWidth() {
        return (upper - lower) / 2;
    }

    /**
     * @param value observation
     * @return {@code true} if {@code value} lies strictly outside the band
     */
    public boolean excludes(double value) {
        return value < lower || value > upper;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ExpectedRange that))
            return false;
        return Double.compare(lower, that.lower) == 0 && Double.compare(upper, that.upper) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper);
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + ']';
    }
}
