package com.forecastsentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Lower and upper prediction bounds for one confidence level, index-aligned
 * with the forecast rows.
 *
 * @since 1.0.0
 */
public final class ConfidenceInterval implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int level;
    private final List<Double> lower;
    private final List<Double> upper;

    /**
     * @param level confidence level in percent
     * @param lower lower bounds, one per forecast row
     * @param upper upper bounds, one per forecast row
     * @throws IllegalArgumentException if the bound sequences differ in length
     */
    public ConfidenceInterval(int level, List<Double> lower, List<Double> upper) {
        Objects.requireNonNull(lower, "lower bounds must not be null");
        Objects.requireNonNull(upper, "upper bounds must not be null");
        if (lower.size() != upper.size()) {
            throw new IllegalArgumentException("Bound sequences differ in length for level "
                    + level + ": " + lower.size() + " vs " + upper.size());
        }
        this.level = level;
        this.lower = List.copyOf(lower);
        this.upper = List.copyOf(upper);
    }

    public int getLevel() {
        return level;
    }

    public List<Double> getLower() {
        return lower;
    }

    public List<Double> getUpper() {
        return upper;
    }

    /** Label of the upper sequence on the wire, e.g. {@code upper_95}. */
    public String upperLabel() {
        return "upper_" + level;
    }

    /** Label of the lower sequence on the wire, e.g. {@code lower_95}. */
    public String lowerLabel() {
        return "lower_" + level;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ConfidenceInterval that))
            return false;
        return level == that.level && lower.equals(that.lower) && upper.equals(that.upper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, lower, upper);
    }

    @Override
    public String toString() {
        return "ConfidenceInterval{level=" + level + ", rows=" + lower.size() + '}';
    }
}
