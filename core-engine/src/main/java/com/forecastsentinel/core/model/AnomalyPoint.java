package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * A historical observation flagged as anomalous.
 *
 * <p>
 * {@code deviation} is the distance from the band midpoint measured in
 * half-band widths, so a value sitting exactly on a bound has deviation 1.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"date", "value", "severity", "expectedRange", "deviation"})
public final class AnomalyPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String date;
    private final double value;
    private final Severity severity;
    private final ExpectedRange expectedRange;
    private final double deviation;

    public AnomalyPoint(String date, double value, Severity severity, ExpectedRange expectedRange,
            double deviation) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.value = value;
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.expectedRange = Objects.requireNonNull(expectedRange, "expectedRange must not be null");
        this.deviation = deviation;
    }

    public String getDate() {
        return date;
    }

    public double getValue() {
        return value;
    }

    public Severity getSeverity() {
        return severity;
    }

    public ExpectedRange getExpectedRange() {
        return expectedRange;
    }

    public double getDeviation() {
        return deviation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(deviation, that.deviation) == 0
                && date.equals(that.date)
                && severity == that.severity
                && expectedRange.equals(that.expectedRange);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, value, severity, expectedRange, deviation);
    }

    @Override
    public String toString() {
        return "AnomalyPoint{" +
                "date='" + date + '\'' +
                ", value=" + value +
                ", severity=" + severity +
                ", expectedRange=" + expectedRange +
                ", deviation=" + deviation +
                '}';
    }
}
