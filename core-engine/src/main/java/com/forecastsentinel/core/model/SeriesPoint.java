package com.forecastsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A validated observation of the canonical series.
 *
 * @since 1.0.0
 */
public final class SeriesPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDateTime timestamp;
    private final double value;

    public SeriesPoint(LocalDateTime timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return the date label of this point, see {@link Timestamps#label}
     */
    public String getDate() {
        return Timestamps.label(timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesPoint that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "SeriesPoint{" + timestamp + '=' + value + '}';
    }
}
