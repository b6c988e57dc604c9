package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single forecast row: the future timestamp and the model's point estimate.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"date", "value"})
public final class ForecastPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDateTime timestamp;
    private final double value;

    public ForecastPoint(LocalDateTime timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    @JsonIgnore
    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    @JsonProperty("date")
    public String getDate() {
        return Timestamps.label(timestamp);
    }

    @JsonProperty("value")
    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ForecastPoint that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "ForecastPoint{" + getDate() + '=' + value + '}';
    }
}
