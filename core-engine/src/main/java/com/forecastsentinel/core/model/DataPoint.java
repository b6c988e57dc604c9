package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * A raw observation as received from the caller: an unparsed date string and a
 * value.
 *
 * <p>
 * The value is boxed so that a non-numeric input can be represented as
 * {@code null} and rejected by
 * {@link com.forecastsentinel.core.prepare.SeriesValidator} instead of failing
 * earlier with an opaque error.
 * </p>
 *
 * @since 1.0.0
 */
public final class DataPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String date;
    private final Double value;

    @JsonCreator
    public DataPoint(@JsonProperty("date") String date, @JsonProperty("value") Double value) {
        this.date = date;
        this.value = value;
    }

    public static DataPoint of(String date, double value) {
        return new DataPoint(date, value);
    }

    public String getDate() {
        return date;
    }

    public Double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataPoint that))
            return false;
        return Objects.equals(date, that.date) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, value);
    }

    @Override
    public String toString() {
        return "DataPoint{date='" + date + "', value=" + value + '}';
    }
}
