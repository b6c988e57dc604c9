package com.forecastsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Canonical univariate series: strictly ascending, unique timestamps.
 *
 * <p>
 * Instances are produced by
 * {@link com.forecastsentinel.core.prepare.SeriesPreparer}; the constructor
 * re-checks the ordering so that no component can receive an unsorted series.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Immutable and therefore safe to share.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<SeriesPoint> points;

    /**
     * @param points the observations in ascending timestamp order
     * @throws NullPointerException     if {@code points} or an element is
     *                                  {@code null}
     * @throws IllegalArgumentException if timestamps are not strictly ascending
     */
    public TimeSeries(List<SeriesPoint> points) {
        Objects.requireNonNull(points, "points must not be null");
        List<SeriesPoint> copy = new ArrayList<>(points.size());
        LocalDateTime previous = null;
        for (SeriesPoint point : points) {
            Objects.requireNonNull(point, "series point must not be null");
            if (previous != null && !point.getTimestamp().isAfter(previous)) {
                throw new IllegalArgumentException(
                        "Series timestamps must be strictly ascending: " + previous
                                + " followed by " + point.getTimestamp());
            }
            previous = point.getTimestamp();
            copy.add(point);
        }
        this.points = Collections.unmodifiableList(copy);
    }

    public List<SeriesPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public SeriesPoint get(int index) {
        return points.get(index);
    }

    public SeriesPoint last() {
        if (points.isEmpty()) {
            throw new IllegalStateException("Series is empty");
        }
        return points.get(points.size() - 1);
    }

    /**
     * @return a fresh array of the values in series order
     */
    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeries that))
            return false;
        return points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "TimeSeries{size=" + points.size() + '}';
    }
}
