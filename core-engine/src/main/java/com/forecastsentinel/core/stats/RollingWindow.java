package com.forecastsentinel.core.stats;

import org.apache.commons.math3.stat.StatUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Windowed aggregate over a value sequence.
 *
 * <h3>Frames</h3>
 * <p>
 * A trailing window of size {@code W} covers {@code [i - W + 1, i]}. A centered
 * window covers {@code [i - W/2, i + (W - 1) - W/2]} (integer division), so an
 * even window reaches one index further back than forward. Frames are clipped
 * to the sequence.
 * </p>
 *
 * <h3>Undefined values</h3>
 * <p>
 * An aggregate is {@link OptionalDouble#empty() empty} when the clipped frame
 * holds fewer than {@code minPeriods} values. The sample standard deviation
 * additionally needs at least two values.
 * </p>
 *
 * @since 1.0.0
 */
public final class RollingWindow {

    private final int size;
    private final boolean center;
    private final int minPeriods;

    /**
     * @param size       window length; must be &gt;= 1
     * @param center     {@code true} to center the window on each index
     * @param minPeriods minimum values per frame; must be in [1, size]
     * @throws IllegalArgumentException on invalid arguments
     */
    public RollingWindow(int size, boolean center, int minPeriods) {
        if (size < 1) {
            throw new IllegalArgumentException("window size must be >= 1, got: " + size);
        }
        if (minPeriods < 1 || minPeriods > size) {
            throw new IllegalArgumentException(
                    "minPeriods must be in [1, " + size + "], got: " + minPeriods);
        }
        this.size = size;
        this.center = center;
        this.minPeriods = minPeriods;
    }

    public int getSize() {
        return size;
    }

    public boolean isCenter() {
        return center;
    }

    public int getMinPeriods() {
        return minPeriods;
    }

    /**
     * @param values sequence to aggregate
     * @return one rolling mean per index
     */
    public List<OptionalDouble> mean(double[] values) {
        List<OptionalDouble> out = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            int start = frameStart(i);
            int length = frameEnd(i, values.length) - start;
            out.add(length >= minPeriods
                    ? OptionalDouble.of(StatUtils.mean(values, start, length))
                    : OptionalDouble.empty());
        }
        return out;
    }

    /**
     * @param values sequence to aggregate
     * @return one rolling sample standard deviation (n - 1 denominator) per index
     */
    public List<OptionalDouble> standardDeviation(double[] values) {
        int required = Math.max(minPeriods, 2);
        List<OptionalDouble> out = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            int start = frameStart(i);
            int length = frameEnd(i, values.length) - start;
            out.add(length >= required
                    ? OptionalDouble.of(Math.sqrt(StatUtils.variance(values, start, length)))
                    : OptionalDouble.empty());
        }
        return out;
    }

    /** Inclusive start of the clipped frame for {@code index}. */
    int frameStart(int index) {
        return Math.max(0, index + 1 + offset() - size);
    }

    /** Exclusive end of the clipped frame for {@code index}. */
    int frameEnd(int index, int length) {
        return Math.min(length, index + 1 + offset());
    }

    private int offset() {
        return center ? (size - 1) / 2 : 0;
    }

    @Override
    public String toString() {
        return "RollingWindow{size=" + size + ", center=" + center + ", minPeriods=" + minPeriods + '}';
    }
}
