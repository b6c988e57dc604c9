package com.forecastsentinel.core.prepare;

import com.forecastsentinel.core.model.DataPoint;
import com.forecastsentinel.core.model.Frequency;
import com.forecastsentinel.core.model.SeriesPoint;
import com.forecastsentinel.core.model.Timestamps;
import com.forecastsentinel.core.model.TimeSeries;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Turns validated input into the canonical {@link TimeSeries} and derives the
 * series' {@link Frequency} and default season length.
 *
 * <h3>Frequency inference</h3>
 * <p>
 * The median gap between consecutive observations is classified as follows
 * (whole days are the floored gap in days):
 * </p>
 * <table>
 * <caption>Median gap classes</caption>
 * <tr><th>median gap</th><th>frequency</th></tr>
 * <tr><td>&lt; 1 hour</td><td>sub-hourly</td></tr>
 * <tr><td>1 hour to &lt; 1 day</td><td>hourly</td></tr>
 * <tr><td>1 whole day</td><td>daily</td></tr>
 * <tr><td>2 to 8 days</td><td>weekly</td></tr>
 * <tr><td>9 to 32 days</td><td>monthly</td></tr>
 * <tr><td>33 to 100 days</td><td>quarterly</td></tr>
 * <tr><td>&gt; 100 days</td><td>yearly</td></tr>
 * </table>
 * <p>
 * The classification is monotonic in the median gap. It is a heuristic for
 * irregular real-world spacing, not a calendar reconstruction.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesPreparer {

    /** Season length used when the frequency is unknown. */
    public static final int FALLBACK_SEASON_LENGTH = 7;

    private static final long SECONDS_PER_HOUR = 3_600L;
    private static final long SECONDS_PER_DAY = 86_400L;

    private SeriesPreparer() {
        // utility class, not instantiable
    }

    /**
     * Parse and sort validated input. Call
     * {@link SeriesValidator#validate(List)} first.
     *
     * @param data validated raw points
     * @return canonical series in ascending time order
     */
    public static TimeSeries prepare(List<DataPoint> data) {
        List<SeriesPoint> points = new ArrayList<>(data.size());
        for (DataPoint point : data) {
            points.add(new SeriesPoint(Timestamps.parse(point.getDate()), point.getValue()));
        }
        // List.sort is stable
        points.sort(Comparator.comparing(SeriesPoint::getTimestamp));
        return new TimeSeries(points);
    }

    /**
     * Median spacing between consecutive observations.
     *
     * @param series canonical series
     * @return the median gap, or {@link Duration#ZERO} with fewer than 2 points
     */
    public static Duration medianGap(TimeSeries series) {
        int gaps = series.size() - 1;
        if (gaps < 1) {
            return Duration.ZERO;
        }
        long[] millis = new long[gaps];
        for (int i = 0; i < gaps; i++) {
            millis[i] = Duration.between(series.get(i).getTimestamp(),
                    series.get(i + 1).getTimestamp()).toMillis();
        }
        Arrays.sort(millis);
        long median = gaps % 2 == 1
                ? millis[gaps / 2]
                : (millis[gaps / 2 - 1] + millis[gaps / 2]) / 2;
        return Duration.ofMillis(median);
    }

    /**
     * Classify the series' median gap.
     *
     * @param series canonical series
     * @return inferred frequency; {@link Frequency#DAILY} with fewer than 2 points
     */
    public static Frequency inferFrequency(TimeSeries series) {
        if (series.size() < 2) {
            return Frequency.DAILY;
        }
        return classifyGap(medianGap(series));
    }

    /**
     * Classify a single gap. Exposed for monotonicity checks.
     *
     * @param gap median gap
     * @return frequency class
     */
    public static Frequency classifyGap(Duration gap) {
        long seconds = gap.getSeconds();
        if (seconds < SECONDS_PER_HOUR) {
            return Frequency.SUB_HOURLY;
        }
        if (seconds < SECONDS_PER_DAY) {
            return Frequency.HOURLY;
        }
        long days = seconds / SECONDS_PER_DAY;
        if (days <= 1) {
            return Frequency.DAILY;
        }
        if (days <= 8) {
            return Frequency.WEEKLY;
        }
        if (days <= 32) {
            return Frequency.MONTHLY;
        }
        if (days <= 100) {
            return Frequency.QUARTERLY;
        }
        return Frequency.YEARLY;
    }

    /**
     * Number of periods per seasonal cycle implied by a frequency.
     *
     * @param frequency inferred frequency, may be {@code null}
     * @return season length; {@value #FALLBACK_SEASON_LENGTH} for {@code null}
     */
    public static int defaultSeasonLength(Frequency frequency) {
        if (frequency == null) {
            return FALLBACK_SEASON_LENGTH;
        }
        return switch (frequency) {
            // sub-hourly data has no table entry of its own and borrows the hourly cycle
            case SUB_HOURLY, HOURLY -> 24;
            case DAILY -> 7;
            case WEEKLY -> 52;
            case MONTHLY -> 12;
            case QUARTERLY -> 4;
            case YEARLY -> 1;
        };
    }

    /**
     * @param requested caller-supplied season length, may be {@code null}
     * @param frequency inferred frequency
     * @return {@code requested} when present, the frequency default otherwise
     */
    public static int resolveSeasonLength(Integer requested, Frequency frequency) {
        return requested != null ? requested : defaultSeasonLength(frequency);
    }
}
