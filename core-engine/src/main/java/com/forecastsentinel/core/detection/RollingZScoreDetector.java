package com.forecastsentinel.core.detection;

import com.forecastsentinel.core.model.AnomalyPoint;
import com.forecastsentinel.core.model.AnomalyResult;
import com.forecastsentinel.core.model.ConfidenceBand;
import com.forecastsentinel.core.model.ExpectedRange;
import com.forecastsentinel.core.model.ModelCatalogue;
import com.forecastsentinel.core.model.SeriesPoint;
import com.forecastsentinel.core.model.Sensitivity;
import com.forecastsentinel.core.model.TimeSeries;
import com.forecastsentinel.core.stats.RollingWindow;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Rolling z-score anomaly detector.
 *
 * <p>
 * Each observation is compared with a band of {@code mean ± z·std} computed
 * over a centered window of {@code min(2m, N)} points ({@code N} points if that
 * is below 3), where {@code z} is the two-sided normal critical value for the
 * sensitivity's confidence level. Observations strictly outside the band are
 * anomalies.
 * </p>
 *
 * <h3>Degenerate windows</h3>
 * <p>
 * A window of identical values has zero spread: its band collapses to the
 * value itself, so no point in it can be flagged, and the deviation of a
 * zero-width band is reported as 0. Points whose window holds a single value
 * have no band at all and are never flagged.
 * </p>
 *
 * @since 1.0.0
 */
public class RollingZScoreDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RollingZScoreDetector.class);

    public static final String MODEL_NAME = ModelCatalogue.ANOMALY_MODEL;

    /** Windows shorter than this fall back to the whole series. */
    static final int MIN_WINDOW = 3;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    @Override
    public AnomalyResult detect(TimeSeries series, Sensitivity sensitivity, int seasonLength,
            boolean showConfidenceBands) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(sensitivity, "sensitivity must not be null");
        if (seasonLength < 1) {
            throw new IllegalArgumentException("seasonLength must be >= 1, got: " + seasonLength);
        }

        long started = System.nanoTime();
        int windowSize = windowSize(series.size(), seasonLength);
        double z = criticalValue(sensitivity);

        double[] values = series.values();
        RollingWindow window = new RollingWindow(windowSize, true, 1);
        List<OptionalDouble> means = window.mean(values);
        List<OptionalDouble> deviations = window.standardDeviation(values);

        AnomalyResult.Builder builder = AnomalyResult.builder();
        List<ConfidenceBand> bands = showConfidenceBands ? new ArrayList<>() : null;

        for (int i = 0; i < values.length; i++) {
            OptionalDouble mean = means.get(i);
            OptionalDouble std = deviations.get(i);
            if (mean.isEmpty() || std.isEmpty()) {
                continue;
            }
            SeriesPoint point = series.get(i);
            ExpectedRange range = new ExpectedRange(
                    mean.getAsDouble() - z * std.getAsDouble(),
                    mean.getAsDouble() + z * std.getAsDouble());
            if (bands != null) {
                bands.add(new ConfidenceBand(point.getDate(), range.getLower(), range.getUpper()));
            }
            if (range.excludes(point.getValue())) {
                double deviation = deviation(point.getValue(), range);
                builder.addAnomaly(new AnomalyPoint(point.getDate(), point.getValue(),
                        SeverityClassifier.classify(deviation, sensitivity), range, deviation));
            }
        }

        double elapsedMs = (System.nanoTime() - started) / 1_000_000.0;
        AnomalyResult result = builder
                .totalPoints(series.size())
                .confidenceBands(bands)
                .modelUsed(MODEL_NAME)
                .sensitivity(sensitivity)
                .computationTimeMs(elapsedMs)
                .build();
        LOG.debug("Window {} (z={}) flagged {} of {} points", windowSize, z,
                result.getAnomalyCount(), result.getTotalPoints());
        return result;
    }

    @Override
    public String getModelName() {
        return MODEL_NAME;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static int windowSize(int seriesLength, int seasonLength) {
        int size = Math.min(2 * seasonLength, seriesLength);
        return size < MIN_WINDOW ? seriesLength : size;
    }

    static double criticalValue(Sensitivity sensitivity) {
        return STANDARD_NORMAL.inverseCumulativeProbability((1 + sensitivity.getConfidenceLevel() / 100.0) / 2);
    }

    static double deviation(double value, ExpectedRange range) {
        double halfWidth = range.halfWidth();
        return halfWidth > 0 ? Math.abs(value - range.midpoint()) / halfWidth : 0;
    }
}
