package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.error.ComputationException;
import com.forecastsentinel.core.model.ConfidenceInterval;
import com.forecastsentinel.core.model.ForecastMetrics;
import com.forecastsentinel.core.model.ForecastModel;
import com.forecastsentinel.core.model.ForecastPoint;
import com.forecastsentinel.core.model.ForecastResult;
import com.forecastsentinel.core.model.Frequency;
import com.forecastsentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Fits the selected model to a prepared series and assembles the
 * {@link ForecastResult}.
 *
 * <h3>Confidence levels</h3>
 * <p>
 * Every requested level strictly between 0 and 100 yields an interval; other
 * levels are dropped with a warning. Repeated levels produce one interval.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Any failure inside a model, including non-finite output, surfaces as a
 * {@link ComputationException}.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * Stateless apart from the optimizer budget; safe to share.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastEngine.class);

    private final int maxEvaluations;

    /**
     * @param maxEvaluations optimizer budget per candidate fit, &gt; 0
     */
    public ForecastEngine(int maxEvaluations) {
        if (maxEvaluations <= 0) {
            throw new IllegalArgumentException("maxEvaluations must be > 0, got: " + maxEvaluations);
        }
        this.maxEvaluations = maxEvaluations;
    }

    /**
     * Forecast {@code horizon} periods past the end of {@code series}.
     *
     * @param series       prepared series
     * @param frequency    inferred frequency, used for the future dates
     * @param horizon      number of future rows, &gt;= 1
     * @param model        model selector
     * @param seasonLength periods per seasonal cycle, &gt;= 1
     * @param levels       requested confidence levels in percent
     * @return the forecast
     * @throws ComputationException if the model cannot be fitted
     */
    public ForecastResult forecast(TimeSeries series, Frequency frequency, int horizon,
            ForecastModel model, int seasonLength, List<Integer> levels) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(levels, "levels must not be null");
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be >= 1, got: " + horizon);
        }

        long started = System.nanoTime();
        Forecaster forecaster = ForecasterFactory.create(model, seasonLength, maxEvaluations);

        ModelForecast prediction;
        String specification;
        try {
            FittedModel fitted = forecaster.fit(series.values());
            prediction = fitted.forecast(horizon);
            specification = fitted.describe();
        } catch (ComputationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ComputationException(forecaster.getModelName() + " failed: " + e.getMessage(), e);
        }
        if (!prediction.isFinite()) {
            throw new ComputationException(forecaster.getModelName() + " (" + specification
                    + ") produced non-finite forecasts");
        }

        ForecastResult.Builder builder = ForecastResult.builder();
        List<LocalDateTime> dates = FutureDates.after(series, frequency, horizon);
        for (int i = 0; i < horizon; i++) {
            builder.addPoint(new ForecastPoint(dates.get(i), prediction.mean(i)));
        }

        Set<Integer> distinct = new LinkedHashSet<>(levels);
        for (Integer level : distinct) {
            if (level == null || !ModelForecast.supportsLevel(level)) {
                LOG.warn("Confidence level {} is outside (0, 100); omitting it from the result", level);
                continue;
            }
            prediction.bounds(level).ifPresent(bounds ->
                    builder.addInterval(new ConfidenceInterval(level, bounds.getLower(), bounds.getUpper())));
        }

        double elapsedMs = (System.nanoTime() - started) / 1_000_000.0;
        ForecastResult result = builder
                .modelUsed(forecaster.getModelName())
                .metrics(ForecastMetrics.timingOnly(elapsedMs))
                .build();
        LOG.debug("{} selected {} for {} points, horizon {} in {} ms",
                forecaster.getModelName(), specification, series.size(), horizon, elapsedMs);
        return result;
    }

    public int getMaxEvaluations() {
        return maxEvaluations;
    }
}
