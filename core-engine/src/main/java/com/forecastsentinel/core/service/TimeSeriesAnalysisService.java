package com.forecastsentinel.core.service;

import com.forecastsentinel.core.config.EngineConfig;
import com.forecastsentinel.core.config.EngineConfigLoader;
import com.forecastsentinel.core.detection.AnomalyDetector;
import com.forecastsentinel.core.detection.RollingZScoreDetector;
import com.forecastsentinel.core.error.ComputationException;
import com.forecastsentinel.core.error.DataValidationException;
import com.forecastsentinel.core.forecast.ForecastEngine;
import com.forecastsentinel.core.model.AnomalyRequest;
import com.forecastsentinel.core.model.AnomalyResult;
import com.forecastsentinel.core.model.DataPoint;
import com.forecastsentinel.core.model.ForecastModel;
import com.forecastsentinel.core.model.ForecastRequest;
import com.forecastsentinel.core.model.ForecastResult;
import com.forecastsentinel.core.model.Frequency;
import com.forecastsentinel.core.model.ModelCatalogue;
import com.forecastsentinel.core.model.Sensitivity;
import com.forecastsentinel.core.model.TimeSeries;
import com.forecastsentinel.core.prepare.SeriesPreparer;
import com.forecastsentinel.core.prepare.SeriesValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for callers: checks a request, prepares its series and runs the
 * forecast engine or the anomaly detector.
 *
 * <h3>Request checks</h3>
 * <ul>
 * <li>forecasting needs at least {@code minForecastPoints} points, anomaly
 * detection {@code minAnomalyPoints};</li>
 * <li>the horizon must lie in {@code [1, maxHorizon]};</li>
 * <li>an explicit season length must be greater than 1.</li>
 * </ul>
 * Violations raise {@link DataValidationException} before any computation.
 * Omitted optional fields take the defaults of the {@link EngineConfig}.
 *
 * <h3>Thread safety</h3>
 * <p>
 * Holds only immutable collaborators and may be shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeSeriesAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesAnalysisService.class);

    private final EngineConfig config;
    private final ForecastEngine forecastEngine;
    private final AnomalyDetector anomalyDetector;

    /**
     * @param config validated engine configuration; must not be {@code null}
     */
    public TimeSeriesAnalysisService(EngineConfig config) {
        this(config, new ForecastEngine(config.getOptimizerMaxEvaluations()), new RollingZScoreDetector());
    }

    /**
     * Build a service from the process configuration resolved by
     * {@link EngineConfigLoader#load()}.
     *
     * @return a ready service
     * @throws IllegalStateException if the configuration is invalid
     */
    public static TimeSeriesAnalysisService fromEnvironment() {
        return new TimeSeriesAnalysisService(EngineConfigLoader.load());
    }

    TimeSeriesAnalysisService(EngineConfig config, ForecastEngine forecastEngine,
            AnomalyDetector anomalyDetector) {
        this.config = Objects.requireNonNull(config, "EngineConfig must not be null");
        this.forecastEngine = Objects.requireNonNull(forecastEngine, "ForecastEngine must not be null");
        this.anomalyDetector = Objects.requireNonNull(anomalyDetector, "AnomalyDetector must not be null");
        LOG.info("Time series analysis service ready: {}", config);
    }

    public EngineConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Forecasting
    // ---------------------------------------------------------------

    /**
     * @param request forecast request; must not be {@code null}
     * @return the forecast
     * @throws DataValidationException if the request or its data is invalid
     * @throws ComputationException    if the model cannot be fitted
     */
    public ForecastResult forecast(ForecastRequest request) {
        Objects.requireNonNull(request, "ForecastRequest must not be null");

        requireMinimumPoints(request.getData(), config.getMinForecastPoints());
        if (request.getHorizon() < 1 || request.getHorizon() > config.getMaxHorizon()) {
            throw new DataValidationException("Horizon must be between 1 and " + config.getMaxHorizon()
                    + ", got: " + request.getHorizon());
        }
        requireValidSeasonLength(request.getSeasonLength());

        String selector = request.getModel() != null ? request.getModel() : config.getDefaultModel();
        if (!ForecastModel.isKnown(selector)) {
            LOG.warn("Unknown model '{}', falling back to {}", selector, ForecastModel.ETS.id());
        }
        ForecastModel model = ForecastModel.fromId(selector);
        List<Integer> levels = request.getConfidenceLevels() != null
                ? request.getConfidenceLevels()
                : config.getDefaultConfidenceLevels();

        SeriesValidator.validate(request.getData());
        TimeSeries series = SeriesPreparer.prepare(request.getData());
        Frequency frequency = SeriesPreparer.inferFrequency(series);
        int seasonLength = SeriesPreparer.resolveSeasonLength(request.getSeasonLength(), frequency);

        LOG.debug("Forecasting {} {} points with {} (season length {}, horizon {})",
                series.size(), frequency, model.id(), seasonLength, request.getHorizon());
        return forecastEngine.forecast(series, frequency, request.getHorizon(), model, seasonLength, levels);
    }

    // ---------------------------------------------------------------
    // Anomaly detection
    // ---------------------------------------------------------------

    /**
     * @param request anomaly request; must not be {@code null}
     * @return the detected anomalies
     * @throws DataValidationException if the request or its data is invalid
     */
    public AnomalyResult detectAnomalies(AnomalyRequest request) {
        Objects.requireNonNull(request, "AnomalyRequest must not be null");

        requireMinimumPoints(request.getData(), config.getMinAnomalyPoints());
        requireValidSeasonLength(request.getSeasonLength());

        Sensitivity sensitivity = Sensitivity.fromId(request.getSensitivity() != null
                ? request.getSensitivity()
                : config.getDefaultSensitivity());
        boolean showBands = request.getShowConfidenceBands() != null
                ? request.getShowConfidenceBands()
                : config.isDefaultShowConfidenceBands();

        SeriesValidator.validate(request.getData());
        TimeSeries series = SeriesPreparer.prepare(request.getData());
        Frequency frequency = SeriesPreparer.inferFrequency(series);
        int seasonLength = SeriesPreparer.resolveSeasonLength(request.getSeasonLength(), frequency);

        LOG.debug("Detecting anomalies in {} {} points (sensitivity {}, season length {})",
                series.size(), frequency, sensitivity.id(), seasonLength);
        return anomalyDetector.detect(series, sensitivity, seasonLength, showBands);
    }

    // ---------------------------------------------------------------
    // Catalogue
    // ---------------------------------------------------------------

    /**
     * @return the selectable forecasting models
     */
    public ModelCatalogue availableModels() {
        return ModelCatalogue.standard();
    }

    // ---------------------------------------------------------------
    // Request checks
    // ---------------------------------------------------------------

    private static void requireMinimumPoints(List<DataPoint> data, int minimum) {
        if (data.size() < minimum) {
            throw new DataValidationException("Need at least " + minimum + " data points, got: "
                    + data.size());
        }
    }

    private static void requireValidSeasonLength(Integer seasonLength) {
        if (seasonLength != null && seasonLength <= 1) {
            throw new DataValidationException("Season length must be greater than 1, got: " + seasonLength);
        }
    }
}
