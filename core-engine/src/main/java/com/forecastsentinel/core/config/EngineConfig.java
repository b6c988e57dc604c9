package com.forecastsentinel.core.config;

import com.forecastsentinel.core.model.ForecastModel;
import com.forecastsentinel.core.model.Sensitivity;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional, defaults shown):
 * </p>
 *
 * <pre>
 * maxHorizon: 365
 * minForecastPoints: 10
 * minAnomalyPoints: 20
 * defaultModel: auto
 * defaultConfidenceLevels: [95]
 * defaultSensitivity: medium
 * defaultShowConfidenceBands: true
 * optimizerMaxEvaluations: 2000
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private int maxHorizon = 365;
    private int minForecastPoints = 10;
    private int minAnomalyPoints = 20;
    private String defaultModel = "auto";
    private List<Integer> defaultConfidenceLevels = new ArrayList<>(List.of(95));
    private String defaultSensitivity = "medium";
    private boolean defaultShowConfidenceBands = true;
    private int optimizerMaxEvaluations = 2000;

    /**
     * @return a configuration holding only the built-in defaults
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting. Collects all errors and throws a single
     * exception if any setting is invalid.
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (maxHorizon < 1) {
            errors.add("'maxHorizon' must be >= 1, got: " + maxHorizon);
        }
        if (minForecastPoints < 2) {
            errors.add("'minForecastPoints' must be >= 2, got: " + minForecastPoints);
        }
        if (minAnomalyPoints < 2) {
            errors.add("'minAnomalyPoints' must be >= 2, got: " + minAnomalyPoints);
        }
        if (defaultModel == null || !ForecastModel.isKnown(defaultModel)) {
            errors.add("'defaultModel' must be one of auto, arima, ets, theta, got: " + defaultModel);
        }
        if (defaultConfidenceLevels == null || defaultConfidenceLevels.isEmpty()) {
            errors.add("'defaultConfidenceLevels' must not be empty");
        } else {
            for (Integer level : defaultConfidenceLevels) {
                if (level == null || level <= 0 || level >= 100) {
                    errors.add("'defaultConfidenceLevels' entries must be in (0, 100), got: " + level);
                }
            }
        }
        if (defaultSensitivity == null || !isSensitivity(defaultSensitivity)) {
            errors.add("'defaultSensitivity' must be one of low, medium, high, got: "
                    + defaultSensitivity);
        }
        if (optimizerMaxEvaluations < 100) {
            errors.add("'optimizerMaxEvaluations' must be >= 100, got: " + optimizerMaxEvaluations);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static boolean isSensitivity(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Sensitivity sensitivity : Sensitivity.values()) {
            if (sensitivity.id().equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (setters used by SnakeYAML)
    // ---------------------------------------------------------------

    public int getMaxHorizon() {
        return maxHorizon;
    }

    public void setMaxHorizon(int maxHorizon) {
        this.maxHorizon = maxHorizon;
    }

    public int getMinForecastPoints() {
        return minForecastPoints;
    }

    public void setMinForecastPoints(int minForecastPoints) {
        this.minForecastPoints = minForecastPoints;
    }

    public int getMinAnomalyPoints() {
        return minAnomalyPoints;
    }

    public void setMinAnomalyPoints(int minAnomalyPoints) {
        this.minAnomalyPoints = minAnomalyPoints;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    /**
     * @return unmodifiable list of default confidence levels
     */
    public List<Integer> getDefaultConfidenceLevels() {
        return defaultConfidenceLevels != null
                ? Collections.unmodifiableList(defaultConfidenceLevels)
                : null;
    }

    public void setDefaultConfidenceLevels(List<Integer> defaultConfidenceLevels) {
        this.defaultConfidenceLevels = defaultConfidenceLevels != null
                ? new ArrayList<>(defaultConfidenceLevels)
                : null;
    }

    public String getDefaultSensitivity() {
        return defaultSensitivity;
    }

    public void setDefaultSensitivity(String defaultSensitivity) {
        this.defaultSensitivity = defaultSensitivity;
    }

    public boolean isDefaultShowConfidenceBands() {
        return defaultShowConfidenceBands;
    }

    public void setDefaultShowConfidenceBands(boolean defaultShowConfidenceBands) {
        this.defaultShowConfidenceBands = defaultShowConfidenceBands;
    }

    /** Evaluation budget of each Nelder–Mead search during model fitting. */
    public int getOptimizerMaxEvaluations() {
        return optimizerMaxEvaluations;
    }

    public void setOptimizerMaxEvaluations(int optimizerMaxEvaluations) {
        this.optimizerMaxEvaluations = optimizerMaxEvaluations;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "maxHorizon=" + maxHorizon +
                ", minForecastPoints=" + minForecastPoints +
                ", minAnomalyPoints=" + minAnomalyPoints +
                ", defaultModel='" + defaultModel + '\'' +
                ", defaultConfidenceLevels=" + defaultConfidenceLevels +
                ", defaultSensitivity='" + defaultSensitivity + '\'' +
                ", defaultShowConfidenceBands=" + defaultShowConfidenceBands +
                ", optimizerMaxEvaluations=" + optimizerMaxEvaluations +
                '}';
    }
}
