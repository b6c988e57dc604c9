package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of forecasting model selectors.
 *
 * <p>
 * {@link #AUTO} currently resolves to the same automatic ARIMA search as
 * {@link #ARIMA}. Unknown, blank or null selector strings resolve to
 * {@link #ETS} through {@link #fromId(String)}.
 * </p>
 *
 * <p>
 * Each constant also carries the descriptive metadata shown in the model
 * catalogue.
 * </p>
 *
 * @since 1.0.0
 */
public enum ForecastModel {
    AUTO("Auto (Best)",
            "Automatically selects the best model (currently uses AutoARIMA)",
            "fast", "high", null),
    ARIMA("AutoARIMA",
            "Automated ARIMA model selection",
            "fast", "high", "Linear trends, stationary data"),
    ETS("AutoETS",
            "Exponential Smoothing with automated parameter selection",
            "very fast", "high", "Seasonal patterns, simple trends"),
    THETA("AutoTheta",
            "Theta method for forecasting",
            "very fast", "medium-high", "Simple patterns, quick forecasts");

    /** Catalogue recommendation text. */
    public static final String RECOMMENDATION = "auto or ets for most use cases";

    private final String displayName;
    private final String description;
    private final String speed;
    private final String accuracy;
    private final String bestFor;

    ForecastModel(String displayName, String description, String speed, String accuracy,
            String bestFor) {
        this.displayName = displayName;
        this.description = description;
        this.speed = speed;
        this.accuracy = accuracy;
        this.bestFor = bestFor;
    }

    /**
     * Resolve a selector string. {@code null}, blank and unrecognized values
     * fall back to {@link #ETS}.
     *
     * @param id selector, case-insensitive
     * @return the model selector
     */
    public static ForecastModel fromId(String id) {
        if (id == null || id.isBlank()) {
            return ETS;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "auto" -> AUTO;
            case "arima" -> ARIMA;
            case "ets" -> ETS;
            case "theta" -> THETA;
            default -> ETS;
        };
    }

    /**
     * @return {@code true} if {@code id} names one of the constants
     */
    public static boolean isKnown(String id) {
        if (id == null) {
            return false;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ForecastModel model : values()) {
            if (model.id().equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public String getSpeed() {
        return speed;
    }

    public String getAccuracy() {
        return accuracy;
    }

    /**
     * @return typical use case, or {@code null} for {@link #AUTO}
     */
    public String getBestFor() {
        return bestFor;
    }
}
