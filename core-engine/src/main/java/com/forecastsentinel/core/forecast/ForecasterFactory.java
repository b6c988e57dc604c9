package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.model.ForecastModel;

import java.util.Objects;

/**
 * Creates the {@link Forecaster} behind each {@link ForecastModel} selector.
 *
 * <p>
 * This is the single point of extension when adding new models: add the
 * constant to {@link ForecastModel} and map it here.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecasterFactory {

    private ForecasterFactory() {
        // utility class, not instantiable
    }

    /**
     * @param model          the selector; must not be {@code null}
     * @param seasonLength   periods per seasonal cycle, &gt;= 1
     * @param maxEvaluations optimizer budget per candidate fit
     * @return a new forecaster
     */
    public static Forecaster create(ForecastModel model, int seasonLength, int maxEvaluations) {
        Objects.requireNonNull(model, "ForecastModel must not be null");
        return switch (model) {
            case AUTO, ARIMA -> new AutoArimaForecaster(seasonLength, maxEvaluations);
            case ETS -> new AutoEtsForecaster(seasonLength, maxEvaluations);
            case THETA -> new AutoThetaForecaster(seasonLength, maxEvaluations);
        };
    }
}
