package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Diagnostics attached to a forecast.
 *
 * <p>
 * Only {@code computationTimeMs} is guaranteed. The information criteria and
 * the error metric are reserved fields that the engine leaves {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastMetrics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Double aic;
    private final Double bic;
    private final Double mape;
    private final double computationTimeMs;

    public ForecastMetrics(Double aic, Double bic, Double mape, double computationTimeMs) {
        this.aic = aic;
        this.bic = bic;
        this.mape = mape;
        this.computationTimeMs = computationTimeMs;
    }

    public static ForecastMetrics timingOnly(double computationTimeMs) {
        return new ForecastMetrics(null, null, null, computationTimeMs);
    }

    public Double getAic() {
        return aic;
    }

    public Double getBic() {
        return bic;
    }

    public Double getMape() {
        return mape;
    }

    @JsonProperty("computation_time_ms")
    public double getComputationTimeMs() {
        return computationTimeMs;
    }

    @Override
    public String toString() {
        return "ForecastMetrics{computationTimeMs=" + computationTimeMs + '}';
    }
}
