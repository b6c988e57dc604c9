package com.forecastsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of a forecast run.
 *
 * <p>
 * Optional fields left {@code null} are filled from
 * {@link com.forecastsentinel.core.config.EngineConfig} by
 * {@link com.forecastsentinel.core.service.TimeSeriesAnalysisService}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastRequest {

    private final List<DataPoint> data;
    private final int horizon;
    private final String model;
    private final Integer seasonLength;
    private final List<Integer> confidenceLevels;

    private ForecastRequest(Builder builder) {
        this.data = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(builder.data, "data must not be null")));
        this.horizon = builder.horizon;
        this.model = builder.model;
        this.seasonLength = builder.seasonLength;
        this.confidenceLevels = builder.confidenceLevels != null
                ? Collections.unmodifiableList(new ArrayList<>(builder.confidenceLevels))
                : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ForecastRequest}. {@code data} is required.
     */
    public static class Builder {
        private List<DataPoint> data;
        private int horizon;
        private String model;
        private Integer seasonLength;
        private List<Integer> confidenceLevels;

        public Builder data(List<DataPoint> data) {
            this.data = data;
            return this;
        }

        public Builder horizon(int horizon) {
            this.horizon = horizon;
            return this;
        }

        /** Model selector: {@code auto}, {@code arima}, {@code ets} or {@code theta}. */
        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder seasonLength(Integer seasonLength) {
            this.seasonLength = seasonLength;
            return this;
        }

        public Builder confidenceLevels(List<Integer> confidenceLevels) {
            this.confidenceLevels = confidenceLevels;
            return this;
        }

        public ForecastRequest build() {
            return new ForecastRequest(this);
        }
    }

    public List<DataPoint> getData() {
        return data;
    }

    public int getHorizon() {
        return horizon;
    }

    /** @return the model selector, or {@code null} for the configured default */
    public String getModel() {
        return model;
    }

    /** @return explicit season length, or {@code null} to infer one */
    public Integer getSeasonLength() {
        return seasonLength;
    }

    /** @return requested levels, or {@code null} for the configured default */
    public List<Integer> getConfidenceLevels() {
        return confidenceLevels;
    }

    @Override
    public String toString() {
        return "ForecastRequest{" +
                "points=" + data.size() +
                ", horizon=" + horizon +
                ", model='" + model + '\'' +
                ", seasonLength=" + seasonLength +
                ", confidenceLevels=" + confidenceLevels +
                '}';
    }
}
