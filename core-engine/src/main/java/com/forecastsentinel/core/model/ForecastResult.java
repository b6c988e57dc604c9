package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of a forecast run.
 *
 * <h3>Confidence intervals</h3>
 * <p>
 * Intervals are held in an ordered map keyed by confidence level (request
 * order). Use {@link #getInterval(int)} to look one up. Levels the model could
 * not produce are simply absent. The JSON view flattens the map into
 * {@code upper_<level>} / {@code lower_<level>} arrays.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code modelUsed} and {@code metrics} are required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"forecast", "confidenceIntervals", "modelUsed", "metrics"})
public final class ForecastResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<ForecastPoint> forecast;
    private final Map<Integer, ConfidenceInterval> intervals;
    private final String modelUsed;
    private final ForecastMetrics metrics;

    private ForecastResult(Builder builder) {
        this.forecast = Collections.unmodifiableList(new ArrayList<>(builder.forecast));
        this.intervals = Collections.unmodifiableMap(new LinkedHashMap<>(builder.intervals));
        this.modelUsed = Objects.requireNonNull(builder.modelUsed, "modelUsed must not be null");
        this.metrics = Objects.requireNonNull(builder.metrics, "metrics must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ForecastResult}.
     */
    public static class Builder {
        private final List<ForecastPoint> forecast = new ArrayList<>();
        private final Map<Integer, ConfidenceInterval> intervals = new LinkedHashMap<>();
        private String modelUsed;
        private ForecastMetrics metrics;

        public Builder addPoint(ForecastPoint point) {
            this.forecast.add(Objects.requireNonNull(point, "point must not be null"));
            return this;
        }

        /**
         * Add an interval. A second interval for the same level replaces the first.
         *
         * @param interval the interval; must be aligned with the forecast rows
         * @return this builder
         */
        public Builder addInterval(ConfidenceInterval interval) {
            Objects.requireNonNull(interval, "interval must not be null");
            this.intervals.put(interval.getLevel(), interval);
            return this;
        }

        public Builder modelUsed(String modelUsed) {
            this.modelUsed = modelUsed;
            return this;
        }

        public Builder metrics(ForecastMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * @return a new {@link ForecastResult}
         * @throws NullPointerException     if {@code modelUsed} or {@code metrics}
         *                                  is missing
         * @throws IllegalArgumentException if an interval is not aligned with the
         *                                  forecast rows
         */
        public ForecastResult build() {
            for (ConfidenceInterval interval : intervals.values()) {
                if (interval.getLower().size() != forecast.size()) {
                    throw new IllegalArgumentException("Interval for level " + interval.getLevel()
                            + " has " + interval.getLower().size() + " rows, forecast has "
                            + forecast.size());
                }
            }
            return new ForecastResult(this);
        }
    }

    @JsonProperty("forecast")
    public List<ForecastPoint> getForecast() {
        return forecast;
    }

    /**
     * @return unmodifiable ordered map from confidence level to interval
     */
    @JsonIgnore
    public Map<Integer, ConfidenceInterval> getIntervals() {
        return intervals;
    }

    /**
     * @param level confidence level in percent
     * @return the interval, or empty if the level was not produced
     */
    public Optional<ConfidenceInterval> getInterval(int level) {
        return Optional.ofNullable(intervals.get(level));
    }

    /**
     * Flattened interval view, e.g. {@code {"upper_95": [...], "lower_95": [...]}}.
     *
     * @return new ordered map of label to bound sequence
     */
    @JsonProperty("confidenceIntervals")
    public Map<String, List<Double>> getLabelledIntervals() {
        Map<String, List<Double>> labelled = new LinkedHashMap<>();
        for (ConfidenceInterval interval : intervals.values()) {
            labelled.put(interval.upperLabel(), interval.getUpper());
            labelled.put(interval.lowerLabel(), interval.getLower());
        }
        return labelled;
    }

    @JsonProperty("modelUsed")
    public String getModelUsed() {
        return modelUsed;
    }

    @JsonProperty("metrics")
    public ForecastMetrics getMetrics() {
        return metrics;
    }

    @Override
    public String toString() {
        return "ForecastResult{" +
                "modelUsed='" + modelUsed + '\'' +
                ", horizon=" + forecast.size() +
                ", levels=" + intervals.keySet() +
                ", metrics=" + metrics +
                '}';
    }
}
