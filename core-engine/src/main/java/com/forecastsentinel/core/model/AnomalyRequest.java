package com.forecastsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of an anomaly detection run.
 *
 * <p>
 * Optional fields left {@code null} are filled from
 * {@link com.forecastsentinel.core.config.EngineConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyRequest {

    private final List<DataPoint> data;
    private final String sensitivity;
    private final Integer seasonLength;
    private final Boolean showConfidenceBands;

    private AnomalyRequest(Builder builder) {
        this.data = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(builder.data, "data must not be null")));
        this.sensitivity = builder.sensitivity;
        this.seasonLength = builder.seasonLength;
        this.showConfidenceBands = builder.showConfidenceBands;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyRequest}. {@code data} is required.
     */
    public static class Builder {
        private List<DataPoint> data;
        private String sensitivity;
        private Integer seasonLength;
        private Boolean showConfidenceBands;

        public Builder data(List<DataPoint> data) {
            this.data = data;
            return this;
        }

        /** Sensitivity tier: {@code low}, {@code medium} or {@code high}. */
        public Builder sensitivity(String sensitivity) {
            this.sensitivity = sensitivity;
            return this;
        }

        public Builder seasonLength(Integer seasonLength) {
            this.seasonLength = seasonLength;
            return this;
        }

        public Builder showConfidenceBands(Boolean showConfidenceBands) {
            this.showConfidenceBands = showConfidenceBands;
            return this;
        }

        public AnomalyRequest build() {
            return new AnomalyRequest(this);
        }
    }

    public List<DataPoint> getData() {
        return data;
    }

    public String getSensitivity() {
        return sensitivity;
    }

    public Integer getSeasonLength() {
        return seasonLength;
    }

    public Boolean getShowConfidenceBands() {
        return showConfidenceBands;
    }

    @Override
    public String toString() {
        return "AnomalyRequest{" +
                "points=" + data.size() +
                ", sensitivity='" + sensitivity + '\'' +
                ", seasonLength=" + seasonLength +
                ", showConfidenceBands=" + showConfidenceBands +
                '}';
    }
}
