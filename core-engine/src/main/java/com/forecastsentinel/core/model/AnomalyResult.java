package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of an anomaly detection run.
 *
 * <p>
 * {@code confidenceBands} is {@code null} when bands were not requested, and
 * otherwise holds one band per point whose bounds are defined.
 * {@code anomalyCount} and {@code anomalyRate} are derived from the anomaly
 * list and {@code totalPoints}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"anomalies", "totalPoints", "anomalyCount", "anomalyRate", "confidenceBands",
        "modelUsed", "sensitivity", "computationTimeMs"})
public final class AnomalyResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<AnomalyPoint> anomalies;
    private final int totalPoints;
    private final List<ConfidenceBand> confidenceBands;
    private final String modelUsed;
    private final Sensitivity sensitivity;
    private final double computationTimeMs;

    private AnomalyResult(Builder builder) {
        this.anomalies = Collections.unmodifiableList(new ArrayList<>(builder.anomalies));
        this.totalPoints = builder.totalPoints;
        this.confidenceBands = builder.confidenceBands != null
                ? Collections.unmodifiableList(new ArrayList<>(builder.confidenceBands))
                : null;
        this.modelUsed = Objects.requireNonNull(builder.modelUsed, "modelUsed must not be null");
        this.sensitivity = Objects.requireNonNull(builder.sensitivity, "sensitivity must not be null");
        this.computationTimeMs = builder.computationTimeMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyResult}.
     */
    public static class Builder {
        private final List<AnomalyPoint> anomalies = new ArrayList<>();
        private int totalPoints;
        private List<ConfidenceBand> confidenceBands;
        private String modelUsed;
        private Sensitivity sensitivity;
        private double computationTimeMs;

        public Builder addAnomaly(AnomalyPoint anomaly) {
            this.anomalies.add(Objects.requireNonNull(anomaly, "anomaly must not be null"));
            return this;
        }

        public Builder totalPoints(int totalPoints) {
            this.totalPoints = totalPoints;
            return this;
        }

        /**
         * @param confidenceBands bands, or {@code null} when not requested
         * @return this builder
         */
        public Builder confidenceBands(List<ConfidenceBand> confidenceBands) {
            this.confidenceBands = confidenceBands;
            return this;
        }

        public Builder modelUsed(String modelUsed) {
            this.modelUsed = modelUsed;
            return this;
        }

        public Builder sensitivity(Sensitivity sensitivity) {
            this.sensitivity = sensitivity;
            return this;
        }

        public Builder computationTimeMs(double computationTimeMs) {
            this.computationTimeMs = computationTimeMs;
            return this;
        }

        /**
         * @return a new {@link AnomalyResult}
         * @throws NullPointerException     if {@code modelUsed} or
         *                                  {@code sensitivity} is missing
         * @throws IllegalArgumentException if there are more anomalies than points
         */
        public AnomalyResult build() {
            if (anomalies.size() > totalPoints) {
                throw new IllegalArgumentException("anomaly count " + anomalies.size()
                        + " exceeds total points " + totalPoints);
            }
            return new AnomalyResult(this);
        }
    }

    public List<AnomalyPoint> getAnomalies() {
        return anomalies;
    }

    public int getTotalPoints() {
        return totalPoints;
    }

    public int getAnomalyCount() {
        return anomalies.size();
    }

    /**
     * @return anomalies per analysed point in {@code [0, 1]}
     */
    public double getAnomalyRate() {
        return totalPoints > 0 ? (double) anomalies.size() / totalPoints : 0;
    }

    /**
     * @return bands, or {@code null} if they were not requested
     */
    public List<ConfidenceBand> getConfidenceBands() {
        return confidenceBands;
    }

    public String getModelUsed() {
        return modelUsed;
    }

    public Sensitivity getSensitivity() {
        return sensitivity;
    }

    public double getComputationTimeMs() {
        return computationTimeMs;
    }

    @Override
    public String toString() {
        return "AnomalyResult{" +
                "totalPoints=" + totalPoints +
                ", anomalyCount=" + anomalies.size() +
                ", modelUsed='" + modelUsed + '\'' +
                ", sensitivity=" + sensitivity +
                ", computationTimeMs=" + computationTimeMs +
                '}';
    }
}
