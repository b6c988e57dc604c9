package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The selectable forecasting models, in {@link ForecastModel} declaration
 * order, plus a one-line recommendation.
 *
 * <p>
 * Anomaly detection is not selectable. Its results always report
 * {@value #ANOMALY_MODEL} as the model used, listed here as
 * {@code anomaly_model} so clients can tell the two result kinds apart.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"models", "recommended", "anomaly_model"})
public final class ModelCatalogue implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Model name reported by anomaly detection results. */
    public static final String ANOMALY_MODEL = "RollingZScore";

    private static final ModelCatalogue STANDARD = new ModelCatalogue();

    private final List<ModelDescriptor> models;

    private ModelCatalogue() {
        List<ModelDescriptor> entries = new ArrayList<>();
        for (ForecastModel model : ForecastModel.values()) {
            entries.add(new ModelDescriptor(model));
        }
        this.models = Collections.unmodifiableList(entries);
    }

    public static ModelCatalogue standard() {
        return STANDARD;
    }

    @JsonProperty("models")
    public List<ModelDescriptor> getModels() {
        return models;
    }

    @JsonProperty("recommended")
    public String getRecommended() {
        return ForecastModel.RECOMMENDATION;
    }

    @JsonProperty("anomaly_model")
    public String getAnomalyModel() {
        return ANOMALY_MODEL;
    }
}
