package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Catalogue entry for one {@link ForecastModel}.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "name", "description", "speed", "accuracy", "best_for"})
public final class ModelDescriptor implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ForecastModel model;

    public ModelDescriptor(ForecastModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    @JsonProperty("id")
    public String getId() {
        return model.id();
    }

    @JsonProperty("name")
    public String getName() {
        return model.getDisplayName();
    }

    @JsonProperty("description")
    public String getDescription() {
        return model.getDescription();
    }

    @JsonProperty("speed")
    public String getSpeed() {
        return model.getSpeed();
    }

    @JsonProperty("accuracy")
    public String getAccuracy() {
        return model.getAccuracy();
    }

    @JsonProperty("best_for")
    public String getBestFor() {
        return model.getBestFor();
    }

    @Override
    public String toString() {
        return "ModelDescriptor{id='" + getId() + "'}";
    }
}
