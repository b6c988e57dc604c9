package com.forecastsentinel.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forecastsentinel.core.config.EngineConfig;
import com.forecastsentinel.core.config.EngineConfigLoader;
import com.forecastsentinel.core.error.DataValidationException;
import com.forecastsentinel.core.model.AnomalyPoint;
import com.forecastsentinel.core.model.AnomalyRequest;
import com.forecastsentinel.core.model.AnomalyResult;
import com.forecastsentinel.core.model.ConfidenceInterval;
import com.forecastsentinel.core.model.DataPoint;
import com.forecastsentinel.core.model.ForecastPoint;
import com.forecastsentinel.core.model.ForecastRequest;
import com.forecastsentinel.core.model.ForecastResult;
import com.forecastsentinel.core.model.ModelCatalogue;
import com.forecastsentinel.core.model.ModelDescriptor;
import com.forecastsentinel.core.model.Sensitivity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end tests for {@link TimeSeriesAnalysisService}.
 */
class TimeSeriesAnalysisServiceTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private final TimeSeriesAnalysisService service = new TimeSeriesAnalysisService(EngineConfig.defaults());

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    // ---------------------------------------------------------------
    // Forecasting
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should continue a linear series with every requested level")
    void shouldForecastLinearSeries() {
        ForecastResult result = service.forecast(ForecastRequest.builder()
                .data(series(30, i -> i))
                .horizon(10)
                .model("ets")
                .confidenceLevels(List.of(80, 95))
                .build());

        assertThat(result.getForecast()).hasSize(10);
        assertThat(result.getForecast().get(0).getDate()).isEqualTo("2024-01-31");
        assertThat(result.getIntervals().keySet()).containsExactly(80, 95);
        for (int i = 0; i < 10; i++) {
            ForecastPoint point = result.getForecast().get(i);
            assertThat(point.getValue()).isCloseTo(30 + i, within(1e-6));
            for (ConfidenceInterval interval : result.getIntervals().values()) {
                assertThat(interval.getUpper().get(i)).isGreaterThanOrEqualTo(point.getValue());
                assertThat(interval.getLower().get(i)).isLessThanOrEqualTo(point.getValue());
            }
        }
    }

    @Test
    @DisplayName("Should apply configured defaults for model and levels")
    void shouldApplyDefaults() {
        ForecastResult result = service.forecast(ForecastRequest.builder()
                .data(series(30, i -> i))
                .horizon(3)
                .build());

        assertThat(result.getModelUsed()).isEqualTo("AutoARIMA");
        assertThat(result.getIntervals().keySet()).containsExactly(95);
    }

    @Test
    @DisplayName("Should fall back to exponential smoothing for an unknown model")
    void shouldFallBackToEts() {
        ForecastResult result = service.forecast(ForecastRequest.builder()
                .data(series(30, i -> i))
                .horizon(3)
                .model("prophet")
                .build());

        assertThat(result.getModelUsed()).isEqualTo("AutoETS");
    }

    @Test
    @DisplayName("Should reject horizons outside [1, maxHorizon]")
    void shouldRejectHorizon() {
        assertThatThrownBy(() -> service.forecast(ForecastRequest.builder()
                .data(series(30, i -> i)).horizon(0).build()))
                .isInstanceOf(DataValidationException.class)
                .hasMessageContaining("Horizon");
        assertThatThrownBy(() -> service.forecast(ForecastRequest.builder()
                .data(series(30, i -> i)).horizon(366).build()))
                .isInstanceOf(DataValidationException.class);
    }

    @Test
    @DisplayName("Should require ten points for a forecast")
    void shouldRequireForecastPoints() {
        assertThatThrownBy(() -> service.forecast(ForecastRequest.builder()
                .data(series(9, i -> i)).horizon(3).build()))
                .isInstanceOf(DataValidationException.class)
                .hasMessageContaining("at least 10");
    }

    @Test
    @DisplayName("Should reject a season length of 1 or less")
    void shouldRejectSeasonLength() {
        assertThatThrownBy(() -> service.forecast(ForecastRequest.builder()
                .data(series(30, i -> i)).horizon(3).seasonLength(1).build()))
                .isInstanceOf(DataValidationException.class)
                .hasMessageContaining("Season length");
    }

    @Test
    @DisplayName("Should reject structurally invalid data before fitting")
    void shouldRejectInvalidData() {
        List<DataPoint> duplicated = series(12, i -> i);
        duplicated.set(5, DataPoint.of(duplicated.get(4).getDate(), 1.0));
        assertThatThrownBy(() -> service.forecast(ForecastRequest.builder()
                .data(duplicated).horizon(3).build()))
                .isInstanceOf(DataValidationException.class)
                .hasMessageContaining("Duplicate");

        List<DataPoint> missingValue = series(12, i -> i);
        missingValue.set(3, new DataPoint(missingValue.get(3).getDate(), null));
        assertThatThrownBy(() -> service.forecast(ForecastRequest.builder()
                .data(missingValue).horizon(3).build()))
                .isInstanceOf(DataValidationException.class)
                .hasMessageContaining("Invalid value");
    }

    // ---------------------------------------------------------------
    // Anomaly detection
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should find the single spike with default sensitivity and bands")
    void shouldDetectSpike() {
        AnomalyResult result = service.detectAnomalies(AnomalyRequest.builder()
                .data(series(30, i -> i == 14 ? 200 : 100))
                .build());

        assertThat(result.getSensitivity()).isEqualTo(Sensitivity.MEDIUM);
        assertThat(result.getAnomalies()).extracting(AnomalyPoint::getDate).containsExactly("2024-01-15");
        assertThat(result.getConfidenceBands()).isNotNull().hasSize(30);
    }

    @Test
    @DisplayName("Should flag nothing in a constant series")
    void shouldIgnoreConstantSeries() {
        AnomalyResult result = service.detectAnomalies(AnomalyRequest.builder()
                .data(series(25, i -> 50))
                .sensitivity("high")
                .showConfidenceBands(false)
                .build());

        assertThat(result.getAnomalyCount()).isZero();
        assertThat(result.getConfidenceBands()).isNull();
    }

    @Test
    @DisplayName("Should reject unknown sensitivity and short series")
    void shouldRejectInvalidAnomalyRequests() {
        assertThatThrownBy(() -> service.detectAnomalies(AnomalyRequest.builder()
                .data(series(25, i -> 50)).sensitivity("extreme").build()))
                .isInstanceOf(DataValidationException.class);
        assertThatThrownBy(() -> service.detectAnomalies(AnomalyRequest.builder()
                .data(series(19, i -> 50)).build()))
                .isInstanceOf(DataValidationException.class)
                .hasMessageContaining("at least 20");
    }

    @Test
    @DisplayName("Should honour a loaded configuration")
    void shouldHonourLoadedConfiguration() {
        TimeSeriesAnalysisService configured =
                new TimeSeriesAnalysisService(EngineConfigLoader.fromClasspath("test-engine.yml"));

        assertThatThrownBy(() -> configured.forecast(ForecastRequest.builder()
                .data(series(30, i -> i)).horizon(31).build()))
                .isInstanceOf(DataValidationException.class);

        ForecastResult result = configured.forecast(ForecastRequest.builder()
                .data(series(30, i -> i)).horizon(2).build());
        assertThat(result.getModelUsed()).isEqualTo("AutoTheta");
        assertThat(result.getIntervals().keySet()).containsExactly(80, 95);
    }

    @Test
    @DisplayName("Should build from the resolved process configuration")
    void shouldBuildFromEnvironment() {
        TimeSeriesAnalysisService resolved = TimeSeriesAnalysisService.fromEnvironment();

        assertThat(resolved.getConfig()).isNotNull();
        ForecastResult result = resolved.forecast(ForecastRequest.builder()
                .data(series(30, i -> i)).horizon(3).model("ets").build());
        assertThat(result.getForecast()).hasSize(3);
    }

    // ---------------------------------------------------------------
    // Catalogue and wire format
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should list the four model selectors")
    void shouldListModels() {
        ModelCatalogue catalogue = service.availableModels();

        assertThat(catalogue.getModels()).extracting(ModelDescriptor::getId)
                .containsExactly("auto", "arima", "ets", "theta");
        assertThat(catalogue.getModels().get(0).getBestFor()).isNull();
        assertThat(catalogue.getRecommended()).isEqualTo("auto or ets for most use cases");
    }

    @Test
    @DisplayName("Should list the anomaly model that detection results report")
    void shouldListAnomalyModel() throws Exception {
        AnomalyResult result = service.detectAnomalies(AnomalyRequest.builder()
                .data(series(30, i -> 50 + (i % 3))).build());

        JsonNode json = mapper.readTree(mapper.writeValueAsString(service.availableModels()));

        assertThat(json.get("anomaly_model").asText()).isEqualTo("RollingZScore");
        assertThat(result.getModelUsed()).isEqualTo(service.availableModels().getAnomalyModel());
    }

    @Test
    @DisplayName("Should serialize forecasts with the wire field names")
    void shouldSerializeForecast() throws Exception {
        ForecastResult result = service.forecast(ForecastRequest.builder()
                .data(series(30, i -> i)).horizon(2).model("ets").build());

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertThat(json.get("forecast").get(0).get("date").asText()).isEqualTo("2024-01-31");
        assertThat(json.get("confidenceIntervals").has("upper_95")).isTrue();
        assertThat(json.get("confidenceIntervals").has("lower_95")).isTrue();
        assertThat(json.get("modelUsed").asText()).isEqualTo("AutoETS");
        assertThat(json.get("metrics").has("computation_time_ms")).isTrue();
        assertThat(json.get("metrics").get("aic").isNull()).isTrue();
    }

    @Test
    @DisplayName("Should serialize anomalies with the wire field names")
    void shouldSerializeAnomalies() throws Exception {
        AnomalyResult result = service.detectAnomalies(AnomalyRequest.builder()
                .data(series(30, i -> i == 14 ? 200 : 100)).build());

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));
        JsonNode anomaly = json.get("anomalies").get(0);

        assertThat(anomaly.get("severity").asText()).isIn("medium", "high");
        assertThat(anomaly.get("expectedRange").has("lower")).isTrue();
        assertThat(anomaly.get("expectedRange").has("midpoint")).isFalse();
        assertThat(json.get("sensitivity").asText()).isEqualTo("medium");
        assertThat(json.get("anomalyCount").asInt()).isEqualTo(1);
        assertThat(json.get("modelUsed").asText()).isEqualTo("RollingZScore");
    }

    @Test
    @DisplayName("Should read data points from JSON")
    void shouldDeserializeDataPoints() throws Exception {
        DataPoint point = mapper.readValue("{\"date\":\"2024-01-01\",\"value\":4.5}", DataPoint.class);

        assertThat(point).isEqualTo(DataPoint.of("2024-01-01", 4.5));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<DataPoint> series(int n, IntToDoubleFunction value) {
        List<DataPoint> data = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            data.add(DataPoint.of(START.plusDays(i).toString(), value.applyAsDouble(i)));
        }
        return data;
    }
}
