package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.error.ComputationException;
import com.forecastsentinel.core.model.ConfidenceInterval;
import com.forecastsentinel.core.model.ForecastModel;
import com.forecastsentinel.core.model.ForecastPoint;
import com.forecastsentinel.core.model.ForecastResult;
import com.forecastsentinel.core.model.Frequency;
import com.forecastsentinel.core.model.SeriesPoint;
import com.forecastsentinel.core.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ForecastEngine}.
 */
class ForecastEngineTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

    private final ForecastEngine engine = new ForecastEngine(2000);

    @Test
    @DisplayName("Should produce one row per horizon step with dated, ordered intervals")
    void shouldProduceCompleteForecast() {
        ForecastResult result = engine.forecast(linear(30), Frequency.DAILY, 10, ForecastModel.ETS, 7,
                List.of(95, 80));

        assertThat(result.getForecast()).hasSize(10);
        assertThat(result.getForecast().get(0).getDate()).isEqualTo("2024-01-31");
        assertThat(result.getIntervals().keySet()).containsExactly(95, 80);
        assertThat(result.getModelUsed()).isEqualTo("AutoETS");
        assertThat(result.getMetrics().getAic()).isNull();
        assertThat(result.getMetrics().getComputationTimeMs()).isGreaterThanOrEqualTo(0);

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
    @DisplayName("Should omit unsupported levels and collapse duplicates")
    void shouldOmitUnsupportedLevels() {
        ForecastResult result = engine.forecast(linear(30), Frequency.DAILY, 3, ForecastModel.ETS, 7,
                Arrays.asList(0, 95, 100, 95, null));

        assertThat(result.getIntervals().keySet()).containsExactly(95);
        assertThat(result.getInterval(100)).isEmpty();
        assertThat(result.getInterval(95)).isPresent();
    }

    @Test
    @DisplayName("Should report the model behind each selector")
    void shouldReportModelUsed() {
        TimeSeries series = linear(30);

        assertThat(engine.forecast(series, Frequency.DAILY, 2, ForecastModel.AUTO, 7, List.of(95))
                .getModelUsed()).isEqualTo("AutoARIMA");
        assertThat(engine.forecast(series, Frequency.DAILY, 2, ForecastModel.ARIMA, 7, List.of(95))
                .getModelUsed()).isEqualTo("AutoARIMA");
        assertThat(engine.forecast(series, Frequency.DAILY, 2, ForecastModel.THETA, 7, List.of(95))
                .getModelUsed()).isEqualTo("AutoTheta");
    }

    @Test
    @DisplayName("Should surface model failures as ComputationException")
    void shouldSurfaceFailures() {
        assertThatThrownBy(() -> engine.forecast(linear(2), Frequency.DAILY, 2, ForecastModel.THETA, 7,
                List.of(95)))
                .isInstanceOf(ComputationException.class);
    }

    @Test
    @DisplayName("Should surface an over-differenced short series as ComputationException")
    void shouldSurfaceOverDifferencedSeries() {
        TimeSeries series = of(1, 5, 9, 1, 5, 9);

        assertThatThrownBy(() -> engine.forecast(series, Frequency.DAILY, 3, ForecastModel.ARIMA, 3,
                List.of(95)))
                .isInstanceOf(ComputationException.class)
                .hasMessageContaining("after differencing");
    }

    @Test
    @DisplayName("Should reject invalid arguments")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> engine.forecast(linear(30), Frequency.DAILY, 0, ForecastModel.ETS, 7,
                List.of(95)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ForecastEngine(0)).isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static TimeSeries linear(int n) {
        List<SeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            points.add(new SeriesPoint(START.plusDays(i), i));
        }
        return new TimeSeries(points);
    }

    private static TimeSeries of(double... values) {
        List<SeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new SeriesPoint(START.plusDays(i), values[i]));
        }
        return new TimeSeries(points);
    }
}
