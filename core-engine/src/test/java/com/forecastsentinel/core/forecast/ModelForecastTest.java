package com.forecastsentinel.core.forecast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ModelForecast}.
 */
class ModelForecastTest {

    @Test
    @DisplayName("Should use the two-sided normal critical value")
    void shouldUseNormalCriticalValue() {
        assertThat(ModelForecast.criticalValue(95)).isCloseTo(1.959964, within(1e-6));
        assertThat(ModelForecast.criticalValue(80)).isCloseTo(1.281552, within(1e-6));
    }

    @Test
    @DisplayName("Should build symmetric bounds around the mean")
    void shouldBuildBounds() {
        ModelForecast forecast = new ModelForecast(new double[] {10, 20}, new double[] {1, 2});

        ModelForecast.Bounds bounds = forecast.bounds(95).orElseThrow();

        assertThat(bounds.getLower().get(0)).isCloseTo(10 - 1.959964, within(1e-6));
        assertThat(bounds.getUpper().get(1)).isCloseTo(20 + 2 * 1.959964, within(1e-6));
    }

    @Test
    @DisplayName("Should not produce bounds for levels outside (0, 100)")
    void shouldRejectUnsupportedLevels() {
        ModelForecast forecast = new ModelForecast(new double[] {1}, new double[] {1});

        assertThat(forecast.bounds(0)).isEmpty();
        assertThat(forecast.bounds(100)).isEmpty();
        assertThat(ModelForecast.supportsLevel(50)).isTrue();
    }

    @Test
    @DisplayName("Should detect non-finite output and mismatched lengths")
    void shouldValidateContent() {
        assertThat(new ModelForecast(new double[] {Double.NaN}, new double[] {1}).isFinite()).isFalse();
        assertThatThrownBy(() -> new ModelForecast(new double[] {1, 2}, new double[] {1}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
