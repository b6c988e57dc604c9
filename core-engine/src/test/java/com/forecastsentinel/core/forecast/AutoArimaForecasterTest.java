package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.error.ComputationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AutoArimaForecaster}.
 */
class AutoArimaForecasterTest {

    private static final int MAX_EVALUATIONS = 2000;

    @Test
    @DisplayName("Should difference a linear series once and extrapolate the drift")
    void shouldExtrapolateDrift() {
        double[] y = new double[30];
        for (int i = 0; i < y.length; i++) {
            y[i] = i;
        }

        FittedModel fitted = new AutoArimaForecaster(7, MAX_EVALUATIONS).fit(y);
        ModelForecast forecast = fitted.forecast(10);

        assertThat(fitted.describe()).isEqualTo("ARIMA(0,1,0) with drift");
        for (int h = 0; h < 10; h++) {
            assertThat(forecast.mean(h)).isCloseTo(30 + h, within(1e-6));
        }
    }

    @Test
    @DisplayName("Should fit a mean to a constant series")
    void shouldFitMeanToConstant() {
        double[] y = new double[20];
        Arrays.fill(y, 50);

        FittedModel fitted = new AutoArimaForecaster(7, MAX_EVALUATIONS).fit(y);

        assertThat(fitted.describe()).isEqualTo("ARIMA(0,0,0) with non-zero mean");
        assertThat(fitted.forecast(3).mean(2)).isCloseTo(50, within(1e-9));
    }

    @Test
    @DisplayName("Should seasonally difference a strongly seasonal series")
    void shouldSeasonallyDifference() {
        double[] pattern = {3, -1, -2, 0};
        double[] y = new double[32];
        for (int i = 0; i < y.length; i++) {
            y[i] = 10 + pattern[i % 4];
        }

        FittedModel fitted = new AutoArimaForecaster(4, MAX_EVALUATIONS).fit(y);
        ModelForecast forecast = fitted.forecast(8);

        assertThat(fitted.describe()).contains("(0,1,0)[4]");
        for (int h = 0; h < 8; h++) {
            assertThat(forecast.mean(h)).isCloseTo(10 + pattern[h % 4], within(1e-6));
        }
    }

    @Test
    @DisplayName("Should produce non-decreasing standard errors for a random walk")
    void shouldWidenIntervalsForRandomWalk() {
        Random random = new Random(7);
        double[] y = new double[80];
        for (int i = 1; i < y.length; i++) {
            y[i] = y[i - 1] + random.nextGaussian();
        }

        ModelForecast forecast = new AutoArimaForecaster(1, MAX_EVALUATIONS).fit(y).forecast(10);

        assertThat(forecast.isFinite()).isTrue();
        assertThat(forecast.standardError(0)).isPositive();
        for (int h = 1; h < 10; h++) {
            assertThat(forecast.standardError(h)).isGreaterThanOrEqualTo(forecast.standardError(h - 1));
        }
    }

    @Test
    @DisplayName("Should map partial autocorrelations to AR coefficients")
    void shouldMapPartials() {
        double[] coefficients = AutoArimaForecaster.fromPartials(new double[] {atanh(0.5), atanh(0.2)});

        assertThat(coefficients[0]).isCloseTo(0.4, within(1e-12));
        assertThat(coefficients[1]).isCloseTo(0.2, within(1e-12));
        assertThat(AutoArimaForecaster.fromPartials(new double[0])).isEmpty();
    }

    @Test
    @DisplayName("Should difference at the requested lag")
    void shouldDifference() {
        double[] x = {1, 3, 6, 10};

        assertThat(AutoArimaForecaster.difference(x, 1)).containsExactly(2.0, 3.0, 4.0);
        assertThat(AutoArimaForecaster.difference(x, 2)).containsExactly(5.0, 7.0);
    }

    @Test
    @DisplayName("Should fail when differencing leaves too few values")
    void shouldFailOnShortSeries() {
        assertThatThrownBy(() -> new AutoArimaForecaster(1, MAX_EVALUATIONS).fit(new double[] {1, 2, 4}))
                .isInstanceOf(ComputationException.class);
    }

    @Test
    @DisplayName("Should fail when a seasonal difference leaves three values")
    void shouldFailWhenSeasonalDifferenceLeavesThreeValues() {
        double[] y = {1, 5, 9, 1, 5, 9};

        assertThatThrownBy(() -> new AutoArimaForecaster(3, MAX_EVALUATIONS).fit(y))
                .isInstanceOf(ComputationException.class)
                .hasMessageContaining("after differencing, got: 3");
    }

    @Test
    @DisplayName("Should fit when a seasonal difference leaves four values")
    void shouldFitWhenSeasonalDifferenceLeavesFourValues() {
        double[] pattern = {2, 6, 4, 8};
        double[] y = new double[8];
        for (int i = 0; i < y.length; i++) {
            y[i] = pattern[i % 4];
        }

        FittedModel fitted = new AutoArimaForecaster(4, MAX_EVALUATIONS).fit(y);
        ModelForecast forecast = fitted.forecast(4);

        assertThat(fitted.describe()).contains("(0,1,0)[4]");
        for (int h = 0; h < 4; h++) {
            assertThat(forecast.mean(h)).isCloseTo(pattern[h], within(1e-6));
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double atanh(double x) {
        return 0.5 * Math.log((1 + x) / (1 - x));
    }
}
