package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.model.ForecastModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ForecasterFactory}.
 */
class ForecasterFactoryTest {

    @Test
    @DisplayName("Should create the automatic ARIMA search for AUTO and ARIMA")
    void shouldCreateArima() {
        assertThat(ForecasterFactory.create(ForecastModel.AUTO, 7, 500)).isInstanceOf(AutoArimaForecaster.class);
        assertThat(ForecasterFactory.create(ForecastModel.ARIMA, 7, 500)).isInstanceOf(AutoArimaForecaster.class);
    }

    @Test
    @DisplayName("Should create exponential smoothing and Theta forecasters")
    void shouldCreateEtsAndTheta() {
        assertThat(ForecasterFactory.create(ForecastModel.ETS, 7, 500)).isInstanceOf(AutoEtsForecaster.class);
        assertThat(ForecasterFactory.create(ForecastModel.THETA, 7, 500)).isInstanceOf(AutoThetaForecaster.class);
    }

    @Test
    @DisplayName("Should route an unknown selector to exponential smoothing")
    void shouldRouteUnknownSelectorToEts() {
        Forecaster forecaster = ForecasterFactory.create(ForecastModel.fromId("prophet"), 7, 500);

        assertThat(forecaster.getModelName()).isEqualTo(AutoEtsForecaster.MODEL_NAME);
    }

    @Test
    @DisplayName("Should throw on null model")
    void shouldThrowOnNullModel() {
        assertThatThrownBy(() -> ForecasterFactory.create(null, 7, 500))
                .isInstanceOf(NullPointerException.class);
    }
}
