package com.forecastsentinel.core.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RollingWindow}.
 */
class RollingWindowTest {

    private static final double[] VALUES = {1, 2, 3, 4, 5};

    @Test
    @DisplayName("Should clip a centered odd window at both ends")
    void shouldCenterOddWindow() {
        List<OptionalDouble> means = new RollingWindow(3, true, 1).mean(VALUES);

        assertThat(means.get(0).getAsDouble()).isCloseTo(1.5, within(1e-12));
        assertThat(means.get(2).getAsDouble()).isCloseTo(3.0, within(1e-12));
        assertThat(means.get(4).getAsDouble()).isCloseTo(4.5, within(1e-12));
    }

    @Test
    @DisplayName("Should reach one index further back than forward for an even window")
    void shouldCenterEvenWindow() {
        RollingWindow window = new RollingWindow(4, true, 1);

        assertThat(window.frameStart(2)).isEqualTo(0);
        assertThat(window.frameEnd(2, VALUES.length)).isEqualTo(4);
        assertThat(window.mean(VALUES).get(2).getAsDouble()).isCloseTo(2.5, within(1e-12));
    }

    @Test
    @DisplayName("Should leave trailing frames empty until minPeriods values are available")
    void shouldHonourMinPeriods() {
        List<OptionalDouble> means = new RollingWindow(3, false, 3).mean(VALUES);

        assertThat(means.get(0)).isEmpty();
        assertThat(means.get(1)).isEmpty();
        assertThat(means.get(2).getAsDouble()).isCloseTo(2.0, within(1e-12));
    }

    @Test
    @DisplayName("Should compute the sample standard deviation")
    void shouldComputeSampleStandardDeviation() {
        List<OptionalDouble> deviations = new RollingWindow(3, true, 1).standardDeviation(VALUES);

        assertThat(deviations.get(0).getAsDouble()).isCloseTo(Math.sqrt(0.5), within(1e-12));
        assertThat(deviations.get(2).getAsDouble()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should leave the standard deviation undefined for single-value frames")
    void shouldNotDefineDeviationOfOneValue() {
        List<OptionalDouble> deviations = new RollingWindow(1, true, 1).standardDeviation(VALUES);

        assertThat(deviations).allMatch(OptionalDouble::isEmpty);
    }

    @Test
    @DisplayName("Should report zero spread for a constant frame")
    void shouldReportZeroForConstantFrame() {
        List<OptionalDouble> deviations = new RollingWindow(4, true, 1)
                .standardDeviation(new double[] {7, 7, 7, 7, 7, 7});

        assertThat(deviations).allSatisfy(d -> assertThat(d.getAsDouble()).isZero());
    }

    @Test
    @DisplayName("Should reject invalid window settings")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new RollingWindow(0, true, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RollingWindow(3, true, 4)).isInstanceOf(IllegalArgumentException.class);
    }
}
