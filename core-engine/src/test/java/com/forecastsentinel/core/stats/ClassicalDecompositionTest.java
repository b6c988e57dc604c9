package com.forecastsentinel.core.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.function.IntToDoubleFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ClassicalDecomposition}.
 */
class ClassicalDecompositionTest {

    private static final double[] PATTERN = {1, -1, 2, -2};
    private static final double[] FACTORS = {1.1, 0.9, 1.2, 0.8};

    @Test
    @DisplayName("Should recover additive seasonal indices around a flat level")
    void shouldRecoverAdditiveIndices() {
        double[] y = repeat(16, i -> 10 + PATTERN[i % 4]);

        ClassicalDecomposition decomposition = ClassicalDecomposition.additive(y, 4);

        assertThat(decomposition.seasonalIndices()).containsExactly(PATTERN, within(1e-9));
        assertThat(decomposition.seasonalStrength()).isCloseTo(1.0, within(1e-9));
        for (double adjusted : decomposition.adjust(y)) {
            assertThat(adjusted).isCloseTo(10, within(1e-9));
        }
        assertThat(decomposition.reseasonalize(10, 18)).isCloseTo(12, within(1e-9));
    }

    @Test
    @DisplayName("Should recover multiplicative seasonal factors")
    void shouldRecoverMultiplicativeFactors() {
        double[] y = repeat(16, i -> 100 * FACTORS[i % 4]);

        ClassicalDecomposition decomposition = ClassicalDecomposition.multiplicative(y, 4);

        assertThat(decomposition.isMultiplicative()).isTrue();
        assertThat(decomposition.seasonalIndices()).containsExactly(FACTORS, within(1e-9));
        assertThat(decomposition.reseasonalize(100, 2)).isCloseTo(120, within(1e-9));
    }

    @Test
    @DisplayName("Should report zero strength for a series without seasonality")
    void shouldReportZeroStrengthForConstant() {
        ClassicalDecomposition decomposition = ClassicalDecomposition.additive(repeat(12, i -> 5), 3);

        assertThat(decomposition.seasonalStrength()).isZero();
        assertThat(decomposition.seasonalIndices()).containsOnly(0.0);
    }

    @Test
    @DisplayName("Should require two full cycles and a period of at least 2")
    void shouldRejectShortSeries() {
        assertThatThrownBy(() -> ClassicalDecomposition.additive(new double[7], 4))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClassicalDecomposition.additive(new double[10], 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double[] repeat(int n, IntToDoubleFunction f) {
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = f.applyAsDouble(i);
        }
        return y;
    }
}
