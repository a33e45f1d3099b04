package com.example.gsiprojection.pricing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NormalApproximatorTest {

    @Test
    @DisplayName("cdf(0) is one half")
    void cdfAtZeroIsHalf() {
        assertThat(NormalApproximator.cdf(0.0)).isCloseTo(0.5, within(1e-7));
    }

    @Test
    @DisplayName("Matches tabulated quantiles")
    void matchesTabulatedValues() {
        assertThat(NormalApproximator.cdf(1.0)).isCloseTo(0.841345, within(1e-6));
        assertThat(NormalApproximator.cdf(1.96)).isCloseTo(0.975002, within(1e-6));
        assertThat(NormalApproximator.cdf(-1.645)).isCloseTo(0.049985, within(1e-6));
    }

    @Test
    @DisplayName("cdf(z) + cdf(-z) == 1")
    void symmetric() {
        for (double z = -8.0; z <= 8.0; z += 0.37) {
            assertThat(NormalApproximator.cdf(z) + NormalApproximator.cdf(-z))
                    .as("z=%s", z)
                    .isCloseTo(1.0, within(1e-12));
        }
    }

    @Test
    @DisplayName("Non-decreasing across the whole line, including the clamps")
    void monotone() {
        double previous = NormalApproximator.cdf(-10.0);
        for (double z = -10.0; z <= 10.0; z += 0.01) {
            double current = NormalApproximator.cdf(z);
            assertThat(current).as("z=%s", z).isGreaterThanOrEqualTo(previous);
            assertThat(current).isBetween(0.0, 1.0);
            previous = current;
        }
    }

    @Test
    @DisplayName("Pinned to exactly 0 and 1 beyond six standard deviations")
    void clampsTails() {
        assertThat(NormalApproximator.cdf(6.01)).isEqualTo(1.0);
        assertThat(NormalApproximator.cdf(-6.01)).isEqualTo(0.0);
        assertThat(NormalApproximator.cdf(Double.POSITIVE_INFINITY)).isEqualTo(1.0);
        assertThat(NormalApproximator.cdf(Double.NEGATIVE_INFINITY)).isEqualTo(0.0);
    }
}
