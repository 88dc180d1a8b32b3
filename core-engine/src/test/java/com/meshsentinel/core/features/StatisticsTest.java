package com.meshsentinel.core.features;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Statistics}.
 */
class StatisticsTest {

    @Test
    @DisplayName("Should compute the arithmetic mean")
    void shouldComputeMean() {
        assertThat(Statistics.mean(new double[] { 1, 2, 3, 4 })).isEqualTo(2.5);
        assertThat(Statistics.mean(new double[0])).isZero();
    }

    @Test
    @DisplayName("Should compute the sample standard deviation")
    void shouldComputeSampleStdDev() {
        double std = Statistics.sampleStdDev(new double[] { 10, 12, 14, 16, 18 });

        assertThat(std).isCloseTo(Math.sqrt(10), within(1e-9));
        assertThat(Statistics.sampleStdDev(new double[] { 7 })).isZero();
    }

    @Test
    @DisplayName("Should compute trend relative to the first value")
    void shouldComputeTrend() {
        assertThat(Statistics.trend(new double[] { 10, 15, 20 })).isEqualTo(1.0);
        assertThat(Statistics.trend(new double[] { 20, 10 })).isEqualTo(-0.5);
    }

    @Test
    @DisplayName("Should return zero trend for a zero first value or a single value")
    void shouldGuardTrend() {
        assertThat(Statistics.trend(new double[] { 0, 5, 10 })).isZero();
        assertThat(Statistics.trend(new double[] { 5 })).isZero();
    }

    @Test
    @DisplayName("Should compute volatility from relative step changes")
    void shouldComputeVolatility() {
        // steps of +10% and -10%
        double volatility = Statistics.volatility(new double[] { 100, 110, 99 });

        assertThat(volatility).isCloseTo(Math.sqrt(0.02), within(1e-9));
    }

    @Test
    @DisplayName("Should return zero volatility with fewer than two steps")
    void shouldGuardVolatility() {
        assertThat(Statistics.volatility(new double[] { 100, 200 })).isZero();
        assertThat(Statistics.volatility(new double[] { 0, 0, 0 })).isZero();
    }

    @Test
    @DisplayName("Should compute Euclidean distance")
    void shouldComputeDistance() {
        assertThat(Statistics.euclideanDistance(new double[] { 0, 0 }, new double[] { 3, 4 })).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Should reject vectors of different length")
    void shouldRejectDimensionMismatch() {
        assertThatThrownBy(() -> Statistics.euclideanDistance(new double[] { 1 }, new double[] { 1, 2 }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mismatch");
    }

    @Test
    @DisplayName("Should fall back to 1.0 when dividing by zero")
    void shouldGuardRatio() {
        assertThat(Statistics.ratio(5, 2)).isEqualTo(2.5);
        assertThat(Statistics.ratio(5, 0)).isEqualTo(1.0);
    }
}
