package com.costwatch.analytics.engine.stats;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatisticsTest {

    @Test
    void median_oddLength_returnsMiddleElement() {
        assertThat(Statistics.median(new double[]{1, 2, 3})).isEqualTo(2.0);
    }

    @Test
    void median_evenLength_averagesMiddlePair() {
        assertThat(Statistics.median(new double[]{1, 2, 3, 4})).isEqualTo(2.5);
    }

    @Test
    void median_unsortedInput_doesNotModifyArgument() {
        double[] values = {9, 1, 5};
        assertThat(Statistics.median(values)).isEqualTo(5.0);
        assertThat(values).containsExactly(9, 1, 5);
    }

    @Test
    void median_empty_returnsZero() {
        assertThat(Statistics.median(new double[0])).isEqualTo(0.0);
    }

    @Test
    void mad_isMedianOfAbsoluteDeviations() {
        double[] values = {10, 12, 11, 13, 9};
        double median = Statistics.median(values);

        // deviations from 11: 1, 1, 0, 2, 2
        assertThat(median).isEqualTo(11.0);
        assertThat(Statistics.mad(values, median)).isEqualTo(1.0);
    }

    @Test
    void mad_majorityIdentical_isZero() {
        double[] values = {100, 100, 100, 104, 96};
        assertThat(Statistics.mad(values, 100)).isEqualTo(0.0);
        assertThat(Statistics.meanAbsoluteDeviation(values, 100)).isCloseTo(1.6, within(1e-9));
    }

    @Test
    void linearTrend_perfectLine_returnsSlope() {
        assertThat(Statistics.linearTrend(new double[]{1, 2, 3})).isEqualTo(1.0);
        assertThat(Statistics.linearTrend(new double[]{100, 95, 90, 85})).isCloseTo(-5.0, within(1e-9));
    }

    @Test
    void linearTrend_flatOrTooShort_returnsZero() {
        assertThat(Statistics.linearTrend(new double[]{7, 7, 7, 7})).isEqualTo(0.0);
        assertThat(Statistics.linearTrend(new double[]{42})).isEqualTo(0.0);
        assertThat(Statistics.linearTrend(new double[0])).isEqualTo(0.0);
    }

    @Test
    void standardDeviation_isPopulationStdDev() {
        // mean 5, squared diffs sum 32, /8 = 4
        assertThat(Statistics.standardDeviation(new double[]{2, 4, 4, 4, 5, 5, 7, 9})).isEqualTo(2.0);
    }

    @Test
    void volatility_isCoefficientOfVariation() {
        assertThat(Statistics.volatility(new double[]{50, 150})).isCloseTo(0.5, within(1e-9));
        assertThat(Statistics.volatility(new double[]{100, 100, 100})).isEqualTo(0.0);
    }

    @Test
    void volatility_nonPositiveMeanOrSingleValue_returnsZero() {
        assertThat(Statistics.volatility(new double[]{-10, 5})).isEqualTo(0.0);
        assertThat(Statistics.volatility(new double[]{0, 0})).isEqualTo(0.0);
        assertThat(Statistics.volatility(new double[]{100})).isEqualTo(0.0);
    }

    @Test
    void trendStrength_linearSeries_isOne() {
        assertThat(Statistics.trendStrength(new double[]{10, 20, 30, 40})).isCloseTo(1.0, within(1e-9));
        assertThat(Statistics.trendStrength(new double[]{40, 30, 20, 10})).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void trendStrength_flatOrShort_isZero() {
        assertThat(Statistics.trendStrength(new double[]{5, 5, 5, 5})).isEqualTo(0.0);
        assertThat(Statistics.trendStrength(new double[]{1, 2})).isEqualTo(0.0);
    }

    @Test
    void finiteOnly_dropsNaNAndInfinity() {
        double[] values = {1, Double.NaN, 2, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, 3};
        assertThat(Statistics.finiteOnly(values)).containsExactly(1, 2, 3);
    }

    @Test
    void tail_returnsLastValuesOrAll() {
        double[] values = {1, 2, 3, 4, 5};
        assertThat(Statistics.tail(values, 2)).containsExactly(4, 5);
        assertThat(Statistics.tail(values, 10)).containsExactly(1, 2, 3, 4, 5);
    }
}
