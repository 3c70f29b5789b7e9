package com.costwatch.analytics.service;

import com.costwatch.analytics.model.SeriesStatistics;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class InsightGeneratorTest {

    private final InsightGenerator generator = new InsightGenerator(InsightThresholds.defaults());

    @Test
    void insights_growth_reportsWeekAndMonth() {
        double[] values = {100, 100, 100, 100, 100, 100, 100, 130};

        assertThat(generator.insights(values)).containsExactly(
                "Significant week-over-week cost increase of 30.0%",
                "Notable month-over-month cost growth of 30.0%");
    }

    @Test
    void insights_reduction() {
        double[] values = {200, 200, 200, 200, 200, 200, 200, 100};

        assertThat(generator.insights(values)).containsExactly(
                "Significant week-over-week cost decrease of 50.0%",
                "Notable month-over-month cost reduction of 50.0%");
    }

    @Test
    void insights_monthComparisonUsesThirtyPointsBack() {
        double[] values = new double[40];
        Arrays.fill(values, 100);
        values[10] = 50;
        values[39] = 110;

        // week-over-week +10% and month-over-month (against values[10]) +120%
        assertThat(generator.insights(values)).containsExactly("Notable month-over-month cost growth of 120.0%");
    }

    @Test
    void insights_volatileSeries_raisesCaution() {
        double[] values = {10, 100, 10, 100, 10, 100, 10};

        List<String> insights = generator.insights(values);

        assertThat(insights).hasSize(1);
        assertThat(insights.get(0)).startsWith("High cost volatility detected (91.");
    }

    @Test
    void insights_tooFewPoints_empty() {
        assertThat(generator.insights(new double[]{100, 200, 300, 400, 500, 600})).isEmpty();
    }

    @Test
    void recommendations_volatileSeries() {
        assertThat(generator.recommendations(new double[]{10, 100, 10, 100, 10, 100, 10})).containsExactly(
                "Implement cost budgets and alerts to better track spending variations",
                "Consider using reserved instances or savings plans for more predictable costs");
    }

    @Test
    void recommendations_risingSeries() {
        assertThat(generator.recommendations(new double[]{100, 110, 120, 130, 140, 150, 160})).containsExactly(
                "Cost trend is increasing - review recent resource additions and scaling policies",
                "Consider implementing automated cost optimization tools");
    }

    @Test
    void recommendations_flatSeries_none() {
        assertThat(generator.recommendations(new double[]{100, 100, 100, 100, 100, 100, 100})).isEmpty();
    }

    @Test
    void statistics_describeSeries() {
        SeriesStatistics stats = generator.statistics(new double[]{100, 110, 120, 130, 140, 150, 160});

        assertThat(stats.getPointCount()).isEqualTo(7);
        assertThat(stats.getLatestValue()).isEqualTo(160.0);
        assertThat(stats.getTrendSlope()).isCloseTo(10.0, within(1e-9));
        assertThat(stats.getTrendStrength()).isCloseTo(1.0, within(1e-9));
        assertThat(stats.getVolatility()).isCloseTo(20.0 / 130.0, within(1e-9));
    }

    @Test
    void statistics_emptySeries() {
        SeriesStatistics stats = generator.statistics(new double[0]);

        assertThat(stats.getPointCount()).isZero();
        assertThat(stats.getLatestValue()).isZero();
        assertThat(stats.getVolatility()).isZero();
    }
}
