package com.costwatch.analytics.service;

import com.costwatch.analytics.engine.stats.Statistics;
import com.costwatch.analytics.model.SeriesStatistics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Narrative insights and recommendations derived from an aggregate cost series.
 */
@Component
public class InsightGenerator {

    private final InsightThresholds thresholds;

    public InsightGenerator(InsightThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public List<String> insights(double[] values) {
        List<String> insights = new ArrayList<>();
        int n = values.length;
        if (n < Math.max(thresholds.getMinPoints(), thresholds.getWeekOffset())) {
            return insights;
        }

        double latest = values[n - 1];
        double weekAgo = values[n - thresholds.getWeekOffset()];
        double monthAgo = n > thresholds.getMonthOffset() ? values[n - thresholds.getMonthOffset()] : values[0];

        double weekGrowth = growth(latest, weekAgo);
        double monthGrowth = growth(latest, monthAgo);

        if (Math.abs(weekGrowth) > thresholds.getWeekOverWeekPercentage()) {
            insights.add(String.format("Significant week-over-week cost %s of %.1f%%",
                    weekGrowth > 0 ? "increase" : "decrease", Math.abs(weekGrowth)));
        }

        if (Math.abs(monthGrowth) > thresholds.getMonthOverMonthPercentage()) {
            insights.add(String.format("Notable month-over-month cost %s of %.1f%%",
                    monthGrowth > 0 ? "growth" : "reduction", Math.abs(monthGrowth)));
        }

        double volatility = Statistics.volatility(values);
        if (volatility > thresholds.getVolatilityCaution()) {
            insights.add(String.format(
                    "High cost volatility detected (%.1f%%) - consider investigating irregular spending patterns",
                    volatility * 100));
        }

        return insights;
    }

    public List<String> recommendations(double[] values) {
        List<String> recommendations = new ArrayList<>();
        double volatility = Statistics.volatility(values);
        double slope = trailingSlope(values);

        if (volatility > thresholds.getVolatilityRecommendation()) {
            recommendations.add("Implement cost budgets and alerts to better track spending variations");
            recommendations.add("Consider using reserved instances or savings plans for more predictable costs");
        }

        if (slope > thresholds.getTrendSlope()) {
            recommendations.add("Cost trend is increasing - review recent resource additions and scaling policies");
            recommendations.add("Consider implementing automated cost optimization tools");
        }

        return recommendations;
    }

    public SeriesStatistics statistics(double[] values) {
        return SeriesStatistics.builder()
                .pointCount(values.length)
                .latestValue(values.length == 0 ? 0.0 : values[values.length - 1])
                .volatility(Statistics.volatility(values))
                .trendSlope(trailingSlope(values))
                .trendStrength(Statistics.trendStrength(values))
                .build();
    }

    private double trailingSlope(double[] values) {
        return Statistics.linearTrend(Statistics.tail(values, thresholds.getTrendWindow()));
    }

    // Percentage change; 0 when the reference is not positive
    private static double growth(double latest, double reference) {
        return reference > 0 ? (latest - reference) / reference * 100.0 : 0.0;
    }
}
