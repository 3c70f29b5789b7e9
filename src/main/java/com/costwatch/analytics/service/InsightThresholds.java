package com.costwatch.analytics.service;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InsightThresholds {

    // Minimum points before any narrative insight is produced
    @Builder.Default int minPoints = 7;

    // Offsets (in points) of the week-ago and month-ago comparison values
    @Builder.Default int weekOffset = 7;
    @Builder.Default int monthOffset = 30;

    @Builder.Default double weekOverWeekPercentage = 15.0;
    @Builder.Default double monthOverMonthPercentage = 25.0;

    // Coefficient of variation above which a caution is raised
    @Builder.Default double volatilityCaution = 0.3;

    // Coefficient of variation above which budgets/alerts are recommended
    @Builder.Default double volatilityRecommendation = 0.2;

    // Slope of the trailing window above which scaling review is recommended
    @Builder.Default double trendSlope = 0.1;
    @Builder.Default int trendWindow = 14;

    public static InsightThresholds defaults() {
        return InsightThresholds.builder().build();
    }
}
