package com.costwatch.analytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Descriptive statistics of the aggregate cost series, reported alongside anomalies.
 */
@Value
@Builder
public class SeriesStatistics {

    int pointCount;

    double latestValue;

    // Coefficient of variation (stdDev / mean)
    double volatility;

    // Slope of the most recent trend window
    double trendSlope;

    // |Pearson r| of value against index, 0-1
    double trendStrength;
}
