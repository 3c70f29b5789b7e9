package com.costwatch.analytics.model;

/**
 * Independent detection passes run by the anomaly detector, in execution order.
 */
public enum DetectionMethod {
    POINT_ANOMALY,
    TREND_SHIFT,
    SEASONAL_DEVIATION
}
