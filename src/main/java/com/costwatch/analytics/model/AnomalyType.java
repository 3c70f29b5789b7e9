package com.costwatch.analytics.model;

public enum AnomalyType {
    SPIKE,
    DROP,
    TREND_CHANGE,
    SEASONAL_ANOMALY
}
