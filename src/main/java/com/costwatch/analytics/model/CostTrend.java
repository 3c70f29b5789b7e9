package com.costwatch.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CostTrend {
    INCREASING,
    DECREASING,
    STABLE;

    // Serialized as "increasing", "decreasing" or "stable"
    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
