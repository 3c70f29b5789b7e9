package com.costwatch.analytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Change between two cost values. {@code percentage} is relative to the previous value.
 */
@Value
@Builder
public class CostDelta {

    double absolute;

    double percentage;

    CostTrend trend;
}
