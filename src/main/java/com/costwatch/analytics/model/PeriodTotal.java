package com.costwatch.analytics.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PeriodTotal {

    double current;

    double previous;

    CostDelta delta;
}
