package com.costwatch.analytics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CostDeltaAnalysis {

    DeltaTotals totals;

    @Singular
    List<ServiceCostDelta> serviceDeltas;

    @Singular
    List<ServiceCostDelta> topIncreases;

    @Singular
    List<ServiceCostDelta> topDecreases;

    DeltaInsights insights;
}
