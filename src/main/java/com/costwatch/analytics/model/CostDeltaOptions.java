package com.costwatch.analytics.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class CostDeltaOptions {

    // How many services to list as top increases and top decreases
    @Builder.Default
    int topN = 5;

    // Per-service percentage change that counts as significant
    @Builder.Default
    double significantChangeThreshold = 10.0;

    @Builder.Default
    boolean includeZeroCost = false;

    public static CostDeltaOptions defaults() {
        return CostDeltaOptions.builder().build();
    }
}
