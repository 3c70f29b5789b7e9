package com.costwatch.analytics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DeltaInsights {

    // 0-100, higher means per-service changes diverge more
    int volatilityScore;

    boolean anomalyDetected;

    @Singular
    List<String> significantChanges;
}
