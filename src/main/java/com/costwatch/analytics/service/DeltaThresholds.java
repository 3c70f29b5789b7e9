package com.costwatch.analytics.service;

import lombok.Builder;
import lombok.Value;

/**
 * Fixed cut-offs of the delta analysis that are not per-call options.
 */
@Value
@Builder
public class DeltaThresholds {

    // |percentage| below this is reported as STABLE
    @Builder.Default double stablePercentage = 1.0;

    // Day-over-day total change (%) above which anomalyDetected is set
    @Builder.Default double anomalyPercentage = 25.0;

    // A std-dev of this many percentage points maps to referenceScore
    @Builder.Default double volatilityReferenceStdDev = 20.0;
    @Builder.Default double volatilityReferenceScore = 50.0;

    @Builder.Default int maxSignificantChanges = 5;

    public static DeltaThresholds defaults() {
        return DeltaThresholds.builder().build();
    }
}
