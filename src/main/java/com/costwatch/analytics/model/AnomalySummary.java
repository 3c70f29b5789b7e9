package com.costwatch.analytics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class AnomalySummary {

    int totalAnomalies;

    int servicesWithAnomalies;

    @Singular("severityCount")
    Map<Severity, Long> countsBySeverity;

    public boolean hasCriticalAnomalies() {
        return countsBySeverity.getOrDefault(Severity.CRITICAL, 0L) > 0;
    }
}
