package com.costwatch.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CostAnalyticsReport {

    CloudProvider provider;

    Instant analysisDate;

    @Singular
    List<Anomaly> overallAnomalies;

    // Keyed by service name, in the caller's order
    @Singular
    Map<String, List<Anomaly>> serviceAnomalies;

    AnomalySummary summary;

    SeriesStatistics statistics;

    @Singular
    List<String> insights;

    @Singular
    List<String> recommendations;
}
