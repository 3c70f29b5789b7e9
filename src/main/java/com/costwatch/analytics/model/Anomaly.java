package com.costwatch.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Anomaly {

    Instant timestamp;

    double actualValue;

    double expectedValue;

    // Always non-negative
    double deviation;

    // Always non-negative; 0 when the baseline is 0
    double deviationPercentage;

    Severity severity;

    // 0-100
    double confidence;

    AnomalyType type;

    DetectionMethod detectedBy;

    String description;

    @Singular
    List<String> potentialCauses;

    @Singular
    List<String> affectedServices;
}
