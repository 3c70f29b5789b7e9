package com.costwatch.analytics.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class AnalyticsMetrics {

    private final MeterRegistry registry;

    public AnalyticsMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSeriesAnalyzed(String scope, int points) {
        Counter.builder("analytics.series.analyzed")
                .tag("scope", scope)
                .register(registry)
                .increment();

        DistributionSummary.builder("analytics.series.points")
                .tag("scope", scope)
                .register(registry)
                .record(points);
    }

    public void recordSeriesSkipped(String reason) {
        Counter.builder("analytics.series.skipped")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String type, String severity) {
        Counter.builder("analytics.anomaly.detected")
                .tag("type", type)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordDeltaAnalysis(int volatilityScore, boolean anomalyDetected) {
        Counter.builder("analytics.delta.count")
                .tag("anomaly", String.valueOf(anomalyDetected))
                .register(registry)
                .increment();

        DistributionSummary.builder("analytics.delta.volatility_score")
                .register(registry)
                .record(volatilityScore);
    }
}
