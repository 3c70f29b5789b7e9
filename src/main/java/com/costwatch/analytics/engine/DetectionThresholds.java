package com.costwatch.analytics.engine;

import com.costwatch.analytics.model.Sensitivity;
import com.costwatch.analytics.model.Severity;
import lombok.Builder;
import lombok.Value;

/**
 * Numeric cut-offs used by the detection passes. Every field can be overridden
 * through {@code cost-analytics.detection.thresholds.*}.
 */
@Value
@Builder(toBuilder = true)
public class DetectionThresholds {

    // Modified z-score thresholds per sensitivity
    @Builder.Default double pointThresholdHigh = 2.5;
    @Builder.Default double pointThresholdMedium = 3.5;
    @Builder.Default double pointThresholdLow = 4.5;

    // Slope-change thresholds per sensitivity
    @Builder.Default double trendThresholdHigh = 0.1;
    @Builder.Default double trendThresholdMedium = 0.2;
    @Builder.Default double trendThresholdLow = 0.3;

    // Lower bound on the zero-MAD fallback scale, as a fraction of |median|
    @Builder.Default double madFloorRatio = 0.01;

    // Upper bound on the trend comparison window
    @Builder.Default int maxTrendWindow = 7;

    // Seasonal pass: absolute deviation must exceed this fraction of the baseline...
    @Builder.Default double seasonalAbsoluteRatio = 0.30;
    // ...and the percentage deviation must exceed this
    @Builder.Default double seasonalMinPercentage = 25.0;

    // Confidence caps per pass
    @Builder.Default double pointConfidenceCap = 95.0;
    @Builder.Default double trendConfidenceCap = 90.0;
    @Builder.Default double seasonalConfidence = 80.0;

    // Severity ratio cut-offs (score / threshold)
    @Builder.Default double criticalRatio = 3.0;
    @Builder.Default double highRatio = 2.0;
    @Builder.Default double mediumRatio = 1.5;

    // Deviation percentage above which escalated causes are suggested
    @Builder.Default double escalationPercentage = 50.0;

    public static DetectionThresholds defaults() {
        return DetectionThresholds.builder().build();
    }

    public double zScoreThreshold(Sensitivity sensitivity) {
        switch (sensitivity) {
            case HIGH: return pointThresholdHigh;
            case LOW: return pointThresholdLow;
            default: return pointThresholdMedium;
        }
    }

    public double trendThreshold(Sensitivity sensitivity) {
        switch (sensitivity) {
            case HIGH: return trendThresholdHigh;
            case LOW: return trendThresholdLow;
            default: return trendThresholdMedium;
        }
    }

    public Severity severityFor(double score, double threshold) {
        return Severity.fromRatio(score / threshold, criticalRatio, highRatio, mediumRatio);
    }

    public double confidence(double score, double threshold, double cap) {
        return Math.min(cap, score / threshold * 100.0);
    }
}
