package com.costwatch.analytics.engine;

import com.costwatch.analytics.model.Sensitivity;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable detector configuration. A single instance may be shared by
 * concurrent detector calls.
 */
@Value
@Builder(toBuilder = true)
public class AnomalyDetectionConfig {

    @Builder.Default
    Sensitivity sensitivity = Sensitivity.MEDIUM;

    // Trailing window used as the baseline for point anomalies
    @Builder.Default
    int lookbackPeriods = 14;

    // Cycle length for seasonal comparison; null disables the seasonal pass
    Integer seasonalityPeriods;

    // Drop Saturday/Sunday (UTC) points before detection
    boolean excludeWeekends;

    @Builder.Default
    DetectionThresholds thresholds = DetectionThresholds.defaults();

    public static AnomalyDetectionConfig defaults() {
        return AnomalyDetectionConfig.builder().build();
    }

    public double zScoreThreshold() {
        return thresholds.zScoreThreshold(sensitivity);
    }

    public double trendThreshold() {
        return thresholds.trendThreshold(sensitivity);
    }

    /**
     * Window used by the trend-shift pass: {@code min(maxTrendWindow, lookback / 2)}.
     */
    public int trendWindow() {
        return Math.min(thresholds.getMaxTrendWindow(), lookbackPeriods / 2);
    }

    public boolean hasSeasonality() {
        return seasonalityPeriods != null;
    }

    public void validate() {
        if (sensitivity == null) {
            throw new IllegalArgumentException("sensitivity must be set");
        }
        if (lookbackPeriods < 1) {
            throw new IllegalArgumentException("lookbackPeriods must be >= 1, was " + lookbackPeriods);
        }
        if (seasonalityPeriods != null && seasonalityPeriods < 1) {
            throw new IllegalArgumentException("seasonalityPeriods must be >= 1, was " + seasonalityPeriods);
        }
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds must be set");
        }
        if (thresholds.getMadFloorRatio() < 0) {
            throw new IllegalArgumentException("madFloorRatio must be >= 0, was " + thresholds.getMadFloorRatio());
        }
    }
}
