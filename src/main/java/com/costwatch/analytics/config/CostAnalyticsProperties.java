package com.costwatch.analytics.config;

import com.costwatch.analytics.engine.AnomalyDetectionConfig;
import com.costwatch.analytics.engine.DetectionThresholds;
import com.costwatch.analytics.model.CostDeltaOptions;
import com.costwatch.analytics.model.Sensitivity;
import com.costwatch.analytics.service.DeltaThresholds;
import com.costwatch.analytics.service.InsightThresholds;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "cost-analytics")
public class CostAnalyticsProperties {

    private Detection detection = new Detection();

    private Delta delta = new Delta();

    private Insights insights = new Insights();

    private Orchestrator orchestrator = new Orchestrator();

    @Data
    public static class Detection {
        private Sensitivity sensitivity = Sensitivity.MEDIUM;
        private int lookbackPeriods = 14;
        // Unset disables the seasonal pass. 7 = weekly cycle on daily data.
        private Integer seasonalityPeriods;
        private boolean excludeWeekends = false;
        private Thresholds thresholds = new Thresholds();

        public AnomalyDetectionConfig toConfig() {
            return AnomalyDetectionConfig.builder()
                    .sensitivity(sensitivity)
                    .lookbackPeriods(lookbackPeriods)
                    .seasonalityPeriods(seasonalityPeriods)
                    .excludeWeekends(excludeWeekends)
                    .thresholds(thresholds.toThresholds())
                    .build();
        }
    }

    @Data
    public static class Thresholds {
        private double pointThresholdHigh = 2.5;
        private double pointThresholdMedium = 3.5;
        private double pointThresholdLow = 4.5;
        private double madFloorRatio = 0.01;
        private double trendThresholdHigh = 0.1;
        private double trendThresholdMedium = 0.2;
        private double trendThresholdLow = 0.3;
        private int maxTrendWindow = 7;
        private double seasonalAbsoluteRatio = 0.30;
        private double seasonalMinPercentage = 25.0;
        private double pointConfidenceCap = 95.0;
        private double trendConfidenceCap = 90.0;
        private double seasonalConfidence = 80.0;
        private double criticalRatio = 3.0;
        private double highRatio = 2.0;
        private double mediumRatio = 1.5;
        private double escalationPercentage = 50.0;

        public DetectionThresholds toThresholds() {
            return DetectionThresholds.builder()
                    .pointThresholdHigh(pointThresholdHigh)
                    .pointThresholdMedium(pointThresholdMedium)
                    .pointThresholdLow(pointThresholdLow)
                    .madFloorRatio(madFloorRatio)
                    .trendThresholdHigh(trendThresholdHigh)
                    .trendThresholdMedium(trendThresholdMedium)
                    .trendThresholdLow(trendThresholdLow)
                    .maxTrendWindow(maxTrendWindow)
                    .seasonalAbsoluteRatio(seasonalAbsoluteRatio)
                    .seasonalMinPercentage(seasonalMinPercentage)
                    .pointConfidenceCap(pointConfidenceCap)
                    .trendConfidenceCap(trendConfidenceCap)
                    .seasonalConfidence(seasonalConfidence)
                    .criticalRatio(criticalRatio)
                    .highRatio(highRatio)
                    .mediumRatio(mediumRatio)
                    .escalationPercentage(escalationPercentage)
                    .build();
        }
    }

    @Data
    public static class Delta {
        private int topN = 5;
        private double significantChangeThreshold = 10.0;
        private boolean includeZeroCost = false;
        private double stablePercentage = 1.0;
        private double anomalyPercentage = 25.0;
        private double volatilityReferenceStdDev = 20.0;
        private double volatilityReferenceScore = 50.0;
        private int maxSignificantChanges = 5;

        public CostDeltaOptions toOptions() {
            return CostDeltaOptions.builder()
                    .topN(topN)
                    .significantChangeThreshold(significantChangeThreshold)
                    .includeZeroCost(includeZeroCost)
                    .build();
        }

        public DeltaThresholds toThresholds() {
            return DeltaThresholds.builder()
                    .stablePercentage(stablePercentage)
                    .anomalyPercentage(anomalyPercentage)
                    .volatilityReferenceStdDev(volatilityReferenceStdDev)
                    .volatilityReferenceScore(volatilityReferenceScore)
                    .maxSignificantChanges(maxSignificantChanges)
                    .build();
        }
    }

    @Data
    public static class Insights {
        private int minPoints = 7;
        private int weekOffset = 7;
        private int monthOffset = 30;
        private double weekOverWeekPercentage = 15.0;
        private double monthOverMonthPercentage = 25.0;
        private double volatilityCaution = 0.3;
        private double volatilityRecommendation = 0.2;
        private double trendSlope = 0.1;
        private int trendWindow = 14;

        public InsightThresholds toThresholds() {
            return InsightThresholds.builder()
                    .minPoints(minPoints)
                    .weekOffset(weekOffset)
                    .monthOffset(monthOffset)
                    .weekOverWeekPercentage(weekOverWeekPercentage)
                    .monthOverMonthPercentage(monthOverMonthPercentage)
                    .volatilityCaution(volatilityCaution)
                    .volatilityRecommendation(volatilityRecommendation)
                    .trendSlope(trendSlope)
                    .trendWindow(trendWindow)
                    .build();
        }
    }

    @Data
    public static class Orchestrator {
        // Worker threads for per-service detection
        private int parallelism = 4;
    }
}
