package com.costwatch.analytics.engine.passes;

import com.costwatch.analytics.engine.AnomalyCauses;
import com.costwatch.analytics.engine.AnomalyDetectionConfig;
import com.costwatch.analytics.engine.DetectionPass;
import com.costwatch.analytics.engine.DetectionThresholds;
import com.costwatch.analytics.engine.SeriesValidator;
import com.costwatch.analytics.engine.stats.Statistics;
import com.costwatch.analytics.model.Anomaly;
import com.costwatch.analytics.model.AnomalyType;
import com.costwatch.analytics.model.DataPoint;
import com.costwatch.analytics.model.DetectionMethod;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Detects a change of slope: compares the linear trend of the most recent window
 * with the trend of the window immediately before it.
 */
@Component
public class TrendShiftPass implements DetectionPass {

    @Override
    public DetectionMethod method() {
        return DetectionMethod.TREND_SHIFT;
    }

    @Override
    public List<Anomaly> detect(List<DataPoint> series, AnomalyDetectionConfig config) {
        List<Anomaly> anomalies = new ArrayList<>();
        int window = config.trendWindow();
        if (window < 1) {
            return anomalies;
        }

        double[] values = SeriesValidator.values(series);
        double threshold = config.trendThreshold();
        DetectionThresholds thresholds = config.getThresholds();

        for (int i = window * 2; i < values.length; i++) {
            double recentSlope = Statistics.linearTrend(Arrays.copyOfRange(values, i - window, i));
            double priorSlope = Statistics.linearTrend(Arrays.copyOfRange(values, i - window * 2, i - window));
            double slopeChange = Math.abs(recentSlope - priorSlope);

            if (slopeChange <= threshold) {
                continue;
            }

            double current = values[i];
            double expected = values[i - 1] + priorSlope;
            double deviation = Math.abs(current - expected);
            double deviationPct = expected == 0 ? 0.0 : deviation / Math.abs(expected) * 100.0;
            String direction = recentSlope > priorSlope ? "acceleration" : "deceleration";

            anomalies.add(Anomaly.builder()
                    .timestamp(series.get(i).getTimestamp())
                    .actualValue(current)
                    .expectedValue(expected)
                    .deviation(deviation)
                    .deviationPercentage(deviationPct)
                    .severity(thresholds.severityFor(slopeChange, threshold))
                    .confidence(thresholds.confidence(slopeChange, threshold, thresholds.getTrendConfidenceCap()))
                    .type(AnomalyType.TREND_CHANGE)
                    .detectedBy(method())
                    .description("Significant trend change detected: " + direction + " in cost growth")
                    .potentialCauses(AnomalyCauses.forAnomaly(
                            AnomalyType.TREND_CHANGE, deviationPct, thresholds.getEscalationPercentage()))
                    .build());
        }
        return anomalies;
    }
}
