package com.costwatch.analytics.engine.passes;

import com.costwatch.analytics.engine.AnomalyCauses;
import com.costwatch.analytics.engine.AnomalyDetectionConfig;
import com.costwatch.analytics.engine.DetectionPass;
import com.costwatch.analytics.engine.DetectionThresholds;
import com.costwatch.analytics.engine.SeriesValidator;
import com.costwatch.analytics.model.Anomaly;
import com.costwatch.analytics.model.AnomalyType;
import com.costwatch.analytics.model.DataPoint;
import com.costwatch.analytics.model.DetectionMethod;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares each point with the same phase one cycle earlier
 * ({@code value[i - seasonalityPeriods]}).
 *
 * Runs only when a seasonality period is configured and the series holds at
 * least two full cycles. A point triggers when its absolute deviation exceeds
 * {@code seasonalAbsoluteRatio} of the baseline AND its percentage deviation
 * exceeds {@code seasonalMinPercentage}.
 */
@Component
public class SeasonalDeviationPass implements DetectionPass {

    @Override
    public DetectionMethod method() {
        return DetectionMethod.SEASONAL_DEVIATION;
    }

    @Override
    public List<Anomaly> detect(List<DataPoint> series, AnomalyDetectionConfig config) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (!config.hasSeasonality() || series.size() < config.getSeasonalityPeriods() * 2) {
            return anomalies;
        }

        int period = config.getSeasonalityPeriods();
        double[] values = SeriesValidator.values(series);
        DetectionThresholds thresholds = config.getThresholds();
        double minPct = thresholds.getSeasonalMinPercentage();

        for (int i = period; i < values.length; i++) {
            double current = values[i];
            double baseline = values[i - period];
            double deviation = Math.abs(current - baseline);
            double deviationPct = baseline == 0 ? 0.0 : deviation / Math.abs(baseline) * 100.0;
            double absoluteThreshold = baseline * thresholds.getSeasonalAbsoluteRatio();

            if (deviation <= absoluteThreshold || deviationPct <= minPct) {
                continue;
            }

            anomalies.add(Anomaly.builder()
                    .timestamp(series.get(i).getTimestamp())
                    .actualValue(current)
                    .expectedValue(baseline)
                    .deviation(deviation)
                    .deviationPercentage(deviationPct)
                    .severity(thresholds.severityFor(deviationPct, minPct))
                    .confidence(thresholds.getSeasonalConfidence())
                    .type(AnomalyType.SEASONAL_ANOMALY)
                    .detectedBy(method())
                    .description(String.format(
                            "Unusual seasonal pattern: %.1f%% deviation from same period last cycle", deviationPct))
                    .potentialCauses(AnomalyCauses.forAnomaly(
                            AnomalyType.SEASONAL_ANOMALY, deviationPct, thresholds.getEscalationPercentage()))
                    .build());
        }
        return anomalies;
    }
}
