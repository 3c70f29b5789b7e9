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
 * Flags single points that sit far from the trailing baseline, using the
 * modified z-score {@code 0.6745 * (x - median) / MAD} over the previous
 * {@code lookbackPeriods} values.
 *
 * When MAD is 0 (more than half the window shares one value) the score falls back
 * to {@code (x - median) / max(1.253314 * meanAD, madFloorRatio * |median|)}, so a
 * move of a fraction of a percent on a flat baseline stays below every threshold.
 * Only a flat window at exactly 0 has no scale; any departure from it scores
 * infinitely high. A point equal to the median always scores 0.
 */
@Component
public class PointAnomalyPass implements DetectionPass {

    static final double MAD_SCALE = 0.6745;
    static final double MEAN_AD_SCALE = 1.253314;

    @Override
    public DetectionMethod method() {
        return DetectionMethod.POINT_ANOMALY;
    }

    @Override
    public List<Anomaly> detect(List<DataPoint> series, AnomalyDetectionConfig config) {
        List<Anomaly> anomalies = new ArrayList<>();
        double[] values = SeriesValidator.values(series);
        int lookback = config.getLookbackPeriods();
        double threshold = config.zScoreThreshold();
        DetectionThresholds thresholds = config.getThresholds();

        for (int i = lookback; i < values.length; i++) {
            double current = values[i];
            double[] window = Arrays.copyOfRange(values, i - lookback, i);
            double median = Statistics.median(window);
            double score = Math.abs(modifiedZScore(current, window, median, thresholds.getMadFloorRatio()));

            if (score <= threshold) {
                continue;
            }

            double signedDeviation = current - median;
            double deviationPct = median == 0 ? 0.0 : Math.abs(signedDeviation / median) * 100.0;
            AnomalyType type = signedDeviation > 0 ? AnomalyType.SPIKE : AnomalyType.DROP;

            anomalies.add(Anomaly.builder()
                    .timestamp(series.get(i).getTimestamp())
                    .actualValue(current)
                    .expectedValue(median)
                    .deviation(Math.abs(signedDeviation))
                    .deviationPercentage(deviationPct)
                    .severity(thresholds.severityFor(score, threshold))
                    .confidence(thresholds.confidence(score, threshold, thresholds.getPointConfidenceCap()))
                    .type(type)
                    .detectedBy(method())
                    .description(AnomalyCauses.describe("statistical", signedDeviation, deviationPct))
                    .potentialCauses(AnomalyCauses.forAnomaly(type, deviationPct, thresholds.getEscalationPercentage()))
                    .build());
        }
        return anomalies;
    }

    static double modifiedZScore(double value, double[] window, double median, double madFloorRatio) {
        double deviation = value - median;
        if (deviation == 0) {
            return 0.0;
        }
        double mad = Statistics.mad(window, median);
        if (mad > 0) {
            return MAD_SCALE * deviation / mad;
        }
        double scale = Math.max(MEAN_AD_SCALE * Statistics.meanAbsoluteDeviation(window, median),
                madFloorRatio * Math.abs(median));
        if (scale > 0) {
            return deviation / scale;
        }
        return deviation > 0 ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
    }
}
