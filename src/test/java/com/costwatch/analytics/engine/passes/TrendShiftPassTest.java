package com.costwatch.analytics.engine.passes;

import com.costwatch.analytics.engine.AnomalyDetectionConfig;
import com.costwatch.analytics.model.Anomaly;
import com.costwatch.analytics.model.AnomalyType;
import com.costwatch.analytics.model.DetectionMethod;
import com.costwatch.analytics.model.Sensitivity;
import com.costwatch.analytics.model.Severity;
import com.costwatch.analytics.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrendShiftPassTest {

    private final TrendShiftPass pass = new TrendShiftPass();

    @Test
    void detect_flatThenRamp_flagsAcceleration() {
        // lookback 14 -> window 7. At i=14 the recent window [7,14) is 100,100,100,110,120,130,140
        // (slope 200/28) and the prior window is flat.
        List<Anomaly> anomalies = pass.detect(
                TestDataFactory.series(100, 100, 100, 100, 100, 100, 100, 100, 100, 100, 110, 120, 130, 140, 150),
                TestDataFactory.config(Sensitivity.MEDIUM, 14));

        assertThat(anomalies).hasSize(1);
        Anomaly anomaly = anomalies.get(0);
        assertThat(anomaly.getTimestamp()).isEqualTo(TestDataFactory.day(14));
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.TREND_CHANGE);
        assertThat(anomaly.getDetectedBy()).isEqualTo(DetectionMethod.TREND_SHIFT);
        assertThat(anomaly.getExpectedValue()).isEqualTo(140.0);
        assertThat(anomaly.getDeviation()).isEqualTo(10.0);
        assertThat(anomaly.getDeviationPercentage()).isCloseTo(7.142857, within(1e-6));
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(anomaly.getConfidence()).isEqualTo(90.0);
        assertThat(anomaly.getDescription()).contains("acceleration");
        assertThat(anomaly.getPotentialCauses()).hasSize(4).contains("Business growth or contraction");
    }

    @Test
    void detect_constantSlope_noTrendChange() {
        double[] values = IntStream.range(0, 20).mapToDouble(i -> 100 + 5 * i).toArray();

        assertThat(pass.detect(TestDataFactory.series(values), TestDataFactory.config(Sensitivity.HIGH, 14)))
                .isEmpty();
    }

    @Test
    void detect_windowCappedAtSeven() {
        AnomalyDetectionConfig config = TestDataFactory.config(Sensitivity.MEDIUM, 30);
        assertThat(config.trendWindow()).isEqualTo(7);
    }

    @Test
    void detect_lookbackBelowTwo_passDisabled() {
        AnomalyDetectionConfig config = TestDataFactory.config(Sensitivity.HIGH, 1);

        assertThat(config.trendWindow()).isZero();
        assertThat(pass.detect(TestDataFactory.series(1, 50, 2, 80, 3), config)).isEmpty();
    }

    @Test
    void detect_slopeChangeBelowThreshold_ignored() {
        // recent slope 0.25 vs prior 0: above HIGH (0.1) but not LOW (0.3)
        double[] values = {100, 100, 100, 100, 100.25, 100.5, 100.75, 101, 101.25};
        List<Anomaly> high = pass.detect(TestDataFactory.series(values), TestDataFactory.config(Sensitivity.HIGH, 8));
        List<Anomaly> low = pass.detect(TestDataFactory.series(values), TestDataFactory.config(Sensitivity.LOW, 8));

        assertThat(high).isNotEmpty();
        assertThat(low).isEmpty();
    }
}
