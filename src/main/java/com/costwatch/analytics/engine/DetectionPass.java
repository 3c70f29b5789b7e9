package com.costwatch.analytics.engine;

import com.costwatch.analytics.model.Anomaly;
import com.costwatch.analytics.model.DataPoint;
import com.costwatch.analytics.model.DetectionMethod;

import java.util.List;

/**
 * One independent anomaly detection method.
 * Implementations are stateless; configuration is passed on every call.
 */
public interface DetectionPass {

    /**
     * The method this pass implements.
     */
    DetectionMethod method();

    /**
     * Scan a validated, ascending series.
     *
     * @param series the cost series, already checked for ordering and minimum length
     * @param config detector configuration
     * @return anomalies found by this pass, possibly several per series, at most one per point
     */
    List<Anomaly> detect(List<DataPoint> series, AnomalyDetectionConfig config);
}
