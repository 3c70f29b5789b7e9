package com.costwatch.analytics.service;

import com.costwatch.analytics.config.AnalyticsMetrics;
import com.costwatch.analytics.engine.AnomalyDetector;
import com.costwatch.analytics.engine.SeriesValidator;
import com.costwatch.analytics.engine.stats.Statistics;
import com.costwatch.analytics.model.Anomaly;
import com.costwatch.analytics.model.AnomalySummary;
import com.costwatch.analytics.model.CloudProvider;
import com.costwatch.analytics.model.CostAnalyticsReport;
import com.costwatch.analytics.model.DataPoint;
import com.costwatch.analytics.model.Severity;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs anomaly detection over an aggregate cost series and, optionally, each
 * service's series, then attaches narrative insights and recommendations.
 *
 * Service series are analyzed in parallel on the analytics executor, one series
 * per task; results are returned in the caller's service order.
 */
@Service
public class CostAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(CostAnalyticsService.class);

    private final AnomalyDetector anomalyDetector;
    private final InsightGenerator insightGenerator;
    private final Executor executor;
    private final Clock clock;
    private final AnalyticsMetrics metrics;

    public CostAnalyticsService(AnomalyDetector anomalyDetector,
                                InsightGenerator insightGenerator,
                                @Qualifier("analyticsExecutor") Executor executor,
                                @Qualifier("analyticsClock") Clock clock,
                                AnalyticsMetrics metrics) {
        this.anomalyDetector = anomalyDetector;
        this.insightGenerator = insightGenerator;
        this.executor = executor;
        this.clock = clock;
        this.metrics = metrics;
    }

    public CostAnalyticsReport analyze(CloudProvider provider, List<DataPoint> costSeries) {
        return analyze(provider, costSeries, Collections.emptyMap());
    }

    /**
     * Analyze the aggregate series and every per-service series.
     *
     * @param provider      provider label copied into the report
     * @param costSeries    aggregate cost series, strictly ascending
     * @param serviceSeries per-service series keyed by service name; may be empty
     * @throws com.costwatch.analytics.engine.InvalidSeriesException if the aggregate series is malformed
     * @throws AnalyticsException if a service series fails, naming that service
     */
    @Observed(name = "analytics.analyze", contextualName = "analyze-provider-costs")
    public CostAnalyticsReport analyze(CloudProvider provider, List<DataPoint> costSeries,
                                       Map<String, List<DataPoint>> serviceSeries) {
        List<Anomaly> overall = anomalyDetector.detectAnomalies(costSeries);
        metrics.recordSeriesAnalyzed("aggregate", costSeries.size());

        Map<String, List<Anomaly>> byService = detectPerService(serviceSeries);

        double[] values = Statistics.finiteOnly(SeriesValidator.values(costSeries));
        CostAnalyticsReport report = CostAnalyticsReport.builder()
                .provider(provider)
                .analysisDate(clock.instant())
                .overallAnomalies(overall)
                .serviceAnomalies(byService)
                .summary(summarize(overall, byService))
                .statistics(insightGenerator.statistics(values))
                .insights(insightGenerator.insights(values))
                .recommendations(insightGenerator.recommendations(values))
                .build();

        log.info("Analyzed {} costs: points={}, overallAnomalies={}, services={}, serviceAnomalies={}",
                provider, costSeries.size(), overall.size(), byService.size(),
                report.getSummary().getTotalAnomalies() - overall.size());
        return report;
    }

    private Map<String, List<Anomaly>> detectPerService(Map<String, List<DataPoint>> serviceSeries) {
        if (serviceSeries == null || serviceSeries.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<String, CompletableFuture<List<Anomaly>>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, List<DataPoint>> entry : serviceSeries.entrySet()) {
            String service = entry.getKey();
            List<DataPoint> series = entry.getValue();
            futures.put(service, CompletableFuture.supplyAsync(() -> detectForService(service, series), executor));
        }

        Map<String, List<Anomaly>> results = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<List<Anomaly>>> entry : futures.entrySet()) {
            try {
                results.put(entry.getKey(), entry.getValue().join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Anomaly detection failed for service {}: {}", entry.getKey(), cause.getMessage(), cause);
                futures.values().forEach(f -> f.cancel(false));
                throw new AnalyticsException(entry.getKey(), cause);
            }
        }
        return results;
    }

    private List<Anomaly> detectForService(String service, List<DataPoint> series) {
        List<Anomaly> anomalies = anomalyDetector.detectAnomalies(series);
        metrics.recordSeriesAnalyzed("service", series.size());

        List<Anomaly> tagged = new ArrayList<>(anomalies.size());
        for (Anomaly anomaly : anomalies) {
            tagged.add(anomaly.toBuilder().affectedService(service).build());
        }
        if (!tagged.isEmpty()) {
            log.debug("Service {}: {} anomalies over {} points", service, tagged.size(), series.size());
        }
        return Collections.unmodifiableList(tagged);
    }

    static AnomalySummary summarize(List<Anomaly> overall, Map<String, List<Anomaly>> byService) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }

        int total = 0;
        int servicesWithAnomalies = 0;
        for (Anomaly anomaly : overall) {
            counts.merge(anomaly.getSeverity(), 1L, Long::sum);
            total++;
        }
        for (List<Anomaly> anomalies : byService.values()) {
            if (!anomalies.isEmpty()) {
                servicesWithAnomalies++;
            }
            for (Anomaly anomaly : anomalies) {
                counts.merge(anomaly.getSeverity(), 1L, Long::sum);
                total++;
            }
        }

        return AnomalySummary.builder()
                .totalAnomalies(total)
                .servicesWithAnomalies(servicesWithAnomalies)
                .countsBySeverity(counts)
                .build();
    }
}
