package com.costwatch.analytics.engine;

import com.costwatch.analytics.config.AnalyticsMetrics;
import com.costwatch.analytics.model.Anomaly;
import com.costwatch.analytics.model.DataPoint;
import com.costwatch.analytics.model.DetectionMethod;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Runs every registered {@link DetectionPass} over a cost series and consolidates
 * the results so that at most one anomaly is reported per timestamp.
 *
 * Passes are executed in {@link DetectionMethod} order. The detector holds no
 * mutable state and can be shared across threads.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private static final Comparator<Anomaly> RANKING = Comparator
            .comparingInt((Anomaly a) -> a.getSeverity().getRank()).reversed()
            .thenComparing(Comparator.comparingDouble(Anomaly::getConfidence).reversed())
            .thenComparing(a -> a.getDetectedBy() == null ? Integer.MAX_VALUE : a.getDetectedBy().ordinal());

    private final Map<DetectionMethod, DetectionPass> passes;
    private final AnomalyDetectionConfig config;
    private final Tracer tracer;
    private final AnalyticsMetrics metrics;

    public AnomalyDetector(List<DetectionPass> detectionPasses, AnomalyDetectionConfig config,
                           Tracer tracer, AnalyticsMetrics metrics) {
        config.validate();
        this.passes = new EnumMap<>(DetectionMethod.class);
        this.config = config;
        this.tracer = tracer;
        this.metrics = metrics;

        for (DetectionPass pass : detectionPasses) {
            DetectionPass previous = passes.put(pass.method(), pass);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate detection pass for " + pass.method() + ": "
                        + previous.getClass().getSimpleName() + " and " + pass.getClass().getSimpleName());
            }
            log.info("Registered detection pass: {} -> {}", pass.method(), pass.getClass().getSimpleName());
        }
    }

    public AnomalyDetectionConfig getConfig() {
        return config;
    }

    /**
     * Detect anomalies in an ascending cost series.
     *
     * @param series points ordered by strictly ascending timestamp
     * @return consolidated anomalies, ascending by timestamp; empty when the series
     *         is shorter than {@code lookbackPeriods}
     * @throws InvalidSeriesException if the series is not strictly ascending
     */
    public List<Anomaly> detectAnomalies(List<DataPoint> series) {
        SeriesValidator.requireAscending(series);
        List<DataPoint> usable = prepare(series);

        if (usable.size() < config.getLookbackPeriods()) {
            log.debug("Series too short for detection: {} points, lookback={}",
                    usable.size(), config.getLookbackPeriods());
            metrics.recordSeriesSkipped("insufficient_history");
            return List.of();
        }

        List<Anomaly> raw = new ArrayList<>();
        for (DetectionPass pass : passes.values()) {
            Span span = tracer.nextSpan()
                    .name("anomaly.pass." + pass.method().name().toLowerCase())
                    .tag("series.points", String.valueOf(usable.size()))
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                List<Anomaly> found = pass.detect(usable, config);
                span.tag("anomalies", String.valueOf(found.size()));
                raw.addAll(found);
                log.debug("Pass {} emitted {} anomalies over {} points", pass.method(), found.size(), usable.size());
            } catch (RuntimeException e) {
                span.error(e);
                throw e;
            } finally {
                span.end();
            }
        }

        List<Anomaly> consolidated = consolidate(raw);
        for (Anomaly anomaly : consolidated) {
            metrics.recordAnomaly(anomaly.getType().name(), anomaly.getSeverity().name());
        }
        return consolidated;
    }

    /**
     * Keep one anomaly per timestamp: highest severity, then highest confidence,
     * then the earliest pass. Output is ascending by timestamp and unmodifiable.
     */
    public static List<Anomaly> consolidate(List<Anomaly> anomalies) {
        Map<Instant, List<Anomaly>> byTimestamp = anomalies.stream()
                .collect(Collectors.groupingBy(Anomaly::getTimestamp, TreeMap::new, Collectors.toList()));

        List<Anomaly> consolidated = new ArrayList<>(byTimestamp.size());
        for (List<Anomaly> group : byTimestamp.values()) {
            group.stream().min(RANKING).ifPresent(consolidated::add);
        }
        return Collections.unmodifiableList(consolidated);
    }

    private List<DataPoint> prepare(List<DataPoint> series) {
        List<DataPoint> usable = new ArrayList<>(series.size());
        int dropped = 0;
        for (DataPoint point : series) {
            if (!Double.isFinite(point.getValue())) {
                dropped++;
                continue;
            }
            if (config.isExcludeWeekends() && isWeekend(point.getTimestamp())) {
                continue;
            }
            usable.add(point);
        }
        if (dropped > 0) {
            log.debug("Ignored {} non-finite points", dropped);
        }
        return usable;
    }

    private static boolean isWeekend(Instant timestamp) {
        DayOfWeek day = timestamp.atZone(ZoneOffset.UTC).getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
