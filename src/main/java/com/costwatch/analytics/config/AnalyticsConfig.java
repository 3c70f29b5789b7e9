package com.costwatch.analytics.config;

import com.costwatch.analytics.engine.AnomalyDetectionConfig;
import com.costwatch.analytics.model.CostDeltaOptions;
import com.costwatch.analytics.service.DeltaThresholds;
import com.costwatch.analytics.service.InsightThresholds;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns the bound {@link CostAnalyticsProperties} into the immutable settings
 * objects the engine and services are constructed with.
 */
@Configuration
public class AnalyticsConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsConfig.class);

    @Bean
    public AnomalyDetectionConfig anomalyDetectionConfig(CostAnalyticsProperties properties) {
        AnomalyDetectionConfig config = properties.getDetection().toConfig();
        config.validate();
        log.info("Anomaly detection: sensitivity={}, lookback={}, seasonality={}, excludeWeekends={}",
                config.getSensitivity(), config.getLookbackPeriods(),
                config.getSeasonalityPeriods(), config.isExcludeWeekends());
        return config;
    }

    @Bean
    public CostDeltaOptions defaultDeltaOptions(CostAnalyticsProperties properties) {
        return properties.getDelta().toOptions();
    }

    @Bean
    public DeltaThresholds deltaThresholds(CostAnalyticsProperties properties) {
        return properties.getDelta().toThresholds();
    }

    @Bean
    public InsightThresholds insightThresholds(CostAnalyticsProperties properties) {
        return properties.getInsights().toThresholds();
    }

    @Bean
    public Clock analyticsClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService analyticsExecutor(CostAnalyticsProperties properties) {
        int parallelism = properties.getOrchestrator().getParallelism();
        if (parallelism < 1) {
            throw new IllegalArgumentException("cost-analytics.orchestrator.parallelism must be >= 1, was " + parallelism);
        }
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "cost-analytics-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }
}
