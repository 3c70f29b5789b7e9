package com.costwatch.analytics.service;

import com.costwatch.analytics.config.AnalyticsMetrics;
import com.costwatch.analytics.engine.stats.Statistics;
import com.costwatch.analytics.model.CostDelta;
import com.costwatch.analytics.model.CostDeltaAnalysis;
import com.costwatch.analytics.model.CostDeltaOptions;
import com.costwatch.analytics.model.CostTrend;
import com.costwatch.analytics.model.DeltaInsights;
import com.costwatch.analytics.model.DeltaTotals;
import com.costwatch.analytics.model.PeriodTotal;
import com.costwatch.analytics.model.ServiceCostDelta;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Period-over-period cost comparison for per-service daily cost histories.
 *
 * All period boundaries are computed on UTC calendar days relative to "today"
 * as given by the injected clock:
 * <ul>
 *   <li>yesterday vs. the day before</li>
 *   <li>[today-7, today-1) vs. [today-14, today-7)</li>
 *   <li>month to date vs. the full previous calendar month</li>
 * </ul>
 */
@Service
public class CostDeltaService {

    private static final Logger log = LoggerFactory.getLogger(CostDeltaService.class);

    private final Clock clock;
    private final CostDeltaOptions defaultOptions;
    private final DeltaThresholds thresholds;
    private final AnalyticsMetrics metrics;

    public CostDeltaService(@Qualifier("analyticsClock") Clock clock,
                            CostDeltaOptions defaultOptions,
                            DeltaThresholds thresholds,
                            AnalyticsMetrics metrics) {
        this.clock = clock;
        this.defaultOptions = defaultOptions;
        this.thresholds = thresholds;
        this.metrics = metrics;
    }

    /**
     * Delta between two cost values. When {@code previous} is 0 the percentage is
     * 100 for a positive current value and 0 otherwise.
     */
    public static CostDelta calculateDelta(double current, double previous) {
        return calculateDelta(current, previous, DeltaThresholds.defaults().getStablePercentage());
    }

    static CostDelta calculateDelta(double current, double previous, double stablePercentage) {
        double absolute = current - previous;
        double percentage;
        if (previous == 0) {
            percentage = current > 0 ? 100.0 : 0.0;
        } else {
            percentage = (current - previous) / previous * 100.0;
        }

        CostTrend trend;
        if (Math.abs(percentage) < stablePercentage) {
            trend = CostTrend.STABLE;
        } else if (absolute > 0) {
            trend = CostTrend.INCREASING;
        } else {
            trend = CostTrend.DECREASING;
        }

        return CostDelta.builder()
                .absolute(absolute)
                .percentage(percentage)
                .trend(trend)
                .build();
    }

    public CostDeltaAnalysis analyzeDelta(Map<String, Map<LocalDate, Double>> dailyCostsByService) {
        return analyzeDelta(dailyCostsByService, defaultOptions);
    }

    /**
     * Compare cost periods across all services.
     *
     * @param dailyCostsByService service name → (UTC day → cost); iteration order of the
     *                            outer map is preserved in {@code serviceDeltas}
     * @param options             top-N size, significance threshold, zero-cost inclusion
     */
    @Observed(name = "analytics.delta", contextualName = "analyze-cost-delta")
    public CostDeltaAnalysis analyzeDelta(Map<String, Map<LocalDate, Double>> dailyCostsByService,
                                          CostDeltaOptions options) {
        if (options.getTopN() < 0) {
            throw new IllegalArgumentException("topN must be >= 0, was " + options.getTopN());
        }

        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        PeriodWindows windows = PeriodWindows.anchoredOn(today);

        double yesterdayTotal = 0;
        double dayBeforeTotal = 0;
        double last7Total = 0;
        double previous7Total = 0;
        double thisMonthTotal = 0;
        double lastMonthTotal = 0;
        int skipped = 0;

        List<ServiceCostDelta> serviceDeltas = new ArrayList<>();

        for (Map.Entry<String, Map<LocalDate, Double>> service : dailyCostsByService.entrySet()) {
            double serviceYesterday = 0;
            double serviceDayBefore = 0;

            for (Map.Entry<LocalDate, Double> day : service.getValue().entrySet()) {
                LocalDate date = day.getKey();
                Double boxed = day.getValue();
                if (date == null || boxed == null || !Double.isFinite(boxed)) {
                    skipped++;
                    continue;
                }
                double cost = boxed;

                if (date.equals(windows.yesterday)) {
                    yesterdayTotal += cost;
                    serviceYesterday += cost;
                }
                if (date.equals(windows.dayBeforeYesterday)) {
                    dayBeforeTotal += cost;
                    serviceDayBefore += cost;
                }
                if (windows.inLast7Days(date)) {
                    last7Total += cost;
                }
                if (windows.inPrevious7Days(date)) {
                    previous7Total += cost;
                }
                if (windows.inThisMonth(date)) {
                    thisMonthTotal += cost;
                }
                if (windows.inLastMonth(date)) {
                    lastMonthTotal += cost;
                }
            }

            if (options.isIncludeZeroCost() || serviceYesterday > 0 || serviceDayBefore > 0) {
                serviceDeltas.add(ServiceCostDelta.builder()
                        .serviceName(service.getKey())
                        .currentCost(serviceYesterday)
                        .previousCost(serviceDayBefore)
                        .delta(delta(serviceYesterday, serviceDayBefore))
                        .build());
            }
        }

        if (skipped > 0) {
            log.debug("Skipped {} daily cost entries with missing date or non-finite value", skipped);
        }

        List<ServiceCostDelta> byMagnitude = serviceDeltas.stream()
                .sorted(Comparator.comparingDouble((ServiceCostDelta s) -> Math.abs(s.getDelta().getAbsolute())).reversed())
                .collect(Collectors.toList());

        List<ServiceCostDelta> topIncreases = byMagnitude.stream()
                .filter(s -> s.getDelta().getAbsolute() > 0)
                .limit(options.getTopN())
                .collect(Collectors.toList());

        List<ServiceCostDelta> topDecreases = byMagnitude.stream()
                .filter(s -> s.getDelta().getAbsolute() < 0)
                .limit(options.getTopN())
                .collect(Collectors.toList());

        CostDelta yesterdayDelta = delta(yesterdayTotal, dayBeforeTotal);
        int volatilityScore = volatilityScore(serviceDeltas, thresholds);
        boolean anomalyDetected = Math.abs(yesterdayDelta.getPercentage()) > thresholds.getAnomalyPercentage();

        DeltaInsights insights = DeltaInsights.builder()
                .volatilityScore(volatilityScore)
                .anomalyDetected(anomalyDetected)
                .significantChanges(significantChanges(serviceDeltas, options.getSignificantChangeThreshold(),
                        thresholds.getMaxSignificantChanges()))
                .build();

        DeltaTotals totals = DeltaTotals.builder()
                .yesterday(periodTotal(yesterdayTotal, dayBeforeTotal))
                .last7Days(periodTotal(last7Total, previous7Total))
                .thisMonth(periodTotal(thisMonthTotal, lastMonthTotal))
                .build();

        metrics.recordDeltaAnalysis(volatilityScore, anomalyDetected);
        log.info("Delta analysis for {}: services={}, yesterday={} ({}%), volatilityScore={}, anomaly={}",
                today, serviceDeltas.size(),
                String.format("%.2f", yesterdayTotal),
                String.format("%.1f", yesterdayDelta.getPercentage()),
                volatilityScore, anomalyDetected);

        return CostDeltaAnalysis.builder()
                .totals(totals)
                .serviceDeltas(serviceDeltas)
                .topIncreases(topIncreases)
                .topDecreases(topDecreases)
                .insights(insights)
                .build();
    }

    /**
     * Population standard deviation of the finite per-service percentage changes,
     * scaled so that {@code volatilityReferenceStdDev} maps to
     * {@code volatilityReferenceScore}, rounded and capped at 100.
     */
    static int volatilityScore(List<ServiceCostDelta> serviceDeltas, DeltaThresholds thresholds) {
        double[] percentages = Statistics.finiteOnly(serviceDeltas.stream()
                .mapToDouble(s -> s.getDelta().getPercentage())
                .toArray());
        if (percentages.length == 0) {
            return 0;
        }
        double stdDev = Statistics.standardDeviation(percentages);
        double scaled = stdDev / thresholds.getVolatilityReferenceStdDev() * thresholds.getVolatilityReferenceScore();
        return (int) Math.min(100, Math.round(scaled));
    }

    static List<String> significantChanges(List<ServiceCostDelta> serviceDeltas, double threshold, int limit) {
        List<String> changes = new ArrayList<>();
        for (ServiceCostDelta service : serviceDeltas) {
            if (changes.size() >= limit) {
                break;
            }
            double pct = service.getDelta().getPercentage();
            if (!Double.isFinite(pct) || Math.abs(pct) < threshold) {
                continue;
            }
            String direction = service.getDelta().getAbsolute() > 0 ? "increased" : "decreased";
            changes.add(String.format("%s %s by %.1f%%", service.getServiceName(), direction, Math.abs(pct)));
        }
        return changes;
    }

    private CostDelta delta(double current, double previous) {
        return calculateDelta(current, previous, thresholds.getStablePercentage());
    }

    private PeriodTotal periodTotal(double current, double previous) {
        return PeriodTotal.builder()
                .current(current)
                .previous(previous)
                .delta(delta(current, previous))
                .build();
    }

    /**
     * UTC day boundaries of the compared periods.
     */
    static final class PeriodWindows {

        final LocalDate yesterday;
        final LocalDate dayBeforeYesterday;
        final LocalDate last7Start;
        final LocalDate previous7Start;
        final LocalDate thisMonthStart;
        final LocalDate lastMonthStart;
        final LocalDate lastMonthEnd;

        private PeriodWindows(LocalDate today) {
            this.yesterday = today.minusDays(1);
            this.dayBeforeYesterday = today.minusDays(2);
            this.last7Start = today.minusDays(7);
            this.previous7Start = today.minusDays(14);
            this.thisMonthStart = today.withDayOfMonth(1);
            this.lastMonthStart = thisMonthStart.minusMonths(1);
            this.lastMonthEnd = thisMonthStart.minusDays(1);
        }

        static PeriodWindows anchoredOn(LocalDate today) {
            return new PeriodWindows(today);
        }

        boolean inLast7Days(LocalDate date) {
            return !date.isBefore(last7Start) && date.isBefore(yesterday);
        }

        boolean inPrevious7Days(LocalDate date) {
            return !date.isBefore(previous7Start) && date.isBefore(last7Start);
        }

        boolean inThisMonth(LocalDate date) {
            return !date.isBefore(thisMonthStart);
        }

        boolean inLastMonth(LocalDate date) {
            return !date.isBefore(lastMonthStart) && !date.isAfter(lastMonthEnd);
        }
    }
}
