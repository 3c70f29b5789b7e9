package com.costwatch.analytics.engine;

import com.costwatch.analytics.model.AnomalyType;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory text attached to anomalies: a human-readable description and a short
 * list of plausible causes.
 */
public final class AnomalyCauses {

    private AnomalyCauses() {}

    /**
     * Base causes for the anomaly type, followed by escalated causes for spikes and
     * drops whose deviation exceeds {@code escalationPercentage}.
     */
    public static List<String> forAnomaly(AnomalyType type, double deviationPercentage, double escalationPercentage) {
        List<String> causes = new ArrayList<>();
        boolean escalated = deviationPercentage > escalationPercentage;

        switch (type) {
            case SPIKE:
                causes.add("Increased resource usage or traffic");
                causes.add("New service deployments or scaling events");
                causes.add("Data transfer spikes or storage usage increases");
                if (escalated) {
                    causes.add("Potential security incident or DDoS attack");
                    causes.add("Misconfigured auto-scaling rules");
                }
                break;
            case DROP:
                causes.add("Reduced usage or traffic patterns");
                causes.add("Service shutdowns or downscaling");
                causes.add("Resource optimization implementations");
                if (escalated) {
                    causes.add("Service outages or failures");
                    causes.add("Billing or account issues");
                }
                break;
            case TREND_CHANGE:
                causes.add("Business growth or contraction");
                causes.add("Architectural changes or migrations");
                causes.add("New feature rollouts or service changes");
                causes.add("Seasonal business pattern shifts");
                break;
            case SEASONAL_ANOMALY:
                causes.add("Unusual business events or promotions");
                causes.add("Holiday pattern deviations");
                causes.add("Market or economic factors");
                causes.add("Competitor actions or market changes");
                break;
        }
        return causes;
    }

    /**
     * e.g. "statistical anomaly detected: significant increase of 64.2%"
     */
    public static String describe(String label, double signedDeviation, double deviationPercentage) {
        String direction = signedDeviation > 0 ? "increase" : "decrease";
        return String.format("%s anomaly detected: %s %s of %.1f%%",
                label, magnitude(deviationPercentage), direction, deviationPercentage);
    }

    static String magnitude(double deviationPercentage) {
        if (deviationPercentage > 100) return "massive";
        if (deviationPercentage > 50) return "significant";
        if (deviationPercentage > 25) return "notable";
        return "minor";
    }
}
