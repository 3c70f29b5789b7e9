package com.costwatch.analytics.service;

/**
 * Raised when analysis of one series in a multi-series run fails.
 */
public class AnalyticsException extends RuntimeException {

    private final String seriesName;

    public AnalyticsException(String seriesName, Throwable cause) {
        super("Analysis failed for series '" + seriesName + "': " + cause.getMessage(), cause);
        this.seriesName = seriesName;
    }

    public String getSeriesName() {
        return seriesName;
    }
}
