package com.costwatch.analytics.model;

public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Map a score-to-threshold ratio onto a severity tier.
     * Cut-offs are strict: a ratio of exactly 2.0 is MEDIUM, not HIGH.
     */
    public static Severity fromRatio(double ratio, double criticalRatio, double highRatio, double mediumRatio) {
        if (ratio > criticalRatio) return CRITICAL;
        if (ratio > highRatio) return HIGH;
        if (ratio > mediumRatio) return MEDIUM;
        return LOW;
    }
}
