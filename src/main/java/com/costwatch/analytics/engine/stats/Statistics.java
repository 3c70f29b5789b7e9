package com.costwatch.analytics.engine.stats;

import java.util.Arrays;

/**
 * Stateless numeric helpers shared by the detection passes, the delta analyzer
 * and the insight generator.
 *
 * All methods take raw {@code double[]} values and never modify their argument.
 * Callers are expected to have removed non-finite values first (see {@link #finiteOnly}).
 */
public final class Statistics {

    private Statistics() {}

    /**
     * Median of the values: middle element for odd lengths, mean of the two middle
     * elements for even lengths. Returns 0 for an empty array.
     */
    public static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0
                ? (sorted[mid - 1] + sorted[mid]) / 2.0
                : sorted[mid];
    }

    /**
     * Median absolute deviation around the given center.
     */
    public static double mad(double[] values, double median) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    /**
     * Mean absolute deviation around the given center.
     */
    public static double meanAbsoluteDeviation(double[] values, double center) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += Math.abs(v - center);
        }
        return sum / values.length;
    }

    /**
     * Ordinary-least-squares slope of value against index {@code 0..n-1}:
     * {@code (nΣxy − ΣxΣy) / (nΣx² − (Σx)²)}.
     * Fewer than two values have no slope and yield 0.
     */
    public static double linearTrend(double[] values) {
        int n = values.length;
        if (n < 2) {
            return 0.0;
        }
        double sumX = 0.0;
        double sumY = 0.0;
        double sumXY = 0.0;
        double sumXX = 0.0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += values[i];
            sumXY += i * values[i];
            sumXX += (double) i * i;
        }
        return (n * sumXY - sumX * sumY) / (n * sumXX - sumX * sumX);
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation (divides by n).
     */
    public static double standardDeviation(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double squaredDiffs = 0.0;
        for (double v : values) {
            squaredDiffs += (v - mean) * (v - mean);
        }
        return Math.sqrt(squaredDiffs / values.length);
    }

    /**
     * Coefficient of variation, {@code stdDev / mean}. 0 when there are fewer than
     * two values or the mean is not positive.
     */
    public static double volatility(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        return mean > 0 ? standardDeviation(values) / mean : 0.0;
    }

    /**
     * Absolute Pearson correlation between value and index, in [0, 1].
     * 0 for fewer than three values or when either side has no variance.
     */
    public static double trendStrength(double[] values) {
        int n = values.length;
        if (n < 3) {
            return 0.0;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = mean(values);

        double ssXY = 0.0;
        double ssXX = 0.0;
        double ssYY = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            double dy = values[i] - meanY;
            ssXY += dx * dy;
            ssXX += dx * dx;
            ssYY += dy * dy;
        }
        if (ssXX == 0.0 || ssYY == 0.0) {
            return 0.0;
        }
        return Math.min(1.0, Math.abs(ssXY / Math.sqrt(ssXX * ssYY)));
    }

    /**
     * Copy of the values with NaN and infinities removed.
     */
    public static double[] finiteOnly(double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    /**
     * The last {@code count} values, or all of them when fewer are available.
     */
    public static double[] tail(double[] values, int count) {
        int from = Math.max(0, values.length - count);
        return Arrays.copyOfRange(values, from, values.length);
    }
}
