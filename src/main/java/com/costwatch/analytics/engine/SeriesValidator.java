package com.costwatch.analytics.engine;

import com.costwatch.analytics.model.DataPoint;

import java.util.List;

public final class SeriesValidator {

    private SeriesValidator() {}

    /**
     * Reject series that are not strictly ascending by timestamp.
     *
     * @throws InvalidSeriesException on the first offending point
     */
    public static void requireAscending(List<DataPoint> series) {
        if (series == null) {
            throw new InvalidSeriesException("Series must not be null");
        }
        DataPoint previous = null;
        for (int i = 0; i < series.size(); i++) {
            DataPoint point = series.get(i);
            if (point == null || point.getTimestamp() == null) {
                throw new InvalidSeriesException("Point " + i + " has no timestamp");
            }
            if (previous != null) {
                int cmp = point.getTimestamp().compareTo(previous.getTimestamp());
                if (cmp == 0) {
                    throw new InvalidSeriesException("Duplicate timestamp " + point.getTimestamp() + " at index " + i);
                }
                if (cmp < 0) {
                    throw new InvalidSeriesException(String.format(
                            "Series not ascending: %s at index %d precedes %s",
                            point.getTimestamp(), i, previous.getTimestamp()));
                }
            }
            previous = point;
        }
    }

    public static double[] values(List<DataPoint> series) {
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = series.get(i).getValue();
        }
        return values;
    }
}
