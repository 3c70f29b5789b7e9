package com.costwatch.analytics.engine;

/**
 * Thrown when a series breaks the detector's input contract
 * (null points, missing timestamps, non-ascending or duplicate timestamps).
 */
public class InvalidSeriesException extends IllegalArgumentException {

    public InvalidSeriesException(String message) {
        super(message);
    }
}
