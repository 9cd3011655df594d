package com.perfwatch.analytics.error;

/**
 * Malformed or insufficient input: non-finite values, an empty series where points are
 * required, or too few points to forecast. Never retried.
 */
public class SeriesValidationException extends IllegalArgumentException {

    public SeriesValidationException(String message) {
        super(message);
    }
}
