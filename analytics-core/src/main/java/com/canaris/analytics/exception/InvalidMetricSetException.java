package com.canaris.analytics.exception;

/**
 * Raised when a multivariate call supplies a metric set that does not match
 * the trained one, or metrics of unequal length.
 */
public class InvalidMetricSetException extends AnalyticsException {

    public InvalidMetricSetException(String message) {
        super(message);
    }
}
