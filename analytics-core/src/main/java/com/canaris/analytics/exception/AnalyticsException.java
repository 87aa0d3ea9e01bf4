package com.canaris.analytics.exception;

/**
 * Base type for every failure raised by the analytics engine.
 */
public class AnalyticsException extends RuntimeException {

    public AnalyticsException(String message) {
        super(message);
    }

    public AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
