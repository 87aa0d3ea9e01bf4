package com.canaris.analytics.exception;

import lombok.Getter;

/**
 * Raised when a series or training set is below the minimum sample floor.
 */
@Getter
public class InsufficientDataException extends AnalyticsException {

    private final int required;
    private final int actual;

    public InsufficientDataException(String context, int required, int actual) {
        super(String.format("Insufficient data for %s: need at least %d samples, got %d", context, required, actual));
        this.required = required;
        this.actual = actual;
    }
}
