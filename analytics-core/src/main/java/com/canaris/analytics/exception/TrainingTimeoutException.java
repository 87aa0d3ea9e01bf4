package com.canaris.analytics.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class TrainingTimeoutException extends AnalyticsException {

    private final String modelName;

    public TrainingTimeoutException(String modelName, Duration timeout) {
        super("Training of '" + modelName + "' did not finish within " + timeout.toSeconds() + "s and was cancelled");
        this.modelName = modelName;
    }
}
