package com.canaris.analytics.exception;

import lombok.Getter;

@Getter
public class PersistenceException extends AnalyticsException {

    private final String modelName;
    private final String version;

    public PersistenceException(String modelName, String version, String message, Throwable cause) {
        super(String.format("Model store failure for %s@%s: %s", modelName, version, message), cause);
        this.modelName = modelName;
        this.version = version;
    }
}
