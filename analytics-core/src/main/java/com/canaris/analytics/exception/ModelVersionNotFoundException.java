package com.canaris.analytics.exception;

import lombok.Getter;

@Getter
public class ModelVersionNotFoundException extends AnalyticsException {

    private final String modelName;
    private final String version;

    public ModelVersionNotFoundException(String modelName, String version) {
        super("Model '" + modelName + "' has no version '" + version + "'");
        this.modelName = modelName;
        this.version = version;
    }
}
