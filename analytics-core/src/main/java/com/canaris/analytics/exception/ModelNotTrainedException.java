package com.canaris.analytics.exception;

import lombok.Getter;

@Getter
public class ModelNotTrainedException extends AnalyticsException {

    private final String modelName;

    public ModelNotTrainedException(String modelName) {
        super("No trained model found for '" + modelName + "'");
        this.modelName = modelName;
    }
}
