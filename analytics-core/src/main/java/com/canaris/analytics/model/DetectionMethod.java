package com.canaris.analytics.model;

public enum DetectionMethod {
    ML,
    STATISTICAL;

    public String label() {
        return name().toLowerCase();
    }
}
