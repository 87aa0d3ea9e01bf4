package com.canaris.analytics.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CompositeHealth {
    double score;
    HealthStatus status;
    boolean jointAnomaly;
    int anomalousMetrics;
    MultivariateDetection detection;
}
