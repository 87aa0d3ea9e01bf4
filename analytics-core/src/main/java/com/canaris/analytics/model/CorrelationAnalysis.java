package com.canaris.analytics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CorrelationAnalysis {
    int metricCount;
    int samples;
    /** Sorted by absolute coefficient, strongest first. */
    @Singular
    List<CorrelationPair> pairs;
    String message;
}
