package com.canaris.analytics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class ModelInfo {
    String name;
    String type;
    boolean trained;
    String version;
    Instant createdAt;
    double contamination;
    int trainingSamples;
    int features;
    List<String> metricNames;
    @Singular("statistic")
    Map<String, Object> statistics;
}
