package com.canaris.analytics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class MultivariateDetection {
    String modelName;
    String modelVersion;
    AnomalyVerdict verdict;
    @Singular
    Map<String, Double> values;
    @Singular
    List<MetricDeviation> deviations;

    public boolean isAnomaly() {
        return verdict.isAnomaly();
    }
}
