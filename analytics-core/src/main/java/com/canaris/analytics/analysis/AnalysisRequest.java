package com.canaris.analytics.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * What to analyze for each asset. An empty metric list means every metric
 * the source holds for the asset.
 */
@Value
@Builder
public class AnalysisRequest {
    @Singular
    List<String> metricNames;
    Instant start;
    Instant end;
    @Builder.Default
    int limit = 10_000;
    @Builder.Default
    boolean useMl = true;
    String modelName;
    @Builder.Default
    double zThreshold = 3.0;
}
