package com.canaris.analytics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Judgment for one value. {@code score} is always in [0, 1] with higher meaning more anomalous.
 */
@Value
@Builder
public class AnomalyVerdict {
    double value;
    double score;
    boolean anomaly;
    double threshold;
    DetectionMethod method;
    @Singular("meta")
    Map<String, Object> metadata;
}
