package com.canaris.analytics.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TrainingSummary {
    String modelName;
    String version;
    int samples;
    int features;
    double contamination;
    double meanScore;
    double stdScore;
    int anomaliesInTraining;
    int normalInTraining;
}
