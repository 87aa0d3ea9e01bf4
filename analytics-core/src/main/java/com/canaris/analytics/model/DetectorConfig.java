package com.canaris.analytics.model;

import com.canaris.analytics.features.FeatureConfig;
import com.canaris.analytics.forest.ForestOptions;
import lombok.Builder;
import lombok.Value;

/**
 * Settings shared by the univariate and multivariate detectors.
 */
@Value
@Builder
public class DetectorConfig {

    @Builder.Default
    double threshold = 0.7;
    @Builder.Default
    double contamination = 0.1;
    @Builder.Default
    int minSamples = FeatureConfig.DEFAULT_MIN_SAMPLES;
    @Builder.Default
    ForestOptions forest = ForestOptions.defaults();

    public static DetectorConfig defaults() {
        return DetectorConfig.builder().build();
    }
}
