package com.canaris.analytics.features;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder
public class FeatureConfig {

    public static final int DEFAULT_MIN_SAMPLES = 10;

    @Singular
    List<Integer> rollingWindows;

    @Singular
    List<Integer> lags;

    @Builder.Default
    int minSamples = DEFAULT_MIN_SAMPLES;

    /** Current value, a rolling window of 6 points (the point and its 5 predecessors) and a lag of 1. */
    public static FeatureConfig defaults() {
        return FeatureConfig.builder().rollingWindow(6).lag(1).build();
    }

    public int dimensions() {
        return 1 + 4 * rollingWindows.size() + lags.size();
    }

    /** Column names in vector order. */
    public List<String> featureNames() {
        List<String> names = new ArrayList<>(dimensions());
        names.add("value");
        for (int window : rollingWindows) {
            names.add("rolling_mean_" + window);
            names.add("rolling_std_" + window);
            names.add("rolling_min_" + window);
            names.add("rolling_max_" + window);
        }
        for (int lag : lags) {
            names.add("lag_" + lag);
        }
        return names;
    }
}
