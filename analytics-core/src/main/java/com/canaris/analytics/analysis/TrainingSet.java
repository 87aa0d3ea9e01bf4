package com.canaris.analytics.analysis;

import com.canaris.analytics.features.FeatureVector;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TrainingSet {
    @Singular
    List<FeatureVector> vectors;
    List<String> featureNames;
    int assets;
    int seriesUsed;
    int seriesSkipped;
    @Singular
    List<String> failedAssets;

    public int size() {
        return vectors.size();
    }
}
