package com.canaris.analytics.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BatchAnalysisResult {
    /** One entry per requested asset, in request order. */
    @Singular
    List<AssetAnalysisResult> results;
    int totalAssets;
    int successful;
    int failed;
    int totalAnomalies;
}
