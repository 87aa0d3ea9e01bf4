package com.canaris.analytics.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AssetAnalysisResult {
    String assetId;
    boolean success;
    /** Failure description, {@code null} on success. */
    String error;
    int seriesAnalyzed;
    int seriesSkipped;
    int pointsAnalyzed;
    @Singular
    List<AnomalyFinding> findings;

    public static AssetAnalysisResult failed(String assetId, String error) {
        return AssetAnalysisResult.builder().assetId(assetId).success(false).error(error).build();
    }
}
