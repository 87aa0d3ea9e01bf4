package com.canaris.analytics.rootcause;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class RootCauseAnalysis {
    String eventId;
    /** {@code null} when no asset could be scored. */
    String rootCauseAssetId;
    double confidence;
    /** Normalised score per candidate asset, in first-seen order. */
    @Singular
    Map<String, Double> assetScores;
    @Singular
    List<String> contributingFactors;
    int correlatedEventsCount;
    Instant analyzedAt;
}
