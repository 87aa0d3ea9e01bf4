package com.canaris.analytics.model;

import com.canaris.analytics.forest.IsolationForest;
import lombok.Builder;
import lombok.Value;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * Persisted state of a trained detector: the forest, its calibrated decision
 * boundary and the statistics of every training column.
 */
@Value
@Builder
public class TrainedForest implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    String detectorType;
    IsolationForest forest;
    double boundary;
    double contamination;
    int trainingSamples;
    List<String> columns;
    List<FeatureStatistics> columnStatistics;
}
