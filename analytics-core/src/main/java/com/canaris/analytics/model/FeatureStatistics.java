package com.canaris.analytics.model;

import com.canaris.analytics.statistics.Stats;
import lombok.Value;

import java.io.Serial;
import java.io.Serializable;

/**
 * Mean, population std and range of one training column.
 */
@Value
public class FeatureStatistics implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    double mean;
    double std;
    double min;
    double max;

    public static FeatureStatistics of(double[] column) {
        return new FeatureStatistics(Stats.mean(column), Stats.std(column), Stats.min(column), Stats.max(column));
    }

    /** 0 when the column had no spread. */
    public double zScore(double value) {
        return std == 0 ? 0 : (value - mean) / std;
    }
}
