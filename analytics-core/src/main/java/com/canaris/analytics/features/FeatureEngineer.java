package com.canaris.analytics.features;

import com.canaris.analytics.exception.InsufficientDataException;
import com.canaris.analytics.statistics.Stats;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns an ordered value sequence into one feature vector per position.
 * <p>
 * Layout of each vector: the value itself, then mean/std/min/max for every
 * rolling window, then one entry per lag. Early positions use whatever
 * history exists for the rolling block and repeat the current value for
 * lags that reach before the first point.
 */
@Slf4j
public class FeatureEngineer {

    @Getter
    private final FeatureConfig config;

    public FeatureEngineer(FeatureConfig config) {
        for (int window : config.getRollingWindows()) {
            if (window < 1) {
                throw new IllegalArgumentException("Rolling window must be positive, got " + window);
            }
        }
        for (int lag : config.getLags()) {
            if (lag < 1) {
                throw new IllegalArgumentException("Lag must be positive, got " + lag);
            }
        }
        this.config = config;
    }

    public FeatureEngineer() {
        this(FeatureConfig.defaults());
    }

    public List<FeatureVector> transform(double[] values) {
        if (values.length < config.getMinSamples()) {
            throw new InsufficientDataException("feature engineering", config.getMinSamples(), values.length);
        }
        List<FeatureVector> vectors = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            vectors.add(new FeatureVector(i, featuresAt(values, i)));
        }
        log.debug("Built {} feature vectors of length {}", vectors.size(), config.dimensions());
        return vectors;
    }

    private double[] featuresAt(double[] values, int i) {
        double[] features = new double[config.dimensions()];
        int k = 0;
        features[k++] = values[i];

        for (int window : config.getRollingWindows()) {
            int from = Math.max(0, i - window + 1);
            double[] recent = Arrays.copyOfRange(values, from, i + 1);
            features[k++] = Stats.mean(recent);
            features[k++] = Stats.std(recent);
            features[k++] = Stats.min(recent);
            features[k++] = Stats.max(recent);
        }

        for (int lag : config.getLags()) {
            features[k++] = i >= lag ? values[i - lag] : values[i];
        }
        return features;
    }
}
