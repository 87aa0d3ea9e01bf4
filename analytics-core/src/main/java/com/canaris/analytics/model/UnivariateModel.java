package com.canaris.analytics.model;

import com.canaris.analytics.exception.InsufficientDataException;
import com.canaris.analytics.features.FeatureVector;
import com.canaris.analytics.store.ModelStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Isolation forest over the feature vectors of a single metric.
 */
@Slf4j
public class UnivariateModel extends ForestDetector {

    public static final String TYPE = "univariate";

    public UnivariateModel(String name, ModelStore store, DetectorConfig config) {
        super(name, store, config);
    }

    @Override
    protected String type() {
        return TYPE;
    }

    public TrainingSummary train(List<FeatureVector> vectors) {
        return train(vectors, config.getContamination());
    }

    public TrainingSummary train(List<FeatureVector> vectors, double contamination) {
        return train(vectors, null, contamination);
    }

    /**
     * @param featureNames column names in vector order, or {@code null} for positional names
     */
    public TrainingSummary train(List<FeatureVector> vectors, List<String> featureNames, double contamination) {
        if (vectors.size() < config.getMinSamples()) {
            throw new InsufficientDataException("training '" + name + "'", config.getMinSamples(), vectors.size());
        }
        double[][] data = FeatureVector.toMatrix(vectors);
        int width = data[0].length;
        List<String> columns = featureNames != null ? featureNames : positionalNames(width);
        if (columns.size() != width) {
            throw new IllegalArgumentException("Got " + columns.size() + " feature names for vectors of length " + width);
        }
        return fitAndStore(data, columns, contamination, Map.of());
    }

    /**
     * Scores a batch. Raw forest scores are min-max normalised across the
     * batch, so the most isolated point of the batch scores 1 and a batch of
     * identical scores yields 0 everywhere.
     */
    public List<AnomalyVerdict> predict(List<FeatureVector> vectors) {
        TrainedForest state = requireTrained();
        double[] raw = state.getForest().score(FeatureVector.toMatrix(vectors));
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double r : raw) {
            min = Math.min(min, r);
            max = Math.max(max, r);
        }
        double range = max - min;
        double threshold = config.getThreshold();

        List<AnomalyVerdict> verdicts = new ArrayList<>(vectors.size());
        for (int i = 0; i < raw.length; i++) {
            double score = range > 0 ? (raw[i] - min) / range : 0.0;
            verdicts.add(AnomalyVerdict.builder()
                    .value(vectors.get(i).value())
                    .score(score)
                    .anomaly(score > threshold)
                    .threshold(threshold)
                    .method(DetectionMethod.ML)
                    .meta("rawScore", raw[i])
                    .meta("position", vectors.get(i).getPosition())
                    .build());
        }
        log.debug("Model '{}' scored {} points", name, verdicts.size());
        return verdicts;
    }

    /**
     * Judges one point against the contamination boundary learned in training.
     * The reported score is half the raw forest score and the threshold is half
     * the boundary.
     */
    public AnomalyVerdict detect(FeatureVector vector) {
        TrainedForest state = requireTrained();
        double raw = state.getForest().score(vector.toArray());
        return AnomalyVerdict.builder()
                .value(vector.value())
                .score(confidence(raw))
                .anomaly(raw > state.getBoundary())
                .threshold(confidence(state.getBoundary()))
                .method(DetectionMethod.ML)
                .meta("rawScore", raw)
                .meta("boundary", state.getBoundary())
                .build();
    }

    private static List<String> positionalNames(int width) {
        List<String> names = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            names.add("feature_" + i);
        }
        return names;
    }
}
