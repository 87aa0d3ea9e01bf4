package com.canaris.analytics.model;

import com.canaris.analytics.exception.ModelNotTrainedException;
import com.canaris.analytics.forest.IsolationForest;
import com.canaris.analytics.statistics.Stats;
import com.canaris.analytics.store.LoadedModel;
import com.canaris.analytics.store.ModelStore;
import com.canaris.analytics.store.ModelVersion;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Common lifecycle of the isolation forest detectors: eager load from the
 * {@link ModelStore} on construction, explicit train, save and reload.
 * The loaded state is replaced as a whole, so a concurrent reader sees
 * either the old or the new model.
 */
@Slf4j
public abstract class ForestDetector {

    @Getter
    protected final String name;
    protected final ModelStore store;
    @Getter
    protected final DetectorConfig config;

    private volatile Loaded loaded;

    protected ForestDetector(String name, ModelStore store, DetectorConfig config) {
        this.name = name;
        this.store = store;
        this.config = config;
        reload();
    }

    public boolean isTrained() {
        return loaded != null;
    }

    public Optional<String> getVersion() {
        Loaded current = loaded;
        return current == null ? Optional.empty() : Optional.ofNullable(current.version);
    }

    /**
     * Replaces the in-memory model with the store's {@code latest} version.
     * When nothing is stored the detector becomes untrained.
     *
     * @return whether a model was loaded
     */
    public boolean reload() {
        return load(ModelStore.LATEST);
    }

    /**
     * Activates one stored version, or {@code latest}. An unknown explicit
     * version leaves the active model untouched.
     *
     * @return whether a model was loaded
     */
    public boolean load(String version) {
        Optional<LoadedModel<TrainedForest>> found = store.load(name, version, TrainedForest.class);
        if (found.isPresent() && accepts(found.get().getState())) {
            LoadedModel<TrainedForest> model = found.get();
            loaded = new Loaded(model.getState(), model.getVersion(), model.getCreatedAt());
            log.info("{} '{}' loaded version {}", type(), name, model.getVersion());
            return true;
        }
        if (version == null || ModelStore.LATEST.equals(version)) {
            loaded = null;
        }
        return false;
    }

    /** Writes the active model as a new version and makes it {@code latest}. */
    public ModelVersion save() {
        TrainedForest state = requireTrained();
        return activate(state, new LinkedHashMap<>());
    }

    public ModelInfo info() {
        Loaded current = loaded;
        ModelInfo.ModelInfoBuilder info = ModelInfo.builder()
                .name(name)
                .type(type())
                .trained(current != null)
                .contamination(config.getContamination());
        if (current == null) {
            return info.build();
        }
        TrainedForest state = current.state;
        info.version(current.version)
                .createdAt(current.createdAt)
                .contamination(state.getContamination())
                .trainingSamples(state.getTrainingSamples())
                .features(state.getColumns().size())
                .metricNames(state.getColumns())
                .statistic("boundary", state.getBoundary())
                .statistic("trees", state.getForest().size())
                .statistic("sampleSize", state.getForest().getSampleSize());
        for (int i = 0; i < state.getColumns().size(); i++) {
            FeatureStatistics column = state.getColumnStatistics().get(i);
            info.statistic(state.getColumns().get(i), Map.of(
                    "mean", column.getMean(), "std", column.getStd(),
                    "min", column.getMin(), "max", column.getMax()));
        }
        return info.build();
    }

    protected abstract String type();

    /** Whether a stored state belongs to this kind of detector. */
    protected boolean accepts(TrainedForest state) {
        if (!type().equals(state.getDetectorType())) {
            log.warn("Ignoring stored model '{}': it holds a {} model, not a {}", name, state.getDetectorType(), type());
            return false;
        }
        return true;
    }

    protected TrainedForest requireTrained() {
        Loaded current = loaded;
        if (current == null) {
            throw new ModelNotTrainedException(name);
        }
        return current.state;
    }

    /**
     * Fits a forest, calibrates the decision boundary as the
     * {@code 1 - contamination} quantile of the training scores, then saves
     * and activates the new state.
     */
    protected TrainingSummary fitAndStore(double[][] data, List<String> columns, double contamination,
                                          Map<String, Object> metadata) {
        if (!(contamination > 0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("Contamination must be in (0, 0.5], got " + contamination);
        }
        log.info("Training {} '{}' on {} samples x {} features (contamination {})",
                type(), name, data.length, columns.size(), contamination);
        IsolationForest forest = IsolationForest.fit(data, config.getForest());
        double[] scores = forest.score(data);
        double boundary = Stats.percentile(scores, (1.0 - contamination) * 100.0);
        int anomalies = 0;
        for (double score : scores) {
            if (score > boundary) {
                anomalies++;
            }
        }

        List<FeatureStatistics> columnStatistics = new ArrayList<>(columns.size());
        for (int c = 0; c < columns.size(); c++) {
            double[] column = new double[data.length];
            for (int r = 0; r < data.length; r++) {
                column[r] = data[r][c];
            }
            columnStatistics.add(FeatureStatistics.of(column));
        }

        TrainedForest state = TrainedForest.builder()
                .detectorType(type())
                .forest(forest)
                .boundary(boundary)
                .contamination(contamination)
                .trainingSamples(data.length)
                .columns(List.copyOf(columns))
                .columnStatistics(List.copyOf(columnStatistics))
                .build();

        ModelVersion version = activate(state, new LinkedHashMap<>(metadata));

        TrainingSummary summary = TrainingSummary.builder()
                .modelName(name)
                .version(version.getVersion())
                .samples(data.length)
                .features(columns.size())
                .contamination(contamination)
                .meanScore(Stats.mean(scores))
                .stdScore(Stats.std(scores))
                .anomaliesInTraining(anomalies)
                .normalInTraining(data.length - anomalies)
                .build();
        log.info("{} '{}' trained: version {}, {} of {} training points above boundary {}",
                type(), name, version.getVersion(), anomalies, data.length, boundary);
        return summary;
    }

    private ModelVersion activate(TrainedForest state, Map<String, Object> metadata) {
        metadata.put("modelName", name);
        metadata.put("type", type());
        metadata.put("contamination", state.getContamination());
        metadata.put("trainingSamples", state.getTrainingSamples());
        metadata.put("features", state.getColumns());
        ModelVersion version = store.save(name, state, metadata);
        loaded = new Loaded(state, version.getVersion(), version.getCreatedAt());
        return version;
    }

    /** Single-point confidence: half the raw forest score, capped at 1. */
    protected static double confidence(double rawScore) {
        return Math.min(Math.abs(rawScore) / 2.0, 1.0);
    }

    private static final class Loaded {
        final TrainedForest state;
        final String version;
        final Instant createdAt;

        Loaded(TrainedForest state, String version, Instant createdAt) {
            this.state = state;
            this.version = version;
            this.createdAt = createdAt;
        }
    }
}
