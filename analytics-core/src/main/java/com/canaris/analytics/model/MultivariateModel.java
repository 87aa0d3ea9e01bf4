package com.canaris.analytics.model;

import com.canaris.analytics.exception.InsufficientDataException;
import com.canaris.analytics.exception.InvalidMetricSetException;
import com.canaris.analytics.store.ModelStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Isolation forest over several metrics of one asset observed at the same
 * instants. Each training row holds one value per metric, in the iteration
 * order of the map passed to {@link #train(Map)}.
 */
@Slf4j
public class MultivariateModel extends ForestDetector {

    public static final String TYPE = "multivariate";

    static final double DEVIATION_LIMIT = 3.0;
    private static final double JOINT_ANOMALY_PENALTY = 30.0;
    private static final double METRIC_PENALTY = 15.0;

    private final PearsonsCorrelation pearson = new PearsonsCorrelation();

    public MultivariateModel(String name, ModelStore store, DetectorConfig config) {
        super(name, store, config);
    }

    @Override
    protected String type() {
        return TYPE;
    }

    public TrainingSummary train(Map<String, double[]> metrics) {
        return train(metrics, config.getContamination());
    }

    public TrainingSummary train(Map<String, double[]> metrics, double contamination) {
        if (metrics.size() < 2) {
            throw new InvalidMetricSetException("Multivariate training needs at least 2 metrics, got " + metrics.keySet());
        }
        int samples = commonLength(metrics);
        if (samples < config.getMinSamples()) {
            throw new InsufficientDataException("training '" + name + "'", config.getMinSamples(), samples);
        }

        List<String> columns = new ArrayList<>(metrics.keySet());
        double[][] data = new double[samples][columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            double[] series = metrics.get(columns.get(c));
            for (int r = 0; r < samples; r++) {
                data[r][c] = series[r];
            }
        }
        return fitAndStore(data, columns, contamination, Map.of("metricNames", columns));
    }

    /**
     * Joint verdict for one observation plus every metric lying outside
     * mean ± 3σ of its training distribution. Every trained metric needs a
     * numeric value.
     */
    public MultivariateDetection detect(Map<String, Double> values) {
        TrainedForest state = requireTrained();
        List<String> columns = state.getColumns();
        if (!new HashSet<>(columns).equals(values.keySet())) {
            throw new InvalidMetricSetException("Model '" + name + "' was trained on " + new TreeSet<>(columns)
                    + " but got " + new TreeSet<>(values.keySet()));
        }

        double[] row = new double[columns.size()];
        MultivariateDetection.MultivariateDetectionBuilder detection = MultivariateDetection.builder()
                .modelName(name)
                .modelVersion(getVersion().orElse(null));
        for (int c = 0; c < columns.size(); c++) {
            String metric = columns.get(c);
            Double value = values.get(metric);
            if (value == null || value.isNaN()) {
                throw new InvalidMetricSetException("Metric '" + metric + "' has no numeric value");
            }
            row[c] = value;
            detection.value(metric, row[c]);

            FeatureStatistics stats = state.getColumnStatistics().get(c);
            double z = stats.zScore(row[c]);
            if (Math.abs(z) > DEVIATION_LIMIT) {
                detection.deviation(MetricDeviation.builder()
                        .metric(metric)
                        .value(row[c])
                        .zScore(z)
                        .mean(stats.getMean())
                        .std(stats.getStd())
                        .expectedLow(stats.getMean() - DEVIATION_LIMIT * stats.getStd())
                        .expectedHigh(stats.getMean() + DEVIATION_LIMIT * stats.getStd())
                        .build());
            }
        }

        double raw = state.getForest().score(row);
        detection.verdict(AnomalyVerdict.builder()
                .value(raw)
                .score(confidence(raw))
                .anomaly(raw > state.getBoundary())
                .threshold(confidence(state.getBoundary()))
                .method(DetectionMethod.ML)
                .meta("rawScore", raw)
                .meta("boundary", state.getBoundary())
                .build());
        return detection.build();
    }

    /**
     * Health score starting at 100: minus 30 for a joint anomaly and minus 15
     * per deviating metric, clamped to [0, 100].
     */
    public CompositeHealth compositeHealth(Map<String, Double> values) {
        MultivariateDetection detection = detect(values);
        int deviating = detection.getDeviations().size();
        double score = 100.0;
        if (detection.isAnomaly()) {
            score -= JOINT_ANOMALY_PENALTY;
        }
        score -= METRIC_PENALTY * deviating;
        score = Math.max(0.0, Math.min(100.0, score));
        return CompositeHealth.builder()
                .score(score)
                .status(HealthStatus.of(score))
                .jointAnomaly(detection.isAnomaly())
                .anomalousMetrics(deviating)
                .detection(detection)
                .build();
    }

    /**
     * Pearson correlation and two-sided p-value for every pair of metrics.
     * Does not require a trained model.
     */
    public CorrelationAnalysis analyzeCorrelations(Map<String, double[]> metrics) {
        if (metrics.size() < 2) {
            return CorrelationAnalysis.builder()
                    .metricCount(metrics.size())
                    .message("Need at least 2 metrics for correlation analysis")
                    .build();
        }
        int samples = commonLength(metrics);
        List<String> names = new ArrayList<>(metrics.keySet());
        List<CorrelationPair> pairs = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                pairs.add(correlate(names.get(i), metrics.get(names.get(i)), names.get(j), metrics.get(names.get(j))));
            }
        }
        pairs.sort(Comparator.comparingDouble((CorrelationPair p) -> Math.abs(p.getCoefficient())).reversed());
        return CorrelationAnalysis.builder()
                .metricCount(names.size())
                .samples(samples)
                .pairs(pairs)
                .message("Analyzed " + pairs.size() + " metric pairs")
                .build();
    }

    private CorrelationPair correlate(String nameA, double[] a, String nameB, double[] b) {
        int n = a.length;
        double r = n < 2 ? Double.NaN : pearson.correlation(a, b);
        if (Double.isNaN(r)) {
            // zero variance in one of the series
            r = 0.0;
        }
        return CorrelationPair.builder()
                .metricA(nameA)
                .metricB(nameB)
                .coefficient(r)
                .pValue(pValue(r, n))
                .strength(CorrelationStrength.of(r))
                .direction(r >= 0 ? "positive" : "negative")
                .build();
    }

    static double pValue(double r, int n) {
        if (n < 3 || r == 0.0) {
            return 1.0;
        }
        if (Math.abs(r) >= 1.0) {
            return 0.0;
        }
        double t = r * Math.sqrt((n - 2) / (1.0 - r * r));
        TDistribution distribution = new TDistribution(n - 2);
        return 2.0 * (1.0 - distribution.cumulativeProbability(Math.abs(t)));
    }

    private static int commonLength(Map<String, double[]> metrics) {
        int length = -1;
        for (Map.Entry<String, double[]> metric : metrics.entrySet()) {
            int size = metric.getValue().length;
            if (length >= 0 && size != length) {
                throw new InvalidMetricSetException("All metrics must have the same number of samples, got "
                        + lengths(metrics));
            }
            length = size;
        }
        return Math.max(length, 0);
    }

    private static String lengths(Map<String, double[]> metrics) {
        StringBuilder sb = new StringBuilder("{");
        metrics.forEach((k, v) -> sb.append(sb.length() > 1 ? ", " : "").append(k).append('=').append(v.length));
        return sb.append('}').toString();
    }
}
