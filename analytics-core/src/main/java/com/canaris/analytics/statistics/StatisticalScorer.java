package com.canaris.analytics.statistics;

import com.canaris.analytics.model.AnomalyVerdict;
import com.canaris.analytics.model.DetectionMethod;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Threshold-based outlier detection that needs no trained state.
 * <p>
 * Degenerate inputs (fewer than three values, zero spread) yield no anomalies.
 */
@Slf4j
public class StatisticalScorer {

    static final int MIN_VALUES = 3;
    static final double SEVERITY_SCALE = 5.0;
    private static final double MAD_CONSTANT = 0.6745;

    public boolean[] detect(double[] values, StatisticalMethod method, double threshold) {
        boolean[] flags = new boolean[values.length];
        if (values.length < MIN_VALUES) {
            return flags;
        }
        switch (method) {
            case ZSCORE -> {
                double mean = Stats.mean(values);
                double std = Stats.std(values);
                if (std == 0) {
                    return flags;
                }
                for (int i = 0; i < values.length; i++) {
                    flags[i] = Math.abs((values[i] - mean) / std) > threshold;
                }
            }
            case IQR -> {
                double q1 = Stats.percentile(values, 25);
                double q3 = Stats.percentile(values, 75);
                double iqr = q3 - q1;
                double lower = q1 - threshold * iqr;
                double upper = q3 + threshold * iqr;
                for (int i = 0; i < values.length; i++) {
                    flags[i] = values[i] < lower || values[i] > upper;
                }
            }
            case MAD -> {
                double median = Stats.median(values);
                double[] deviations = new double[values.length];
                for (int i = 0; i < values.length; i++) {
                    deviations[i] = Math.abs(values[i] - median);
                }
                double mad = Stats.median(deviations);
                if (mad == 0) {
                    return flags;
                }
                for (int i = 0; i < values.length; i++) {
                    flags[i] = Math.abs(MAD_CONSTANT * (values[i] - median) / mad) > threshold;
                }
            }
        }
        return flags;
    }

    /**
     * Z-score verdicts with severity min(|z| / 5, 1). The reported threshold is
     * {@code zThreshold / 5}, so a verdict is anomalous exactly when its score exceeds it.
     */
    public List<AnomalyVerdict> zScore(double[] values, double zThreshold) {
        return score(values, StatisticalMethod.ZSCORE, zThreshold, true);
    }

    /**
     * Verdicts for every value. Methods other than {@link StatisticalMethod#ZSCORE}
     * report a score of 0 unless {@code withSeverity} asks for the z-score severity.
     */
    public List<AnomalyVerdict> score(double[] values, StatisticalMethod method, double threshold, boolean withSeverity) {
        boolean[] flags = detect(values, method, threshold);
        boolean severity = withSeverity || method == StatisticalMethod.ZSCORE;
        double mean = Stats.mean(values);
        double std = Stats.std(values);
        double reportedThreshold = method == StatisticalMethod.ZSCORE ? threshold / SEVERITY_SCALE : threshold;

        List<AnomalyVerdict> verdicts = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            double score = severity ? severity(values[i], mean, std) : 0.0;
            verdicts.add(AnomalyVerdict.builder()
                    .value(values[i])
                    .score(score)
                    .anomaly(flags[i])
                    .threshold(reportedThreshold)
                    .method(DetectionMethod.STATISTICAL)
                    .meta("method", method.name().toLowerCase())
                    .meta("deviation", score)
                    .build());
        }
        log.debug("Statistical scoring with {} flagged {} of {} values", method, countFlagged(flags), values.length);
        return verdicts;
    }

    public StatisticalSummary describe(double[] values) {
        return StatisticalSummary.builder()
                .count(values.length)
                .mean(Stats.mean(values))
                .median(Stats.median(values))
                .std(Stats.std(values))
                .variance(Stats.variance(values))
                .min(Stats.min(values))
                .max(Stats.max(values))
                .q25(Stats.percentile(values, 25))
                .q75(Stats.percentile(values, 75))
                .build();
    }

    static double severity(double value, double mean, double std) {
        if (std <= 0) {
            return 0.0;
        }
        return Math.min(Math.abs((value - mean) / std) / SEVERITY_SCALE, 1.0);
    }

    private static int countFlagged(boolean[] flags) {
        int n = 0;
        for (boolean flag : flags) {
            if (flag) {
                n++;
            }
        }
        return n;
    }
}
