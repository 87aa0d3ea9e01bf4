package com.canaris.analytics.statistics;

import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import smile.math.MathEx;

/**
 * Descriptive statistics shared by the scorers and models.
 * Standard deviations are population deviations (divisor n).
 */
public final class Stats {

    private Stats() {
    }

    public static double mean(double[] values) {
        return values.length == 0 ? 0.0 : MathEx.mean(values);
    }

    public static double std(double[] values) {
        return Math.sqrt(variance(values));
    }

    public static double variance(double[] values) {
        return values.length == 0 ? 0.0 : new Variance(false).evaluate(values);
    }

    public static double min(double[] values) {
        return values.length == 0 ? 0.0 : MathEx.min(values);
    }

    public static double max(double[] values) {
        return values.length == 0 ? 0.0 : MathEx.max(values);
    }

    /** Median of a copy of {@code values}; the input is never reordered. */
    public static double median(double[] values) {
        return values.length == 0 ? 0.0 : MathEx.median(values.clone());
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param p percentile in (0, 100]
     */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            return 0.0;
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, p);
    }
}
