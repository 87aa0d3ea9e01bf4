package com.canaris.analytics.features;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serializable;
import java.util.List;

/**
 * Ordered numeric features derived from one position of a metric series.
 */
@ToString
@EqualsAndHashCode
public final class FeatureVector implements Serializable {

    private static final long serialVersionUID = 1L;

    @Getter
    private final int position;
    private final double[] values;

    public FeatureVector(int position, double[] values) {
        this.position = position;
        this.values = values.clone();
    }

    public static FeatureVector of(double... values) {
        return new FeatureVector(0, values);
    }

    public int length() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    /** The base feature, i.e. the raw value at {@link #getPosition()}. */
    public double value() {
        return values[0];
    }

    public double[] toArray() {
        return values.clone();
    }

    public static double[][] toMatrix(List<FeatureVector> vectors) {
        double[][] matrix = new double[vectors.size()][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = vectors.get(i).values.clone();
        }
        return matrix;
    }
}
