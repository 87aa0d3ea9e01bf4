package com.canaris.analytics.forest;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.Serializable;
import java.util.Random;
import java.util.concurrent.CancellationException;

/**
 * Isolation forest (Liu, Ting and Zhou, 2008). Points that are isolated by
 * fewer random partitions on average receive higher anomaly scores.
 * <p>
 * Trees are grown sequentially from per-tree seeds drawn from one master
 * seed, so fitting the same data with the same options always yields the
 * same forest.
 */
@Slf4j
public class IsolationForest implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final double EULER_GAMMA = 0.5772156649;

    private final IsolationTree[] trees;
    @Getter
    private final int dimensions;
    @Getter
    private final int sampleSize;
    private final double normalizer;

    private IsolationForest(IsolationTree[] trees, int dimensions, int sampleSize) {
        this.trees = trees;
        this.dimensions = dimensions;
        this.sampleSize = sampleSize;
        this.normalizer = averagePathLength(sampleSize);
    }

    /**
     * @throws CancellationException if the calling thread is interrupted between trees
     */
    public static IsolationForest fit(double[][] data, ForestOptions options) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on an empty data set");
        }
        if (options.getTrees() < 1) {
            throw new IllegalArgumentException("Number of trees must be positive, got " + options.getTrees());
        }
        int dimensions = data[0].length;
        for (double[] row : data) {
            if (row.length != dimensions) {
                throw new IllegalArgumentException("All rows must have " + dimensions + " features");
            }
        }

        int sampleSize = Math.min(Math.max(options.getSubsample(), 2), data.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));
        Random master = new Random(options.getSeed());

        IsolationTree[] trees = new IsolationTree[options.getTrees()];
        for (int t = 0; t < trees.length; t++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Isolation forest fit interrupted after " + t + " trees");
            }
            Random random = new Random(master.nextLong());
            trees[t] = IsolationTree.grow(subsample(data, sampleSize, random), heightLimit, random);
        }
        log.debug("Fitted {} trees on {} rows x {} features (sample size {}, height limit {})",
                trees.length, data.length, dimensions, sampleSize, heightLimit);
        return new IsolationForest(trees, dimensions, sampleSize);
    }

    /** Anomaly score in (0, 1]; values near 1 are anomalies, values well below 0.5 are normal. */
    public double score(double[] x) {
        if (x.length != dimensions) {
            throw new IllegalArgumentException("Expected " + dimensions + " features, got " + x.length);
        }
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(x);
        }
        double meanPath = total / trees.length;
        if (normalizer == 0) {
            return 0.5;
        }
        return Math.pow(2.0, -meanPath / normalizer);
    }

    public double[] score(double[][] x) {
        double[] scores = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            scores[i] = score(x[i]);
        }
        return scores;
    }

    public int size() {
        return trees.length;
    }

    /** Average path length of an unsuccessful search in a binary search tree of {@code n} points. */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (size == data.length) {
            return data;
        }
        // partial Fisher-Yates over an index permutation
        int[] index = new int[data.length];
        for (int i = 0; i < index.length; i++) {
            index[i] = i;
        }
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = index[i];
            index[i] = index[j];
            index[j] = tmp;
            sample[i] = data[index[i]];
        }
        return sample;
    }
}
