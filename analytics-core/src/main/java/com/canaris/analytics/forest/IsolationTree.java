package com.canaris.analytics.forest;

import java.io.Serializable;
import java.util.Random;

/**
 * A single randomized partitioning tree. Each internal node splits one
 * attribute at a uniformly drawn value between the node's minimum and
 * maximum; growth stops at the height limit or when the node's points can no
 * longer be separated.
 */
final class IsolationTree implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Node root;

    private IsolationTree(Node root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] samples, int heightLimit, Random random) {
        int[] index = new int[samples.length];
        for (int i = 0; i < index.length; i++) {
            index[i] = i;
        }
        return new IsolationTree(build(samples, index, 0, index.length, 0, heightLimit, random));
    }

    /** Path length to the leaf holding {@code x}, adjusted by the expected depth of the leaf's remaining points. */
    double pathLength(double[] x) {
        Node node = root;
        int depth = 0;
        while (node.left != null) {
            node = x[node.attribute] < node.split ? node.left : node.right;
            depth++;
        }
        return depth + IsolationForest.averagePathLength(node.size);
    }

    private static Node build(double[][] data, int[] index, int from, int to, int depth, int heightLimit, Random random) {
        int size = to - from;
        if (depth >= heightLimit || size <= 1) {
            return Node.leaf(size);
        }

        int dims = data[index[from]].length;
        double[] lo = new double[dims];
        double[] hi = new double[dims];
        for (int d = 0; d < dims; d++) {
            lo[d] = Double.POSITIVE_INFINITY;
            hi[d] = Double.NEGATIVE_INFINITY;
        }
        for (int i = from; i < to; i++) {
            double[] row = data[index[i]];
            for (int d = 0; d < dims; d++) {
                lo[d] = Math.min(lo[d], row[d]);
                hi[d] = Math.max(hi[d], row[d]);
            }
        }

        int splittable = 0;
        for (int d = 0; d < dims; d++) {
            if (hi[d] > lo[d]) {
                splittable++;
            }
        }
        if (splittable == 0) {
            return Node.leaf(size);
        }

        int pick = random.nextInt(splittable);
        int attribute = -1;
        for (int d = 0; d < dims; d++) {
            if (hi[d] > lo[d] && pick-- == 0) {
                attribute = d;
                break;
            }
        }
        double split = lo[attribute] + random.nextDouble() * (hi[attribute] - lo[attribute]);
        if (split <= lo[attribute]) {
            split = Math.nextUp(lo[attribute]);
        }

        // partition index[from, to) so that values below the split come first
        int mid = from;
        for (int i = from; i < to; i++) {
            if (data[index[i]][attribute] < split) {
                int tmp = index[i];
                index[i] = index[mid];
                index[mid] = tmp;
                mid++;
            }
        }

        Node left = build(data, index, from, mid, depth + 1, heightLimit, random);
        Node right = build(data, index, mid, to, depth + 1, heightLimit, random);
        return Node.internal(attribute, split, left, right, size);
    }

    private static final class Node implements Serializable {

        private static final long serialVersionUID = 1L;

        final int attribute;
        final double split;
        final Node left;
        final Node right;
        final int size;

        private Node(int attribute, double split, Node left, Node right, int size) {
            this.attribute = attribute;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, null, null, size);
        }

        static Node internal(int attribute, double split, Node left, Node right, int size) {
            return new Node(attribute, split, left, right, size);
        }
    }
}
