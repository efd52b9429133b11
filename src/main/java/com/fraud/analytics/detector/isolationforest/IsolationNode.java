package com.fraud.analytics.detector.isolationforest;

import java.util.Random;

/**
 * Isolation tree node: either an internal split on one feature or an external leaf
 * remembering how many training samples reached it.
 */
final class IsolationNode {

    private static final double EULER_MASCHERONI = 0.5772156649;

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size;

    private IsolationNode(int splitFeature, double splitValue, IsolationNode left, IsolationNode right, int size) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    /**
     * Grows one isolation tree over {@code sample}. Each split picks a random feature and a uniform
     * value inside that feature's range; growth stops at the height limit, at a single row, or when
     * the chosen feature is constant.
     */
    static IsolationNode grow(double[][] sample, int heightLimit, Random random) {
        int[] order = new int[sample.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        return grow(sample, order, 0, order.length, 0, heightLimit, random);
    }

    // Rows order[from, to) reach this node; they are partitioned in place.
    private static IsolationNode grow(double[][] sample, int[] order, int from, int to,
                                      int depth, int heightLimit, Random random) {
        int count = to - from;
        if (count <= 1 || depth >= heightLimit) {
            return leaf(count);
        }

        int feature = random.nextInt(sample[order[from]].length);
        double low = sample[order[from]][feature];
        double high = low;
        for (int i = from + 1; i < to; i++) {
            double v = sample[order[i]][feature];
            if (v < low) low = v;
            else if (v > high) high = v;
        }
        if (!(high > low)) {
            return leaf(count);
        }

        double value = low + random.nextDouble() * (high - low);
        int boundary = from;
        for (int i = from; i < to; i++) {
            if (sample[order[i]][feature] < value) {
                int swap = order[boundary];
                order[boundary++] = order[i];
                order[i] = swap;
            }
        }
        return split(feature, value,
                grow(sample, order, from, boundary, depth + 1, heightLimit, random),
                grow(sample, order, boundary, to, depth + 1, heightLimit, random));
    }

    static IsolationNode split(int feature, double value, IsolationNode left, IsolationNode right) {
        return new IsolationNode(feature, value, left, right, left.size + right.size);
    }

    static IsolationNode leaf(int size) {
        return new IsolationNode(-1, Double.NaN, null, null, size);
    }

    boolean isLeaf() {
        return left == null;
    }

    /**
     * Depth at which {@code point} is isolated, plus the expected remaining depth for
     * leaves that still hold several samples.
     */
    double pathLength(double[] point) {
        IsolationNode node = this;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * c(n): average path length of an unsuccessful BST search over n samples,
     * 2H(n-1) - 2(n-1)/n with H(i) ≈ ln(i) + γ.
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_MASCHERONI;
        return 2.0 * harmonic - (2.0 * (n - 1.0) / n);
    }

    int size() {
        return size;
    }
}
