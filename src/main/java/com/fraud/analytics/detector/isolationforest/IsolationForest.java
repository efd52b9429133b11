package com.fraud.analytics.detector.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of isolation trees fitted on random sub-samples of the rows.
 *
 * Raw score s(x) = 2^(-E[h(x)] / c(ψ)) lies in (0, 1]: values near 1 are isolated quickly
 * (anomalous), values well below 0.5 are deep inside the data.
 */
public final class IsolationForest {

    private final List<IsolationNode> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationNode> trees, int sampleSize) {
        this.trees = Collections.unmodifiableList(trees);
        this.sampleSize = sampleSize;
    }

    /**
     * @param data       rows to fit on, each a feature vector of equal width
     * @param numTrees   ensemble size
     * @param maxSamples sub-sample size per tree, capped at the number of rows
     * @param seed       random seed, fixed so repeated runs over the same window agree
     */
    public static IsolationForest fit(double[][] data, int numTrees, int maxSamples, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on zero rows");
        }
        int sampleSize = Math.max(1, Math.min(maxSamples, data.length));
        int heightLimit = (int) Math.ceil(Math.log(Math.max(2, sampleSize)) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationNode> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            trees.add(IsolationNode.grow(subsample(data, sampleSize, random), heightLimit, random));
        }
        return new IsolationForest(trees, sampleSize);
    }

    public double score(double[] point) {
        double c = IsolationNode.averagePathLength(sampleSize);
        if (trees.isEmpty() || c <= 0) return 0.5;

        double total = 0.0;
        for (IsolationNode tree : trees) {
            total += tree.pathLength(point);
        }
        double meanPath = total / trees.size();
        return Math.pow(2.0, -meanPath / c);
    }

    public double[] scoreAll(double[][] rows) {
        double[] out = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            out[i] = score(rows[i]);
        }
        return out;
    }

    /**
     * Per-feature contribution to a point's score: how much the score drops when that
     * feature alone is replaced by its reference (column mean).
     */
    public double[] featureContributions(double[] point, double[] reference) {
        double base = score(point);
        double[] contributions = new double[point.length];
        for (int j = 0; j < point.length; j++) {
            double[] modified = Arrays.copyOf(point, point.length);
            modified[j] = reference[j];
            contributions[j] = Math.max(0.0, base - score(modified));
        }
        return contributions;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (size >= data.length) {
            return Arrays.copyOf(data, data.length);
        }
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) indices[i] = i;
        double[][] sample = new double[size][];
        // partial Fisher-Yates
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public int getTreeCount() { return trees.size(); }
    public int getSampleSize() { return sampleSize; }
}
