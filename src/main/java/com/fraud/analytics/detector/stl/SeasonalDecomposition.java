package com.fraud.analytics.detector.stl;

/**
 * Additive split of a series: value = trend + seasonal + residual at every index.
 */
public record SeasonalDecomposition(double[] trend, double[] seasonal, double[] residual, int period) {

    public int size() {
        return residual.length;
    }
}
