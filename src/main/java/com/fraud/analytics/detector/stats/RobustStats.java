package com.fraud.analytics.detector.stats;

import java.util.Arrays;

/**
 * Descriptive statistics over primitive arrays. Inputs are never modified.
 */
public final class RobustStats {

    /** Scales MAD to be comparable with a normal standard deviation. */
    public static final double MAD_SCALE = 1.4826;

    /** Floor for dispersion estimates used as divisors. */
    public static final double EPSILON = 1e-9;

    private RobustStats() {}

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /**
     * Sample standard deviation (n - 1 denominator); 0 for fewer than two values.
     */
    public static double stdDev(double[] values) {
        int n = values.length;
        if (n < 2) return 0.0;
        double mean = mean(values);
        double m2 = 0.0;
        for (double v : values) {
            double d = v - mean;
            m2 += d * d;
        }
        return Math.sqrt(m2 / (n - 1));
    }

    public static double median(double[] values) {
        return quantile(values, 0.5);
    }

    /**
     * Median absolute deviation around the median, unscaled.
     */
    public static double mad(double[] values) {
        if (values.length == 0) return 0.0;
        double med = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - med);
        }
        return median(deviations);
    }

    /**
     * Linearly interpolated quantile, q in [0, 1].
     */
    public static double quantile(double[] values, double q) {
        if (values.length == 0) return 0.0;
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double clamped = Math.max(0.0, Math.min(1.0, q));
        double pos = clamped * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        if (lower == upper) return sorted[lower];
        double frac = pos - lower;
        return sorted[lower] + frac * (sorted[upper] - sorted[lower]);
    }

    /**
     * Weighted mean; falls back to the plain mean when every weight is zero.
     */
    public static double weightedMean(double[] values, double[] weights) {
        double sum = 0.0;
        double weightSum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i] * weights[i];
            weightSum += weights[i];
        }
        return weightSum > EPSILON ? sum / weightSum : mean(values);
    }
}
