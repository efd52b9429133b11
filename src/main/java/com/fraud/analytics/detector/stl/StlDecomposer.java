package com.fraud.analytics.detector.stl;

import com.fraud.analytics.detector.stats.RobustStats;

import java.util.Arrays;

/**
 * Seasonal-trend decomposition in the spirit of STL.
 *
 * Inner pass:
 *   1. trend estimate with a centred moving window of {@code trendWindow} points
 *   2. cycle-subseries of the detrended values (one per phase of the period), each smoothed
 *      with a centred window of {@code seasonalSmoother} cycles, then centred to zero mean
 *   3. trend re-estimated on the deseasonalised series
 *
 * Robust mode swaps means for medians and runs {@link #ROBUST_ITERATIONS} outer passes, each
 * excluding points whose bisquare weight (from the previous residuals) dropped to zero.
 */
public class StlDecomposer {

    static final int ROBUST_ITERATIONS = 2;

    private final int period;
    private final int trendWindow;
    private final int seasonalSmoother;
    private final boolean robust;

    public StlDecomposer(int period, int trendWindow, int seasonalSmoother, boolean robust) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be >= 2, got " + period);
        }
        this.period = period;
        this.trendWindow = toOdd(Math.max(3, trendWindow));
        this.seasonalSmoother = toOdd(Math.max(1, seasonalSmoother));
        this.robust = robust;
    }

    /**
     * Smallest odd window strictly wider than the period, the usual STL trend-span choice.
     */
    public static int defaultTrendWindow(int period) {
        return toOdd(period + 1);
    }

    public SeasonalDecomposition decompose(double[] values) {
        int n = values.length;
        double[] weights = new double[n];
        Arrays.fill(weights, 1.0);

        SeasonalDecomposition result = innerPass(values, weights);
        if (!robust) {
            return result;
        }
        for (int iter = 0; iter < ROBUST_ITERATIONS; iter++) {
            weights = bisquareWeights(result.residual());
            result = innerPass(values, weights);
        }
        return result;
    }

    private SeasonalDecomposition innerPass(double[] values, double[] weights) {
        int n = values.length;

        double[] initialTrend = smooth(values, weights, trendWindow);
        double[] detrended = new double[n];
        for (int i = 0; i < n; i++) {
            detrended[i] = values[i] - initialTrend[i];
        }

        double[] seasonal = cycleSubseries(detrended, weights);

        double[] deseasonalised = new double[n];
        for (int i = 0; i < n; i++) {
            deseasonalised[i] = values[i] - seasonal[i];
        }
        double[] trend = smooth(deseasonalised, weights, trendWindow);

        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            residual[i] = values[i] - trend[i] - seasonal[i];
        }
        return new SeasonalDecomposition(trend, seasonal, residual, period);
    }

    private double[] cycleSubseries(double[] detrended, double[] weights) {
        int n = detrended.length;
        double[] seasonal = new double[n];
        double[] phaseMeans = new double[period];

        for (int phase = 0; phase < period; phase++) {
            int len = phase < n ? (n - phase + period - 1) / period : 0;
            if (len == 0) continue;
            double[] sub = new double[len];
            double[] subWeights = new double[len];
            for (int c = 0; c < len; c++) {
                sub[c] = detrended[phase + c * period];
                subWeights[c] = weights[phase + c * period];
            }
            double[] smoothed = smooth(sub, subWeights, seasonalSmoother);
            for (int c = 0; c < len; c++) {
                seasonal[phase + c * period] = smoothed[c];
            }
            phaseMeans[phase] = RobustStats.mean(smoothed);
        }

        // seasonal component carries no level; that belongs to the trend
        double level = RobustStats.mean(phaseMeans);
        for (int i = 0; i < n; i++) {
            seasonal[i] -= level;
        }
        return seasonal;
    }

    /**
     * Centred moving statistic, window clipped at the series edges.
     */
    private double[] smooth(double[] values, double[] weights, int window) {
        int n = values.length;
        int half = window / 2;
        double[] out = new double[n];
        if (!robust) {
            double[] prefix = new double[n + 1];
            for (int i = 0; i < n; i++) {
                prefix[i + 1] = prefix[i] + values[i];
            }
            for (int i = 0; i < n; i++) {
                int lo = Math.max(0, i - half);
                int hi = Math.min(n - 1, i + half);
                out[i] = (prefix[hi + 1] - prefix[lo]) / (hi - lo + 1);
            }
            return out;
        }
        double[] buffer = new double[window];
        for (int i = 0; i < n; i++) {
            int lo = Math.max(0, i - half);
            int hi = Math.min(n - 1, i + half);
            int count = 0;
            for (int j = lo; j <= hi; j++) {
                if (weights[j] > 0) buffer[count++] = values[j];
            }
            if (count == 0) {
                for (int j = lo; j <= hi; j++) buffer[count++] = values[j];
            }
            out[i] = RobustStats.median(Arrays.copyOf(buffer, count));
        }
        return out;
    }

    /**
     * Bisquare robustness weights with the STL cut-off of six times the median absolute residual.
     */
    static double[] bisquareWeights(double[] residual) {
        int n = residual.length;
        double[] abs = new double[n];
        for (int i = 0; i < n; i++) abs[i] = Math.abs(residual[i]);
        double h = 6.0 * RobustStats.median(abs);
        double[] weights = new double[n];
        if (h < RobustStats.EPSILON) {
            Arrays.fill(weights, 1.0);
            return weights;
        }
        for (int i = 0; i < n; i++) {
            double u = abs[i] / h;
            weights[i] = u < 1.0 ? Math.pow(1.0 - u * u, 2) : 0.0;
        }
        return weights;
    }

    private static int toOdd(int value) {
        return value % 2 == 0 ? value + 1 : value;
    }

    public int getPeriod() { return period; }
    public int getTrendWindow() { return trendWindow; }
    public int getSeasonalSmoother() { return seasonalSmoother; }
    public boolean isRobust() { return robust; }
}
