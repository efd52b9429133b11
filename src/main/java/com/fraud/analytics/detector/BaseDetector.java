package com.fraud.analytics.detector;

import java.util.stream.IntStream;

/**
 * Shared validation, thresholding and common parameters (k, persistence, min_support).
 * Subclasses implement {@link #score(MetricSeries)} and never see unvalidated input.
 */
public abstract class BaseDetector implements AnomalyDetector {

    protected final DetectorParams params;
    private final double k;
    private final int persistence;
    private final int minSupport;

    protected BaseDetector(DetectorParams params) {
        this.params = params == null ? DetectorParams.empty() : params;
        this.k = this.params.k();
        this.persistence = Math.max(1, this.params.persistence());
        this.minSupport = Math.max(1, this.params.minSupport());
    }

    @Override
    public void validate(MetricSeries series) {
        if (series == null || series.isEmpty()) {
            throw new EmptySeriesException(minSupport);
        }
        if (series.size() < minSupport) {
            throw new InsufficientDataException(series.size(), minSupport);
        }
        int columns = readsAllMetrics() ? series.metricCount() : 1;
        for (int i = 0; i < series.size(); i++) {
            for (int j = 0; j < columns; j++) {
                double value = series.valueAt(i, j);
                if (!Double.isFinite(value)) {
                    throw new NonFiniteInputException(i, series.getMetricNames().get(j), value);
                }
            }
        }
    }

    @Override
    public final DetectorResult detect(MetricSeries series) {
        validate(series);
        DetectorResult result = score(series);
        if (result.size() != series.size()) {
            throw new IllegalStateException(String.format("%s produced %d scores for %d points",
                    getClass().getSimpleName(), result.size(), series.size()));
        }
        return result;
    }

    @Override
    public int[] filterAnomalies(double[] scores) {
        return IntStream.range(0, scores.length)
                .filter(i -> scores[i] > k)
                .toArray();
    }

    /**
     * Run the algorithm over a validated series.
     */
    protected abstract DetectorResult score(MetricSeries series);

    /**
     * Whether validation covers every metric column or only the primary one.
     */
    protected boolean readsAllMetrics() {
        return type().isMultivariate();
    }

    @Override
    public double getK() { return k; }

    @Override
    public int getPersistence() { return persistence; }

    @Override
    public int getMinSupport() { return minSupport; }
}
