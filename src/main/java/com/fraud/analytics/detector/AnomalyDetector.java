package com.fraud.analytics.detector;

/**
 * Contract implemented by every anomaly detection algorithm.
 * Each implementation handles exactly one {@link DetectorType}.
 */
public interface AnomalyDetector {

    /**
     * The algorithm family this detector implements.
     */
    DetectorType type();

    /**
     * Structural checks run before any scoring. Side-effect free.
     *
     * @throws EmptySeriesException       if the series has no points
     * @throws InsufficientDataException  if the series is shorter than min_support
     * @throws NonFiniteInputException    if any value read by the detector is NaN or infinite
     */
    void validate(MetricSeries series);

    /**
     * Validate and score the series. Never mutates the input.
     *
     * @return scores for every point, the anomalous indices and algorithm evidence
     */
    DetectorResult detect(MetricSeries series);

    /**
     * Indices whose score exceeds the detector's k threshold.
     */
    int[] filterAnomalies(double[] scores);

    /**
     * Anomaly threshold multiplier.
     */
    double getK();

    /**
     * Minimum consecutive anomalous windows before a warn escalates.
     */
    int getPersistence();

    int getMinSupport();
}
