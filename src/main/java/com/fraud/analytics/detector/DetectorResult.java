package com.fraud.analytics.detector;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory output of a single detector call: one score per input point, the indices
 * flagged as anomalous and an algorithm-specific evidence payload.
 */
public final class DetectorResult {

    private final DetectorType detectorType;
    private final double[] scores;
    private final int[] anomalies;
    private final Map<String, Object> evidence;

    public DetectorResult(DetectorType detectorType, double[] scores, int[] anomalies, Map<String, Object> evidence) {
        this.detectorType = detectorType;
        this.scores = Arrays.copyOf(scores, scores.length);
        this.anomalies = Arrays.copyOf(anomalies, anomalies.length);
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }

    public DetectorType getDetectorType() { return detectorType; }

    public double[] getScores() { return Arrays.copyOf(scores, scores.length); }

    public double scoreAt(int index) { return scores[index]; }

    public int size() { return scores.length; }

    public int[] getAnomalies() { return Arrays.copyOf(anomalies, anomalies.length); }

    public boolean isAnomaly(int index) {
        return Arrays.binarySearch(anomalies, index) >= 0;
    }

    public Map<String, Object> getEvidence() { return evidence; }

    /**
     * Project the evidence onto one point: per-point arrays (length == number of scores)
     * contribute their entry at {@code index}, everything else is copied as-is.
     * Nested per-row maps keyed by index (e.g. feature contributions) contribute the row's entry.
     */
    public Map<String, Object> pointEvidence(int index) {
        Map<String, Object> out = new LinkedHashMap<>();
        int n = scores.length;
        for (Map.Entry<String, Object> entry : evidence.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof double[] arr && arr.length == n) {
                out.put(entry.getKey(), arr[index]);
            } else if (value instanceof double[][] matrix && matrix.length == n) {
                out.put(entry.getKey(), Arrays.copyOf(matrix[index], matrix[index].length));
            } else if (value instanceof int[]) {
                // run-level index lists stay on the run, not on each point
                continue;
            } else if (value instanceof Map<?, ?> perRow) {
                Object rowValue = perRow.get(index);
                if (rowValue != null) {
                    out.put(entry.getKey(), rowValue);
                }
            } else {
                out.put(entry.getKey(), value);
            }
        }
        return out;
    }
}
