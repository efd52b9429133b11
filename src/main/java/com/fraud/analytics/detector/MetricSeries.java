package com.fraud.analytics.detector;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable windowed series handed to detectors.
 *
 * Each window is one row of metric values; column 0 is the primary metric and any further
 * columns are secondary metrics. Univariate detectors read only the primary column,
 * multivariate detectors treat every row as a feature vector. Accessors return copies,
 * so a detector can never mutate the caller's data.
 */
public final class MetricSeries {

    public static final String DEFAULT_METRIC = "value";

    private final List<String> metricNames;
    private final List<Instant> timestamps;
    private final double[][] rows;

    private MetricSeries(List<String> metricNames, List<Instant> timestamps, double[][] rows) {
        this.metricNames = List.copyOf(metricNames);
        this.timestamps = timestamps == null ? List.of() : List.copyOf(timestamps);
        this.rows = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            double[] row = Objects.requireNonNull(rows[i], "row " + i);
            if (row.length != metricNames.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row %d has %d values, expected %d metrics", i, row.length, metricNames.size()));
            }
            this.rows[i] = Arrays.copyOf(row, row.length);
        }
        if (!this.timestamps.isEmpty() && this.timestamps.size() != rows.length) {
            throw new IllegalArgumentException(String.format(
                    "Got %d timestamps for %d rows", this.timestamps.size(), rows.length));
        }
    }

    /**
     * Univariate series without timestamps.
     */
    public static MetricSeries of(double... values) {
        return univariate(DEFAULT_METRIC, null, values);
    }

    public static MetricSeries univariate(String metric, List<Instant> timestamps, double[] values) {
        double[][] rows = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            rows[i] = new double[]{values[i]};
        }
        return new MetricSeries(List.of(metric), timestamps, rows);
    }

    public static MetricSeries multivariate(List<String> metricNames, List<Instant> timestamps, double[][] rows) {
        if (metricNames == null || metricNames.isEmpty()) {
            throw new IllegalArgumentException("At least one metric name is required");
        }
        return new MetricSeries(metricNames, timestamps, rows);
    }

    /**
     * Multivariate rows with generated feature names (f0, f1, ...).
     */
    public static MetricSeries ofRows(double[][] rows) {
        int width = rows.length == 0 ? 1 : rows[0].length;
        List<String> names = new ArrayList<>(width);
        for (int j = 0; j < width; j++) {
            names.add("f" + j);
        }
        return new MetricSeries(names, null, rows);
    }

    public int size() {
        return rows.length;
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    public int metricCount() {
        return metricNames.size();
    }

    public List<String> getMetricNames() {
        return metricNames;
    }

    public String primaryMetric() {
        return metricNames.get(0);
    }

    public double[] primary() {
        return column(0);
    }

    public double[] column(int metricIndex) {
        double[] out = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            out[i] = rows[i][metricIndex];
        }
        return out;
    }

    public double[] row(int index) {
        return Arrays.copyOf(rows[index], rows[index].length);
    }

    public double[][] rows() {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            out[i] = Arrays.copyOf(rows[i], rows[i].length);
        }
        return out;
    }

    double valueAt(int index, int metricIndex) {
        return rows[index][metricIndex];
    }

    public boolean hasTimestamps() {
        return !timestamps.isEmpty();
    }

    /**
     * @return the window start of the given index, or null when the series carries no timestamps
     */
    public Instant timestampAt(int index) {
        return timestamps.isEmpty() ? null : timestamps.get(index);
    }

    public List<Instant> getTimestamps() {
        return timestamps;
    }
}
