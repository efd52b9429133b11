package com.fraud.analytics.series;

import com.fraud.analytics.detector.MetricSeries;
import com.fraud.analytics.model.WindowRow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits warehouse rows into one metric series per cohort.
 */
public final class CohortSeriesAssembler {

    private CohortSeriesAssembler() {}

    /**
     * Groups rows by their {@code cohortBy} values in first-seen order. Each group keeps window-start
     * order and becomes a series whose columns are {@code metrics}, primary first.
     */
    public static Map<Map<String, String>, MetricSeries> assemble(List<WindowRow> rows,
                                                                  List<String> cohortBy,
                                                                  List<String> metrics) {
        Map<Map<String, String>, List<WindowRow>> groups = new LinkedHashMap<>();
        for (WindowRow row : rows) {
            Map<String, String> cohort = new LinkedHashMap<>();
            for (String dimension : cohortBy) {
                cohort.put(dimension, row.getCohortValues() == null ? null : row.getCohortValues().get(dimension));
            }
            groups.computeIfAbsent(cohort, k -> new ArrayList<>()).add(row);
        }

        Map<Map<String, String>, MetricSeries> series = new LinkedHashMap<>();
        for (Map.Entry<Map<String, String>, List<WindowRow>> group : groups.entrySet()) {
            List<WindowRow> ordered = new ArrayList<>(group.getValue());
            ordered.sort(Comparator.comparing(WindowRow::getWindowStart));

            List<Instant> timestamps = new ArrayList<>(ordered.size());
            double[][] values = new double[ordered.size()][metrics.size()];
            for (int i = 0; i < ordered.size(); i++) {
                WindowRow row = ordered.get(i);
                timestamps.add(row.getWindowStart());
                for (int j = 0; j < metrics.size(); j++) {
                    Double value = row.getMetricValues() == null ? null : row.getMetricValues().get(metrics.get(j));
                    values[i][j] = value == null ? Double.NaN : value;
                }
            }
            series.put(group.getKey(), MetricSeries.multivariate(metrics, timestamps, values));
        }
        return series;
    }
}
