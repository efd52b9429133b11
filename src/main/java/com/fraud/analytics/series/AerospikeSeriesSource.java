package com.fraud.analytics.series;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fraud.analytics.config.AerospikeConfig;
import com.fraud.analytics.model.WindowRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads pre-aggregated windows from the {@code metric_windows} set.
 *
 * Rows are stored at the finest cohort grain. Rows sharing a window start and the same values
 * for the requested {@code cohortBy} dimensions are rolled up by summing their metrics.
 */
@Component
public class AerospikeSeriesSource implements SeriesSource {

    private static final Logger log = LoggerFactory.getLogger(AerospikeSeriesSource.class);

    private final AerospikeClient client;
    private final String namespace;
    private final ObjectMapper objectMapper;

    public AerospikeSeriesSource(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<WindowRow> fetchWindows(List<String> cohortBy, List<String> metrics,
                                        Instant windowFrom, Instant windowTo,
                                        Map<String, String> cohortFilters) {
        long fromMillis = windowFrom.toEpochMilli();
        long toMillis = windowTo.toEpochMilli();
        Map<String, WindowRow> rolledUp = new LinkedHashMap<>();

        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_METRIC_WINDOWS,
                    (key, record) -> {
                        long start = record.getLong("windowStart");
                        if (start < fromMillis || start >= toMillis) return;

                        Map<String, String> cohort = readMap(record, "cohortValues", new TypeReference<Map<String, String>>() {});
                        if (!matches(cohort, cohortFilters)) return;

                        Map<String, String> projected = new LinkedHashMap<>();
                        for (String dimension : cohortBy) {
                            projected.put(dimension, cohort.get(dimension));
                        }
                        Map<String, Double> values = readMap(record, "metricValues", new TypeReference<Map<String, Double>>() {});

                        synchronized (rolledUp) {
                            WindowRow row = rolledUp.computeIfAbsent(start + "|" + projected, k -> WindowRow.builder()
                                    .windowStart(Instant.ofEpochMilli(start))
                                    .windowEnd(Instant.ofEpochMilli(record.getLong("windowEnd")))
                                    .cohortValues(projected)
                                    .build());
                            for (String metric : metrics) {
                                Double value = values.get(metric);
                                // A missing metric stays NaN and is rejected by detector validation.
                                row.getMetricValues().merge(metric, value == null ? Double.NaN : value, Double::sum);
                            }
                        }
                    });
        } catch (AerospikeException e) {
            throw new SeriesFetchException("Failed to read metric windows: " + e.getMessage(), e);
        }

        List<WindowRow> rows = new ArrayList<>(rolledUp.values());
        rows.sort(Comparator.comparing(WindowRow::getWindowStart));
        log.debug("Fetched {} windows for cohortBy={} metrics={} in [{}, {})",
                rows.size(), cohortBy, metrics, windowFrom, windowTo);
        return rows;
    }

    private static boolean matches(Map<String, String> cohort, Map<String, String> filters) {
        if (filters == null || filters.isEmpty()) return true;
        for (Map.Entry<String, String> filter : filters.entrySet()) {
            if (!filter.getValue().equals(cohort.get(filter.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private <T extends Map<String, ?>> T readMap(Record record, String bin, TypeReference<T> type) {
        String json = record.getString(bin);
        if (json == null || json.isEmpty()) {
            throw new SeriesFetchException("Metric window is missing bin '" + bin + "'");
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            throw new SeriesFetchException("Malformed '" + bin + "' in metric window: " + json, e);
        }
    }
}
