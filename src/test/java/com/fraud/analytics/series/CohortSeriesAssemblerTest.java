package com.fraud.analytics.series;

import com.fraud.analytics.detector.MetricSeries;
import com.fraud.analytics.model.WindowRow;
import com.fraud.analytics.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.fraud.analytics.testutil.TestDataFactory.WINDOW_FROM;
import static org.assertj.core.api.Assertions.assertThat;

class CohortSeriesAssemblerTest {

    @Test
    void assemble_groupsByCohortInFirstSeenOrder() {
        List<WindowRow> rows = new ArrayList<>(TestDataFactory.hourlyRows("m-2", "txn_count", new double[]{1, 2, 3}));
        rows.addAll(TestDataFactory.hourlyRows("m-1", "txn_count", new double[]{10, 20}));

        Map<Map<String, String>, MetricSeries> cohorts =
                CohortSeriesAssembler.assemble(rows, List.of("merchant"), List.of("txn_count"));

        assertThat(cohorts.keySet()).containsExactly(Map.of("merchant", "m-2"), Map.of("merchant", "m-1"));
        assertThat(cohorts.get(Map.of("merchant", "m-2")).primary()).containsExactly(1.0, 2.0, 3.0);
        assertThat(cohorts.get(Map.of("merchant", "m-1")).primary()).containsExactly(10.0, 20.0);
    }

    @Test
    void assemble_ordersRowsByWindowStart() {
        List<WindowRow> rows = new ArrayList<>(TestDataFactory.hourlyRows("m-1", "txn_count", new double[]{1, 2, 3, 4}));
        Collections.reverse(rows);

        MetricSeries series = CohortSeriesAssembler
                .assemble(rows, List.of("merchant"), List.of("txn_count"))
                .get(Map.of("merchant", "m-1"));

        assertThat(series.primary()).containsExactly(1.0, 2.0, 3.0, 4.0);
        assertThat(series.timestampAt(0)).isEqualTo(WINDOW_FROM);
        assertThat(series.timestampAt(3)).isEqualTo(WINDOW_FROM.plus(Duration.ofHours(3)));
    }

    @Test
    void assemble_primaryMetricFirstAndMissingMetricIsNaN() {
        WindowRow row = WindowRow.builder()
                .windowStart(WINDOW_FROM)
                .windowEnd(WINDOW_FROM.plus(Duration.ofHours(1)))
                .cohortValues(new LinkedHashMap<>(Map.of("merchant", "m-1")))
                .metricValues(new LinkedHashMap<>(Map.of("amount_sum", 250.0)))
                .build();

        MetricSeries series = CohortSeriesAssembler
                .assemble(List.of(row), List.of("merchant"), List.of("txn_count", "amount_sum"))
                .get(Map.of("merchant", "m-1"));

        assertThat(series.getMetricNames()).containsExactly("txn_count", "amount_sum");
        assertThat(series.primaryMetric()).isEqualTo("txn_count");
        assertThat(series.row(0)[0]).isNaN();
        assertThat(series.row(0)[1]).isEqualTo(250.0);
    }

    @Test
    void assemble_noCohortDimensionsYieldsSingleSeries() {
        List<WindowRow> rows = new ArrayList<>(TestDataFactory.hourlyRows("m-1", "txn_count", new double[]{1, 2}));
        rows.addAll(TestDataFactory.hourlyRows("m-2", "txn_count", new double[]{3, 4}));

        Map<Map<String, String>, MetricSeries> cohorts =
                CohortSeriesAssembler.assemble(rows, List.of(), List.of("txn_count"));

        assertThat(cohorts).hasSize(1);
        assertThat(cohorts.values().iterator().next().size()).isEqualTo(4);
    }

    @Test
    void assemble_emptyRows() {
        assertThat(CohortSeriesAssembler.assemble(List.of(), List.of("merchant"), List.of("txn_count"))).isEmpty();
    }
}
