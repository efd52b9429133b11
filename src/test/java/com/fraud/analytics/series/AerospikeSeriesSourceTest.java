package com.fraud.analytics.series;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.ScanPolicy;
import com.fraud.analytics.config.AerospikeConfig;
import com.fraud.analytics.model.WindowRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.fraud.analytics.testutil.TestDataFactory.WINDOW_FROM;
import static com.fraud.analytics.testutil.TestDataFactory.WINDOW_TO;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;

@ExtendWith(MockitoExtension.class)
class AerospikeSeriesSourceTest {

    @Mock
    private AerospikeClient client;

    private AerospikeSeriesSource source;
    private final List<Record> stored = new ArrayList<>();

    @BeforeEach
    void setUp() {
        source = new AerospikeSeriesSource(client, "test");
    }

    private void givenStoredWindows() {
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            for (Record record : stored) {
                callback.scanCallback(new Key("test", AerospikeConfig.SET_METRIC_WINDOWS, "k"), record);
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq("test"), eq(AerospikeConfig.SET_METRIC_WINDOWS),
                any(ScanCallback.class));
    }

    private void store(Instant start, String cohortJson, String metricsJson) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("windowStart", start.toEpochMilli());
        bins.put("windowEnd", start.plus(Duration.ofHours(1)).toEpochMilli());
        bins.put("cohortValues", cohortJson);
        bins.put("metricValues", metricsJson);
        stored.add(new Record(bins, 1, 0));
    }

    @Test
    void fetchWindows_rollsUpFinerGrainAndKeepsWindowBounds() {
        Instant second = WINDOW_FROM.plus(Duration.ofHours(1));
        store(second, "{\"merchant\":\"m-1\",\"country\":\"DE\"}", "{\"txn_count\":5.0}");
        store(WINDOW_FROM, "{\"merchant\":\"m-1\",\"country\":\"DE\"}", "{\"txn_count\":3.0}");
        store(WINDOW_FROM, "{\"merchant\":\"m-1\",\"country\":\"FR\"}", "{\"txn_count\":4.0}");
        store(WINDOW_FROM.minusSeconds(1), "{\"merchant\":\"m-1\",\"country\":\"DE\"}", "{\"txn_count\":100.0}");
        store(WINDOW_TO, "{\"merchant\":\"m-1\",\"country\":\"DE\"}", "{\"txn_count\":100.0}");
        givenStoredWindows();

        List<WindowRow> rows = source.fetchWindows(List.of("merchant"), List.of("txn_count"),
                WINDOW_FROM, WINDOW_TO, Map.of());

        assertThat(rows).extracting(WindowRow::getWindowStart).containsExactly(WINDOW_FROM, second);
        assertThat(rows.get(0).getMetricValues()).containsEntry("txn_count", 7.0);
        assertThat(rows.get(0).getCohortValues()).containsOnlyKeys("merchant");
        assertThat(rows.get(1).getMetricValues()).containsEntry("txn_count", 5.0);
    }

    @Test
    void fetchWindows_appliesCohortFilters() {
        store(WINDOW_FROM, "{\"merchant\":\"m-1\",\"country\":\"DE\"}", "{\"txn_count\":3.0}");
        store(WINDOW_FROM, "{\"merchant\":\"m-2\",\"country\":\"FR\"}", "{\"txn_count\":4.0}");
        givenStoredWindows();

        List<WindowRow> rows = source.fetchWindows(List.of("merchant"), List.of("txn_count"),
                WINDOW_FROM, WINDOW_TO, Map.of("country", "FR"));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getCohortValues()).containsEntry("merchant", "m-2");
    }

    @Test
    void fetchWindows_missingMetricIsNaN() {
        store(WINDOW_FROM, "{\"merchant\":\"m-1\"}", "{\"amount_sum\":10.0}");
        givenStoredWindows();

        List<WindowRow> rows = source.fetchWindows(List.of("merchant"), List.of("txn_count"),
                WINDOW_FROM, WINDOW_TO, null);

        assertThat(rows.get(0).getMetricValues().get("txn_count")).isNaN();
    }

    @Test
    void fetchWindows_malformedBin_fails() {
        store(WINDOW_FROM, "not json", "{\"txn_count\":1.0}");
        givenStoredWindows();

        assertThatThrownBy(() -> source.fetchWindows(List.of("merchant"), List.of("txn_count"),
                WINDOW_FROM, WINDOW_TO, Map.of()))
                .isInstanceOf(SeriesFetchException.class)
                .hasMessageContaining("cohortValues");
    }

    @Test
    void fetchWindows_clientError_wrapped() {
        doThrow(new AerospikeException("cluster unreachable")).when(client).scanAll(any(ScanPolicy.class),
                eq("test"), eq(AerospikeConfig.SET_METRIC_WINDOWS), any(ScanCallback.class));

        assertThatThrownBy(() -> source.fetchWindows(List.of("merchant"), List.of("txn_count"),
                WINDOW_FROM, WINDOW_TO, Map.of()))
                .isInstanceOf(SeriesFetchException.class)
                .hasMessageContaining("cluster unreachable");
    }
}
