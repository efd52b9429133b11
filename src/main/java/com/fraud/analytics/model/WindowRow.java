package com.fraud.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One aggregated warehouse window for a cohort.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WindowRow {

    private Instant windowStart;

    private Instant windowEnd;

    @Builder.Default
    private Map<String, String> cohortValues = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> metricValues = new LinkedHashMap<>();
}
