package com.fraud.analytics.series;

import com.fraud.analytics.model.WindowRow;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Warehouse access for aggregated metric windows.
 */
public interface SeriesSource {

    /**
     * Rows in {@code [windowFrom, windowTo)} ordered by window start. Each row's cohort values
     * hold exactly the {@code cohortBy} dimensions and its metric values hold the requested metrics.
     *
     * @throws SeriesFetchException when the warehouse cannot be read
     */
    List<WindowRow> fetchWindows(List<String> cohortBy, List<String> metrics,
                                 Instant windowFrom, Instant windowTo,
                                 Map<String, String> cohortFilters);
}
