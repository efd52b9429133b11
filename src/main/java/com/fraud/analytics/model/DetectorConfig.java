package com.fraud.analytics.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stored detector definition. Read-only here; it is managed by the configuration service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Configuration of one anomaly detector")
public class DetectorConfig {

    @Schema(description = "Detector identifier", example = "det-merchant-volume")
    private String id;

    @Schema(description = "Display name", example = "Merchant hourly volume")
    private String name;

    @Schema(description = "Owning tenant", example = "acme")
    private String tenant;

    @Schema(description = "Algorithm tag", example = "stl_mad",
            allowableValues = {"stl_mad", "cusum", "isoforest", "rcf", "matrix_profile"})
    private String type;

    @Schema(description = "Ordered grouping dimensions; each distinct value tuple is scored separately")
    @Builder.Default
    private List<String> cohortBy = new ArrayList<>();

    private MetricSpec metrics;

    @Schema(description = "Algorithm parameters plus the common k, persistence and min_support")
    @Builder.Default
    private Map<String, String> params = new HashMap<>();

    private boolean enabled;

    /**
     * Primary metric first, then secondary metrics in declared order.
     */
    public List<String> allMetrics() {
        List<String> all = new ArrayList<>();
        if (metrics == null) return all;
        if (metrics.getPrimary() != null) {
            all.add(metrics.getPrimary());
        }
        if (metrics.getSecondary() != null) {
            for (String metric : metrics.getSecondary()) {
                if (metric != null && !all.contains(metric)) {
                    all.add(metric);
                }
            }
        }
        return all;
    }
}
