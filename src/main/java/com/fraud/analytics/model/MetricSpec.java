package com.fraud.analytics.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Metrics a detector reads: one primary metric and optional secondary metrics")
public class MetricSpec {

    @Schema(description = "Primary metric name", example = "txn_count")
    private String primary;

    @Schema(description = "Secondary metric names, used as extra features by multivariate detectors")
    @Builder.Default
    private List<String> secondary = new ArrayList<>();
}
