package com.fraud.analytics.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fraud.analytics.policy.PolicyAction;
import com.fraud.analytics.policy.Severity;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "A flagged point of a detection run with its policy decision")
public class AnomalyEvent {

    private String eventId;

    private String runId;

    private String detectorId;

    @Schema(description = "Cohort dimension values the series was grouped by")
    @Builder.Default
    private Map<String, String> cohortValues = new LinkedHashMap<>();

    @Schema(description = "Primary metric of the scored series", example = "txn_count")
    private String metric;

    @Schema(description = "Start of the flagged window")
    private Instant timestamp;

    @Schema(description = "Detector score, always finite", example = "6.42")
    private double score;

    private Severity severity;

    @Schema(description = "Consecutive anomalous windows ending at this one", example = "2")
    private int persistedN;

    @Schema(description = "Algorithm-specific evidence for this point")
    @Builder.Default
    private Map<String, Object> evidence = new LinkedHashMap<>();

    private PolicyAction policyAction;

    private String policyReason;
}
