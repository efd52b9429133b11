package com.fraud.analytics.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Request to run a detector over a time window")
public class DetectionRequest {

    @NotBlank
    @Schema(description = "Detector to run", example = "det-merchant-volume")
    private String detectorId;

    @NotNull
    @Schema(description = "Inclusive window start", example = "2024-03-01T00:00:00Z")
    private Instant windowFrom;

    @NotNull
    @Schema(description = "Exclusive window end, after window_from", example = "2024-03-08T00:00:00Z")
    private Instant windowTo;

    @Schema(description = "Optional cohort dimension filters passed to the series source")
    @Builder.Default
    private Map<String, String> cohortFilters = new HashMap<>();
}
