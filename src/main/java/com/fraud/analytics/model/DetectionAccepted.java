package com.fraud.analytics.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Acknowledgement of an accepted detection run")
public record DetectionAccepted(
        @Schema(description = "Identifier to poll the run with") String runId) {
}
