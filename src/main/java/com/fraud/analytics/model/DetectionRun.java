package com.fraud.analytics.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "One execution of a detector over a time window")
public class DetectionRun {

    @Schema(description = "Run identifier", example = "5b0c1f9e-6a43-4a55-9d1f-2f3c9f0b7e11")
    private String runId;

    private String detectorId;

    private Instant windowFrom;

    private Instant windowTo;

    @Schema(description = "RUNNING until the run completes or fails; terminal states never change")
    private RunStatus status;

    private Instant startedAt;

    private Instant completedAt;

    @Schema(description = "Number of anomaly events written by a completed run")
    private int eventCount;

    @Schema(description = "Failure message of a FAILED run")
    private String error;

    /**
     * Identity used to allow at most one in-flight run per detector and window.
     */
    public static String inFlightKey(String detectorId, Instant windowFrom, Instant windowTo) {
        return detectorId + "|" + windowFrom.toEpochMilli() + "|" + windowTo.toEpochMilli();
    }
}
