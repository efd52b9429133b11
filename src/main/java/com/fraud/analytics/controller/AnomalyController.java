package com.fraud.analytics.controller;

import com.fraud.analytics.model.AnomalyEvent;
import com.fraud.analytics.model.DetectionAccepted;
import com.fraud.analytics.model.DetectionRequest;
import com.fraud.analytics.service.AnomalyQueryService;
import com.fraud.analytics.service.DetectionOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/analytics/anomalies")
@Tag(name = "Anomalies", description = "Trigger detection runs and list the resulting anomaly events")
public class AnomalyController {

    private final DetectionOrchestrator orchestrator;
    private final AnomalyQueryService queryService;

    public AnomalyController(DetectionOrchestrator orchestrator, AnomalyQueryService queryService) {
        this.orchestrator = orchestrator;
        this.queryService = queryService;
    }

    @PostMapping("/detect")
    @Operation(summary = "Run a detector over a time window",
               description = "Validates the request and detector synchronously, then runs detection in the " +
                       "background. Returns the run id immediately.")
    @ApiResponse(responseCode = "202", description = "Run accepted")
    @ApiResponse(responseCode = "404", description = "Unknown detector id")
    @ApiResponse(responseCode = "409", description = "Detector disabled or run already in progress")
    @ApiResponse(responseCode = "422", description = "Detector type has no implementation")
    public ResponseEntity<DetectionAccepted> detect(@Valid @RequestBody DetectionRequest request) {
        String runId = orchestrator.submit(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new DetectionAccepted(runId));
    }

    @GetMapping
    @Operation(summary = "List anomaly events of a detector",
               description = "Events of completed runs only, newest first, each with its policy action")
    public ResponseEntity<List<AnomalyEvent>> listAnomalies(
            @Parameter(description = "Detector identifier", example = "det-merchant-volume")
            @RequestParam("detector_id") String detectorId) {
        return ResponseEntity.ok(queryService.listEvents(detectorId));
    }
}
