package com.fraud.analytics.controller;

import com.fraud.analytics.detector.UnknownDetectorTypeException;
import com.fraud.analytics.model.DetectionRequest;
import com.fraud.analytics.policy.PolicyAction;
import com.fraud.analytics.policy.Severity;
import com.fraud.analytics.service.AnomalyQueryService;
import com.fraud.analytics.service.DetectionOrchestrator;
import com.fraud.analytics.service.DetectorDisabledException;
import com.fraud.analytics.service.DetectorNotFoundException;
import com.fraud.analytics.service.InvalidDetectorConfigException;
import com.fraud.analytics.service.RunAlreadyInProgressException;
import com.fraud.analytics.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;

import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.fraud.analytics.testutil.TestDataFactory.WINDOW_FROM;
import static com.fraud.analytics.testutil.TestDataFactory.WINDOW_TO;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnomalyController.class)
class AnomalyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private DetectionOrchestrator orchestrator;

    @MockBean
    private AnomalyQueryService queryService;

    private String detectBody() throws Exception {
        return objectMapper.writeValueAsString(DetectionRequest.builder()
                .detectorId("det-1")
                .windowFrom(WINDOW_FROM)
                .windowTo(WINDOW_TO)
                .build());
    }

    @Test
    void detect_accepted() throws Exception {
        when(orchestrator.submit(any(DetectionRequest.class))).thenReturn("run-123");

        mockMvc.perform(post("/analytics/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(detectBody()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.run_id").value("run-123"));
    }

    @Test
    void detect_acceptsSnakeCaseBody() throws Exception {
        when(orchestrator.submit(any(DetectionRequest.class))).thenReturn("run-1");

        mockMvc.perform(post("/analytics/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"detector_id\":\"det-1\",\"window_from\":\"2024-03-01T00:00:00Z\","
                                + "\"window_to\":\"2024-03-03T00:00:00Z\",\"cohort_filters\":{\"country\":\"DE\"}}"))
                .andExpect(status().isAccepted());
    }

    @Test
    void detect_missingDetectorId_validationError() throws Exception {
        mockMvc.perform(post("/analytics/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"window_from\":\"2024-03-01T00:00:00Z\",\"window_to\":\"2024-03-03T00:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.detectorId").exists());

        verify(orchestrator, never()).submit(any());
    }

    @Test
    void detect_malformedJson_badRequest() throws Exception {
        mockMvc.perform(post("/analytics/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    @Test
    void detect_reversedWindow_badRequest() throws Exception {
        when(orchestrator.submit(any(DetectionRequest.class)))
                .thenThrow(new IllegalArgumentException("window_from must be before window_to"));

        mockMvc.perform(post("/analytics/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(detectBody()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"));
    }

    @Test
    void detect_unknownDetector_notFound() throws Exception {
        when(orchestrator.submit(any(DetectionRequest.class))).thenThrow(new DetectorNotFoundException("det-1"));

        mockMvc.perform(post("/analytics/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(detectBody()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void detect_disabledDetector_conflict() throws Exception {
        when(orchestrator.submit(any(DetectionRequest.class))).thenThrow(new DetectorDisabledException("det-1"));

        mockMvc.perform(post("/analytics/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(detectBody()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DETECTOR_DISABLED"));
    }

    @Test
    void detect_runInProgress_conflict() throws Exception {
        when(orchestrator.submit(any(DetectionRequest.class)))
                .thenThrow(new RunAlreadyInProgressException("det-1", WINDOW_FROM, WINDOW_TO));

        mockMvc.perform(post("/analytics/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(detectBody()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("RUN_IN_PROGRESS"));
    }

    @Test
    void detect_unimplementedType_unprocessable() throws Exception {
        when(orchestrator.submit(any(DetectionRequest.class)))
                .thenThrow(new UnknownDetectorTypeException("rcf", List.of("cusum", "isoforest", "stl_mad")));

        mockMvc.perform(post("/analytics/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(detectBody()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("UNKNOWN_DETECTOR_TYPE"))
                .andExpect(jsonPath("$.details.requested_type").value("rcf"))
                .andExpect(jsonPath("$.details.available_types[0]").value("cusum"));
    }

    @Test
    void detect_misconfiguredDetector_unprocessable() throws Exception {
        when(orchestrator.submit(any(DetectionRequest.class)))
                .thenThrow(new InvalidDetectorConfigException("det-1", "no primary metric"));

        mockMvc.perform(post("/analytics/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(detectBody()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INVALID_DETECTOR_CONFIG"));
    }

    @Test
    void detect_unexpectedError_internal() throws Exception {
        when(orchestrator.submit(any(DetectionRequest.class))).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/analytics/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(detectBody()))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"));
    }

    @Test
    void listAnomalies_returnsEventsWithPolicyAction() throws Exception {
        when(queryService.listEvents("det-1")).thenReturn(List.of(
                TestDataFactory.createEvent("e1", "run-1", WINDOW_FROM, 8.2, Severity.CRITICAL, PolicyAction.INVESTIGATE)));

        mockMvc.perform(get("/analytics/anomalies").param("detector_id", "det-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$[0].event_id").value("e1"))
                .andExpect(jsonPath("$[0].severity").value("critical"))
                .andExpect(jsonPath("$[0].policy_action").value("investigate"))
                .andExpect(jsonPath("$[0].persisted_n").value(1));
    }

    @Test
    void listAnomalies_missingDetectorId_badRequest() throws Exception {
        mockMvc.perform(get("/analytics/anomalies"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }
}
