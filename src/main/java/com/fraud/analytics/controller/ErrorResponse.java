package com.fraud.analytics.controller;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "Error body returned for every non-2xx response")
public record ErrorResponse(
        @Schema(description = "Stable error code", example = "RUN_IN_PROGRESS") String error,
        @Schema(description = "Human-readable message") String message,
        @Schema(description = "Structured context, may be empty") Map<String, Object> details) {
}
