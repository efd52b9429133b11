package com.fraud.analytics.controller;

import com.fraud.analytics.detector.UnknownDetectorTypeException;
import com.fraud.analytics.service.DetectorDisabledException;
import com.fraud.analytics.service.DetectorNotFoundException;
import com.fraud.analytics.service.InvalidDetectorConfigException;
import com.fraud.analytics.service.RunAlreadyInProgressException;
import com.fraud.analytics.service.RunNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(error -> fields.put(error.getField(), error.getDefaultMessage()));
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", fields);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({DetectorNotFoundException.class, RunNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(DetectorDisabledException.class)
    public ResponseEntity<ErrorResponse> handleDisabled(DetectorDisabledException ex) {
        return build(HttpStatus.CONFLICT, "DETECTOR_DISABLED", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(RunAlreadyInProgressException.class)
    public ResponseEntity<ErrorResponse> handleInProgress(RunAlreadyInProgressException ex) {
        return build(HttpStatus.CONFLICT, "RUN_IN_PROGRESS", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(InvalidDetectorConfigException.class)
    public ResponseEntity<ErrorResponse> handleInvalidConfig(InvalidDetectorConfigException ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_DETECTOR_CONFIG", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(UnknownDetectorTypeException.class)
    public ResponseEntity<ErrorResponse> handleUnknownType(UnknownDetectorTypeException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requested_type", ex.getRequestedType());
        details.put("available_types", ex.getAvailableTypes());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "UNKNOWN_DETECTOR_TYPE", ex.getMessage(), details);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex) {
        // Framework errors such as unknown paths or unsupported methods carry their own status.
        if (ex instanceof org.springframework.web.ErrorResponse frameworkError) {
            HttpStatus status = HttpStatus.resolve(frameworkError.getStatusCode().value());
            if (status != null && status.is4xxClientError()) {
                return build(status, status.name(), ex.getMessage(), Map.of());
            }
        }
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", details);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                Map<String, Object> details) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, details));
    }
}
