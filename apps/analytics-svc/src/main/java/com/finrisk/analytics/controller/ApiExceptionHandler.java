package com.finrisk.analytics.controller;

import com.finrisk.analytics.controller.dto.ErrorResponseDto;
import com.finrisk.analytics.dataset.DatasetLoadException;
import com.finrisk.analytics.model.MissingColumnsException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MissingColumnsException.class)
    public ResponseEntity<ErrorResponseDto> handleMissingColumns(MissingColumnsException ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "SCHEMA_ERROR", ex.getMessage(), Map.of(
                "dataset", ex.dataset(),
                "missingColumns", ex.missingColumns()
        ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponseDto> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", "Invalid value for parameter '" + ex.getName() + "'", Map.of());
    }

    @ExceptionHandler(DatasetLoadException.class)
    public ResponseEntity<ErrorResponseDto> handleDatasetLoad(DatasetLoadException ex) {
        log.warn("Dataset load failed: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "DATASET_UNAVAILABLE", "Input datasets could not be loaded",
                Map.of("reason", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of("reason", reason));
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status).body(new ErrorResponseDto(code, message, details));
    }
}
