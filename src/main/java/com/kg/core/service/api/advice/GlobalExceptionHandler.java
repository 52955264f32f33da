package com.kg.core.service.api.advice;

import com.kg.core.service.api.dto.ApiResponse;
import com.kg.core.service.cache.CacheUnavailableException;
import com.kg.core.service.graph.GraphStoreException;
import com.kg.core.service.ingest.IngestionException;
import com.kg.core.service.lifecycle.ServiceDegradedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Maps knowledge graph exceptions to HTTP statuses and error envelopes.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(
            MethodArgumentNotValidException ex) {

        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", details);

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Validation failed", IngestionException.VALIDATION_ERROR, null, details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Malformed request body", "MALFORMED_REQUEST"));
    }

    @ExceptionHandler(GraphStoreException.class)
    public ResponseEntity<ApiResponse<Void>> handleGraphStoreException(GraphStoreException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case GraphStoreException.GRAPH_NOT_LOADED -> HttpStatus.SERVICE_UNAVAILABLE;
            case GraphStoreException.NOT_IMPLEMENTED -> HttpStatus.NOT_IMPLEMENTED;
            case GraphStoreException.NOT_FOUND -> HttpStatus.NOT_FOUND;
            case GraphStoreException.TYPE_MISMATCH, GraphStoreException.INVALID_GRAPH -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("Graph store error: {} [{}]", ex.getMessage(), ex.getErrorCode(), ex);
        } else {
            log.warn("Graph store error: {} [{}]", ex.getMessage(), ex.getErrorCode());
        }
        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode(), ex.getPath(), null));
    }

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<ApiResponse<Void>> handleIngestionException(IngestionException ex) {
        log.error("Ingestion error: {} [{}]", ex.getMessage(), ex.getErrorCode());

        HttpStatus status = switch (ex.getErrorCode()) {
            case IngestionException.VALIDATION_ERROR, IngestionException.DECODE_ERROR -> HttpStatus.BAD_REQUEST;
            case IngestionException.DUPLICATE_UPDATE -> HttpStatus.CONFLICT;
            case IngestionException.PUBLISH_FAILED -> HttpStatus.BAD_GATEWAY;
            case IngestionException.RECOVERY_FAILED -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };

        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode(), ex.getUpdateId(), null));
    }

    @ExceptionHandler(ServiceDegradedException.class)
    public ResponseEntity<ApiResponse<Void>> handleDegraded(ServiceDegradedException ex) {
        log.warn("Rejected update {}: {}", ex.getUpdateId(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode(), ex.getUpdateId(), null));
    }

    @ExceptionHandler(CacheUnavailableException.class)
    public ResponseEntity<ApiResponse<Void>> handleCacheUnavailable(CacheUnavailableException ex) {
        log.error("Durable cache unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFoundException(
            NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Resource not found", "NOT_FOUND"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(
            IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getMessage(), "INVALID_ARGUMENT"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred", "INTERNAL_ERROR", null, ex.getMessage()));
    }
}
