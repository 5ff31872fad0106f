package com.assetvault.upload.controller;

import com.assetvault.upload.exception.ErrorCode;
import com.assetvault.upload.exception.MetadataPersistenceFailedException;
import com.assetvault.upload.exception.PlanLimitExceededException;
import com.assetvault.upload.exception.SizeMismatchException;
import com.assetvault.upload.exception.StateConflictException;
import com.assetvault.upload.exception.UploadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps upload failures to HTTP responses with a stable {@code error} code and the
 * {@code retryable} hint clients use to decide whether to call again.
 */
@Slf4j
@RestControllerAdvice
public class UploadExceptionHandler {

    @ExceptionHandler(UploadException.class)
    public ResponseEntity<Map<String, Object>> handleUpload(UploadException ex) {
        HttpStatus status = statusFor(ex.getCode());
        if (status.is5xxServerError()) {
            log.warn("Upload request failed: code={}, message={}", ex.getCode(), ex.getMessage());
        } else {
            log.debug("Upload request rejected: code={}, message={}", ex.getCode(), ex.getMessage());
        }

        Map<String, Object> body = body(ex.getCode().name(), ex.getMessage(), ex.isRetryable());
        if (ex instanceof StateConflictException conflict) {
            body.put("currentStatus", conflict.getCurrentStatus());
            body.put("targetStatus", conflict.getTargetStatus());
        } else if (ex instanceof PlanLimitExceededException limit) {
            body.put("requestedBytes", limit.getRequestedBytes());
            body.put("limitBytes", limit.getLimitBytes());
        } else if (ex instanceof SizeMismatchException mismatch) {
            body.put("expectedSize", mismatch.getExpectedSize());
            body.put("observedSize", mismatch.getObservedSize());
        } else if (ex instanceof MetadataPersistenceFailedException metadata) {
            body.put("rejectedFields", metadata.getRejectedFields());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", error.getField(),
                        "message", error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"))
                .toList();
        Map<String, Object> body = body(ErrorCode.INVALID_REQUEST.name(), "Request validation failed", false);
        body.put("details", fieldErrors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadInput(Exception ex) {
        return ResponseEntity.badRequest().body(body(ErrorCode.INVALID_REQUEST.name(), ex.getMessage(), false));
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case PLAN_LIMIT_EXCEEDED -> HttpStatus.FORBIDDEN;
            case BUCKET_NOT_READY, REMOTE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case STATE_CONFLICT, OBJECT_MISSING -> HttpStatus.CONFLICT;
            case SIZE_MISMATCH, TRANSFER_ASSEMBLY_FAILED, METADATA_PERSISTENCE_FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static Map<String, Object> body(String error, String message, boolean retryable) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("retryable", retryable);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
