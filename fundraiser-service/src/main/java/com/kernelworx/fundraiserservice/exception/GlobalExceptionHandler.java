package com.kernelworx.fundraiserservice.exception;

import com.kernelworx.common.dto.ErrorResponse;
import com.kernelworx.common.dto.ValidationErrorResponse;
import com.kernelworx.common.exception.ErrorKind;
import com.kernelworx.common.exception.FundraiserException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Generate a unique correlation ID for tracking requests
     */
    private String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Handles every domain failure (401, 403, 400, 404, 409, 500).
     * The status and error code come from the exception's kind.
     * Note: Logging is done at service layer with more context, except for internal errors
     */
    @ExceptionHandler(FundraiserException.class)
    public ResponseEntity<ErrorResponse> handleFundraiserException(
            FundraiserException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        ErrorKind kind = ex.getKind();
        if (kind == ErrorKind.INTERNAL_ERROR) {
            log.error("[{}] Internal error - Path: {} - {}", correlationId, request.getRequestURI(), ex.getMessage(), ex);
        }

        HttpStatus status = HttpStatus.valueOf(kind.getHttpStatus());
        return build(status, ex.getMessage(), kind.getErrorCode(), request, correlationId);
    }

    /**
     * Handles MethodArgumentNotValidException (400 - Bad Request)
     * Thrown when request validation fails (@Valid annotation)
     * Returns all field validation errors
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        Map<String, String> validationErrors = new HashMap<>();

        ex.getBindingResult().getAllErrors().forEach(error -> {
            if (error instanceof FieldError fieldError) {
                validationErrors.put(fieldError.getField(), error.getDefaultMessage());
            }
        });

        String correlationId = generateCorrelationId();
        log.debug("[{}] Validation failed - Path: {} - Errors: {}", correlationId, request.getRequestURI(), validationErrors);

        ValidationErrorResponse errorResponse = ValidationErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message("Validation failed")
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .validationErrors(validationErrors)
                .errorCode("VALIDATION_FAILED")
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles unreadable bodies and missing query parameters (400 - Bad Request)
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.debug("[{}] Malformed request - Path: {} - {}", correlationId, request.getRequestURI(), ex.getMessage());

        String message = ex instanceof MissingServletRequestParameterException missing
                ? "Missing required parameter: " + missing.getParameterName()
                : "Malformed request body";
        return build(HttpStatus.BAD_REQUEST, message, ErrorKind.BAD_REQUEST.getErrorCode(), request, correlationId);
    }

    /**
     * Handles concurrent modification and uniqueness races (409 - Conflict)
     * Store errors raised outside a pipeline land here
     */
    @ExceptionHandler({OptimisticLockingFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<ErrorResponse> handleStoreConflict(
            RuntimeException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.warn("[{}] Store conflict - Path: {} - {}", correlationId, request.getRequestURI(), ex.getMessage());

        return build(HttpStatus.CONFLICT, "The resource was modified or already exists",
                ErrorKind.CONFLICT.getErrorCode(), request, correlationId);
    }

    /**
     * Handles all other unexpected exceptions (500 - Internal Server Error)
     * Generic handler for any unhandled exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        // Log the full exception with stack trace for debugging
        log.error("[{}] Unexpected error occurred - Path: {} - Exception: {}",
                correlationId,
                request.getRequestURI(),
                ex.getMessage(),
                ex);

        // Return generic message to client (avoid exposing internal details)
        return build(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact support if the problem persists.",
                "INTERNAL_SERVER_ERROR", request, correlationId);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String errorCode,
                                                HttpServletRequest request, String correlationId) {
        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(errorCode)
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, status);
    }
}
