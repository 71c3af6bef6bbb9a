package com.soko.marketplaceservice.exception;

import com.soko.common.dto.ErrorResponse;
import com.soko.common.dto.ValidationErrorResponse;
import com.soko.common.exception.AccessDeniedException;
import com.soko.common.exception.ErrorCode;
import com.soko.common.exception.InsufficientStockException;
import com.soko.common.exception.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private ResponseEntity<ErrorResponse> build(ErrorCode code, String message, HttpServletRequest request) {
        HttpStatus status = HttpStatus.valueOf(code.getHttpStatus());
        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(code.name())
                .retryable(code.isRetryable())
                .correlationId(generateCorrelationId())
                .build();

        return new ResponseEntity<>(errorResponse, status);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request) {
        return build(ErrorCode.RESOURCE_NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request) {
        return build(ErrorCode.ACCESS_DENIED, ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidOrderStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOrderStateException(
            InvalidOrderStateException ex,
            HttpServletRequest request) {
        return build(ErrorCode.INVALID_TRANSITION, ex.getMessage(), request);
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientStockException(
            InsufficientStockException ex,
            HttpServletRequest request) {
        return build(ErrorCode.INSUFFICIENT_STOCK, ex.getMessage(), request);
    }

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
                .errorCode(ErrorCode.VALIDATION_FAILED.name())
                .retryable(false)
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({ IllegalArgumentException.class, MethodArgumentTypeMismatchException.class })
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            Exception ex,
            HttpServletRequest request) {
        return build(ErrorCode.INVALID_INPUT, ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {
        log.debug("Unreadable request body - Path: {} - {}", request.getRequestURI(), ex.getMessage());
        return build(ErrorCode.INVALID_INPUT, "Malformed request body", request);
    }

    /**
     * Two requests changed the same order at once, e.g. a buyer cancelling while the seller
     * rejects. The loser rolled back completely and may retry.
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockingFailureException(
            OptimisticLockingFailureException ex,
            HttpServletRequest request) {
        log.warn("Optimistic locking conflict detected - Path: {} - User should retry", request.getRequestURI());
        return build(ErrorCode.CONCURRENT_MODIFICATION,
                "The order was modified by another user. Please refresh and try again.", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex,
            HttpServletRequest request) {
        ResponseEntity<ErrorResponse> response = build(ErrorCode.INTERNAL_ERROR,
                "An unexpected error occurred. Please contact support if the problem persists.", request);
        log.error("[{}] Unexpected error occurred - Path: {} - Exception: {}",
                response.getBody().getCorrelationId(),
                request.getRequestURI(),
                ex.getMessage(),
                ex);
        return response;
    }
}
