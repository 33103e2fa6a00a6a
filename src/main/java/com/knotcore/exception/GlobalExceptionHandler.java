package com.knotcore.exception;

import com.knotcore.model.dto.ErrorResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResourceNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(ValidationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDomainValidation(ValidationException ex) {
        log.warn("Rejected input: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "Validation failed: " + errors);
    }

    /**
     * Unreadable bodies, unknown enum values and malformed path variables.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException ex) {
        log.warn("Malformed request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request: " + ex.getReason());
    }

    /**
     * Out-of-range query parameters.
     */
    @ExceptionHandler({HandlerMethodValidationException.class, ConstraintViolationException.class})
    public Mono<ResponseEntity<ErrorResponse>> handleParameterValidation(Exception ex) {
        log.warn("Invalid request parameter: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation failed: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error: " + ex.getMessage());
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String detail) {
        ErrorResponse error = ErrorResponse.builder()
                .status(status.value())
                .detail(detail)
                .traceId(UUID.randomUUID().toString())
                .timestamp(Instant.now())
                .build();
        return Mono.just(ResponseEntity.status(status).body(error));
    }
}
