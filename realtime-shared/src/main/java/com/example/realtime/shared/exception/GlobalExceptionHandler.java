package com.example.realtime.shared.exception;

import com.example.realtime.shared.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.time.OffsetDateTime;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(EventValidationException.class)
    public ResponseEntity<ErrorResponse> handleEventValidationException(EventValidationException ex, ServerWebExchange exchange) {
        log.warn("EventValidationException: {}", ex.getMessage());
        return new ResponseEntity<>(body(HttpStatus.BAD_REQUEST, "Invalid Event", ex.getMessage(), exchange), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimitExceededException(RateLimitExceededException ex, ServerWebExchange exchange) {
        log.warn("RateLimitExceededException: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(body(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", ex.getMessage(), exchange));
    }

    @ExceptionHandler({BreakerOpenException.class, PublishRetriesExhaustedException.class, TransientStoreException.class})
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(EventDistributionException ex, ServerWebExchange exchange) {
        log.error("{}: {}", ex.getClass().getSimpleName(), ex.getMessage());
        return new ResponseEntity<>(body(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage(), exchange), HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(WebExchangeBindException ex, ServerWebExchange exchange) {
        String errors = ex.getBindingResult()
                .getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errors);
        return new ResponseEntity<>(body(HttpStatus.BAD_REQUEST, "Validation Failed", errors, exchange), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, ServerWebExchange exchange) {
        ErrorResponse errorResponse = new ErrorResponse(
                OffsetDateTime.now(),
                ex.getStatusCode().value(),
                ex.getStatusCode().toString(),
                ex.getReason(),
                exchange.getRequest().getPath().toString()
        );

        if (ex.getStatusCode().is4xxClientError()) {
            log.warn("Client error: {} on path '{}' - Reason: {}", ex.getStatusCode().value(), exchange.getRequest().getPath(), ex.getReason());
        } else if (ex.getStatusCode().is5xxServerError()) {
            log.error("Server error occurred on path {}:", exchange.getRequest().getPath(), ex);
        }

        return new ResponseEntity<>(errorResponse, ex.getStatusCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("An unexpected error occurred at path {}:", exchange.getRequest().getPath(), ex);
        return new ResponseEntity<>(body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", exchange), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ErrorResponse body(HttpStatus status, String error, String message, ServerWebExchange exchange) {
        return new ErrorResponse(OffsetDateTime.now(), status.value(), error, message, exchange.getRequest().getPath().toString());
    }
}
