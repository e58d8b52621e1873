package com.github.dimitryivaniuta.edgeguard.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.dimitryivaniuta.edgeguard.protection.ratelimit.RateLimitExceededException;
import com.github.dimitryivaniuta.edgeguard.store.StorageException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ApiError(
            String error,
            String details
    ) {}

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiError> handleRateLimit(RateLimitExceededException ex) {
        HttpHeaders h = new HttpHeaders();
        h.set(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds())); // seconds per RFC
        return new ResponseEntity<>(new ApiError(ex.getMessage(), ex.getDetails()), h, HttpStatus.TOO_MANY_REQUESTS);
    }

    @ExceptionHandler(EdgeApiException.class)
    public ResponseEntity<ApiError> handleEdge(EdgeApiException ex, HttpServletRequest req) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("{} {} failed: {} ({})", req.getMethod(), req.getRequestURI(), ex.getMessage(), ex.getDetails());
        }
        return ResponseEntity.status(ex.getStatus()).body(new ApiError(ex.getMessage(), ex.getDetails()));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ApiError> handleStorage(StorageException ex, HttpServletRequest req) {
        log.error("Storage failure on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("Internal Server Error", "Storage unavailable"));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handleMethod(HttpRequestMethodNotSupportedException ex) {
        HttpHeaders h = new HttpHeaders();
        if (ex.getSupportedHttpMethods() != null) {
            h.setAllow(ex.getSupportedHttpMethods());
        }
        return new ResponseEntity<>(new ApiError("Method Not Allowed", null), h, HttpStatus.METHOD_NOT_ALLOWED);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiError> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(new ApiError("Unsupported Media Type", null));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> noResource(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError("Not Found", null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled exception on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("Internal Server Error", "Unexpected error"));
    }
}
