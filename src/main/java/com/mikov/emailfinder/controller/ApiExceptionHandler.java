package com.mikov.emailfinder.controller;

import com.mikov.emailfinder.exception.CapabilityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Converts failures at the REST boundary to HTTP responses.
 */
@RestControllerAdvice
class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    /**
     * DNS or another required capability is unreachable (HTTP 503).
     */
    @ExceptionHandler(CapabilityException.class)
    ResponseEntity<ApiError> handleCapabilityUnavailable(CapabilityException ex) {
        logger.error("Capability {} unavailable: {}", ex.getCapability(), ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiError(
                        ex.getCapability().name() + "_UNAVAILABLE",
                        "Email discovery temporarily unavailable",
                        Instant.now()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        logger.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiError("BAD_REQUEST", ex.getMessage(), Instant.now()));
    }

    record ApiError(String errorCode, String message, Instant timestamp) {
    }
}
