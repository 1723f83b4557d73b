package com.phillippitts.talkback.presentation.exception;

import com.phillippitts.talkback.exception.BotNotFoundException;
import com.phillippitts.talkback.exception.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown bot personality (HTTP 404).
     */
    @ExceptionHandler(BotNotFoundException.class)
    ResponseEntity<ApiError> handleBotNotFound(BotNotFoundException ex) {
        LOG.warn("Bot personality not found: {}", ex.getBotName());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Bot personality not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Broken setup, e.g. an empty personality file (HTTP 503).
     */
    @ExceptionHandler(ConfigurationException.class)
    ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex) {
        LOG.error("Configuration error: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Service misconfigured",
                "Contact administrator.",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
