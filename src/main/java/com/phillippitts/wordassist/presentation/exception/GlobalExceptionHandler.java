package com.phillippitts.wordassist.presentation.exception;

import com.phillippitts.wordassist.exception.AllProvidersFailedException;
import com.phillippitts.wordassist.exception.NoProvidersAvailableException;
import com.phillippitts.wordassist.exception.OutputValidationException;
import com.phillippitts.wordassist.exception.ProviderConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Converts orchestration exceptions to HTTP responses.
 *
 * Messages of provider failures are passed through; they never contain API keys.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * No provider has an API key configured (HTTP 503).
     */
    @ExceptionHandler(NoProvidersAvailableException.class)
    ResponseEntity<ApiError> handleNoProviders(NoProvidersAvailableException ex) {
        LOG.warn("No AI provider available: skipped={}", ex.getSkipped());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex);
    }

    /**
     * Every attempted provider failed (HTTP 502).
     */
    @ExceptionHandler(AllProvidersFailedException.class)
    ResponseEntity<ApiError> handleAllFailed(AllProvidersFailedException ex) {
        LOG.error("All AI providers failed: {}", ex.getFailures());
        return error(HttpStatus.BAD_GATEWAY, ex);
    }

    /**
     * AI answer did not fit the requested fields (HTTP 422).
     */
    @ExceptionHandler(OutputValidationException.class)
    ResponseEntity<ApiError> handleOutputValidation(OutputValidationException ex) {
        LOG.warn("AI output rejected: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    /**
     * Client error (HTTP 400).
     */
    @ExceptionHandler({ProviderConfigurationException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleBadRequest(RuntimeException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex);
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError("InternalServerError", "An unexpected error occurred", Instant.now()));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), ex.getMessage(), Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String error,
        String message,
        Instant timestamp
    ) {}
}
