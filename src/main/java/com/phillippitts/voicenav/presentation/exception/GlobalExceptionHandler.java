package com.phillippitts.voicenav.presentation.exception;

import com.phillippitts.voicenav.exception.CommandExecutionException;
import com.phillippitts.voicenav.exception.TranscriptionException;
import com.phillippitts.voicenav.exception.VoiceNavException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * A matched command failed while running (HTTP 422).
     */
    @ExceptionHandler(CommandExecutionException.class)
    ResponseEntity<ApiError> handleCommandFailure(CommandExecutionException ex) {
        LOG.warn("Command failed: command={}, reason={}", ex.getCommandName(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Command failed",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(TranscriptionException.class)
    ResponseEntity<ApiError> handleTranscriptionFailure(TranscriptionException ex) {
        LOG.error("Transcription failed: transcriber={}", ex.getTranscriberName(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Transcription service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class,
            MethodArgumentNotValidException.class,
            HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getClass().getSimpleName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex instanceof MethodArgumentNotValidException ? "text must not be blank" : ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Engine busy or otherwise unable to finish the request (HTTP 503).
     */
    @ExceptionHandler(VoiceNavException.class)
    ResponseEntity<ApiError> handleEngineUnavailable(VoiceNavException ex) {
        LOG.warn("Engine unavailable: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Voice engine unavailable",
                "Please retry in a few seconds",
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
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
