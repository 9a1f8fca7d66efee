package com.phillippitts.voicenav.presentation.exception;

import com.phillippitts.voicenav.exception.CommandExecutionException;
import com.phillippitts.voicenav.exception.TranscriptionException;
import com.phillippitts.voicenav.exception.VoiceNavException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void commandFailureReturns422() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleCommandFailure(new CommandExecutionException("ClickNumberCommand", "element 7 not found"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("CommandExecutionException");
        assertThat(response.getBody().message()).isEqualTo("Command failed");
    }

    @Test
    void transcriptionFailureHidesDetails() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleTranscriptionFailure(
                new TranscriptionException("model crashed at /secret/path", "vosk", new RuntimeException()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).doesNotContain("/secret/path");
        assertThat(response.getBody().details()).isEqualTo("Please retry in a few seconds");
    }

    @Test
    void illegalArgumentReturns400WithMessage() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleBadRequest(new IllegalArgumentException("text must not be blank"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().details()).isEqualTo("text must not be blank");
    }

    @Test
    void engineFailureReturns503() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleEngineUnavailable(new VoiceNavException("Utterance timed out"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().message()).isEqualTo("Voice engine unavailable");
    }

    @Test
    void unexpectedErrorReturns500WithTimestamp() {
        Instant before = Instant.now().minusSeconds(1);

        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("internal detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().details()).doesNotContain("internal detail");
        assertThat(response.getBody().timestamp()).isAfter(before);
    }
}
