package com.phillippitts.voicenav.exception;

/**
 * Thrown when the speech-to-text collaborator fails to turn audio into text.
 * Failures are not retried.
 */
public class TranscriptionException extends VoiceNavException {

    private final String transcriberName;

    public TranscriptionException(String message) {
        super(message);
        this.transcriberName = "unknown";
    }

    public TranscriptionException(String message, String transcriberName, Throwable cause) {
        super(message + " (transcriber: " + transcriberName + ")", cause);
        this.transcriberName = transcriberName;
    }

    public String getTranscriberName() {
        return transcriberName;
    }
}
