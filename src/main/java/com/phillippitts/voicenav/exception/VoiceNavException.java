package com.phillippitts.voicenav.exception;

/**
 * Base exception for all voiceNav application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class VoiceNavException extends RuntimeException {

    public VoiceNavException(String message) {
        super(message);
    }

    public VoiceNavException(String message, Throwable cause) {
        super(message, cause);
    }
}
