package com.phillippitts.voicenav.service.pipeline;

import com.phillippitts.voicenav.exception.TranscriptionException;

/**
 * Speech-to-text collaborator. Implementations live outside this application and are picked
 * up when present as a bean.
 */
@FunctionalInterface
public interface SpeechTranscriber {

    /**
     * @param pcm 16 kHz, 16-bit little-endian mono PCM
     * @return recognized text, possibly empty
     * @throws TranscriptionException if recognition fails
     */
    String transcribe(byte[] pcm);

    default String name() {
        return getClass().getSimpleName();
    }
}
