package com.phillippitts.voicenav.service.events;

/** Kinds of events published on the {@link EventBus}. */
public enum EventType {
    COMMAND_DETECTED,
    COMMAND_EXECUTED,
    COMMAND_FAILED,
    OVERLAY_SHOWN,
    OVERLAY_HIDDEN,
    TEXT_PROCESSED,
    TEXT_TYPED,
    TRANSCRIPTION_COMPLETED,
    TRANSCRIPTION_FAILED,
    ERROR_OCCURRED
}
