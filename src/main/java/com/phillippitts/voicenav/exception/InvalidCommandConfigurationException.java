package com.phillippitts.voicenav.exception;

/**
 * Thrown when a configured custom command or hotkey binding cannot be built.
 * Loaders catch it per entry, log it and skip the entry.
 */
public class InvalidCommandConfigurationException extends VoiceNavException {

    private final String trigger;

    public InvalidCommandConfigurationException(String trigger, String message) {
        super("Invalid command '" + trigger + "': " + message);
        this.trigger = trigger;
    }

    public String getTrigger() {
        return trigger;
    }
}
