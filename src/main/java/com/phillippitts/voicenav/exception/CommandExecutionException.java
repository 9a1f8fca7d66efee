package com.phillippitts.voicenav.exception;

/**
 * Thrown when a matched command fails while performing its action.
 * The message is prefixed with the command name so logs identify the failing handler.
 */
public class CommandExecutionException extends VoiceNavException {

    private final String commandName;
    private final String reason;

    public CommandExecutionException(String commandName, String reason) {
        super(commandName + ": " + reason);
        this.commandName = commandName;
        this.reason = reason;
    }

    public CommandExecutionException(String commandName, String reason, Throwable cause) {
        super(commandName + ": " + reason, cause);
        this.commandName = commandName;
        this.reason = reason;
    }

    public String getCommandName() {
        return commandName;
    }

    /** The failure description without the command-name prefix. */
    public String getReason() {
        return reason;
    }
}
