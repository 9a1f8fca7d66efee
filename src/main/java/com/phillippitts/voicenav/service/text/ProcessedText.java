package com.phillippitts.voicenav.service.text;

import java.util.Optional;

/**
 * Outcome of {@link TextProcessor#process}: either cleaned-up text or a command action, never
 * both.
 */
public record ProcessedText(String text, CommandAction action) {

    public static ProcessedText ofText(String text) {
        return new ProcessedText(text, null);
    }

    public static ProcessedText ofAction(CommandAction action) {
        return new ProcessedText(null, action);
    }

    public static ProcessedText empty() {
        return new ProcessedText(null, null);
    }

    public Optional<String> textValue() {
        return Optional.ofNullable(text);
    }

    public Optional<CommandAction> commandAction() {
        return Optional.ofNullable(action);
    }

    public boolean isCommand() {
        return action != null;
    }
}
