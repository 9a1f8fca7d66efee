package com.phillippitts.voicenav.service.text;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Editing actions triggered by command words instead of being typed. */
public enum CommandAction {
    /** Erase the previously typed text. */
    UNDO_LAST,
    /** Select the current line and delete it. */
    CLEAR_LINE;

    /** Accepts the configuration form, e.g. {@code undo_last}. */
    public static Optional<CommandAction> fromConfig(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String n = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values()).filter(a -> a.name().equals(n)).findFirst();
    }
}
