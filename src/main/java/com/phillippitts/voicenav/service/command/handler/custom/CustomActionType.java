package com.phillippitts.voicenav.service.command.handler.custom;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** What a custom command does when its trigger is spoken. */
public enum CustomActionType {
    TYPE_TEXT,
    COPY_TO_CLIPBOARD,
    EXECUTE_FILE,
    KEY_COMBINATION;

    /** Accepts {@code type-text}, {@code type_text} and {@code TYPE_TEXT}. */
    public static Optional<CustomActionType> fromConfig(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String n = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values()).filter(t -> t.name().equals(n)).findFirst();
    }
}
