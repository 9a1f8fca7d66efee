package com.phillippitts.voicenav.service.input;

import java.util.Optional;

/** System clipboard, text only. */
public interface ClipboardAccess {

    Optional<String> readText();

    void writeText(String text);
}
