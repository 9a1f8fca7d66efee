package com.phillippitts.voicenav.service.typing;

import com.phillippitts.voicenav.service.input.KeyboardActions;
import com.phillippitts.voicenav.service.input.ShortcutKeys;

import java.awt.event.KeyEvent;

/** Sends the paste chord selected by {@code typing.paste-shortcut}. */
final class PasteShortcut {

    private PasteShortcut() {}

    static int modifier(String mode) {
        if ("META+V".equalsIgnoreCase(mode)) {
            return KeyEvent.VK_META;
        }
        if ("CONTROL+V".equalsIgnoreCase(mode)) {
            return KeyEvent.VK_CONTROL;
        }
        return ShortcutKeys.primaryModifier();
    }

    static void send(KeyboardActions keyboard, String mode) {
        keyboard.combination(modifier(mode), KeyEvent.VK_V);
    }
}
