package com.phillippitts.voicenav.service.input;

import java.awt.event.KeyEvent;
import java.util.Locale;

/** Platform-dependent modifier keys for editing and window shortcuts. */
public final class ShortcutKeys {

    private ShortcutKeys() {
    }

    static boolean isMac() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("mac");
    }

    /** Command on macOS, Control elsewhere: the modifier of copy/paste/undo. */
    public static int primaryModifier() {
        return isMac() ? KeyEvent.VK_META : KeyEvent.VK_CONTROL;
    }

    /** Key held for window management: Command on macOS, the Windows key elsewhere. */
    public static int windowModifier() {
        return isMac() ? KeyEvent.VK_META : KeyEvent.VK_WINDOWS;
    }
}
