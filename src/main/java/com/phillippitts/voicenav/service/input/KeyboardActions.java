package com.phillippitts.voicenav.service.input;

/**
 * Low-level keyboard injection. Key codes are {@link java.awt.event.KeyEvent} {@code VK_*} constants.
 */
public interface KeyboardActions {

    void press(int keyCode);

    void release(int keyCode);

    default void tap(int keyCode) {
        press(keyCode);
        release(keyCode);
    }

    /**
     * Presses the keys in order and releases them in reverse, e.g. {@code combination(VK_CONTROL, VK_C)}.
     */
    default void combination(int... keyCodes) {
        for (int k : keyCodes) {
            press(k);
        }
        for (int i = keyCodes.length - 1; i >= 0; i--) {
            release(keyCodes[i]);
        }
    }
}
