package com.phillippitts.voicenav.service.input;

import java.awt.event.InputEvent;

public enum MouseButton {
    LEFT(InputEvent.BUTTON1_DOWN_MASK),
    MIDDLE(InputEvent.BUTTON2_DOWN_MASK),
    RIGHT(InputEvent.BUTTON3_DOWN_MASK);

    private final int mask;

    MouseButton(int mask) {
        this.mask = mask;
    }

    public int mask() {
        return mask;
    }
}
