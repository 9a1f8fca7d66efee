package com.phillippitts.voicenav.service.input;

import com.phillippitts.voicenav.domain.ScreenPoint;

/**
 * Low-level pointer injection.
 */
public interface MouseActions {

    ScreenPoint position();

    void moveTo(int x, int y);

    default void moveTo(ScreenPoint p) {
        moveTo(p.x(), p.y());
    }

    void click(MouseButton button, int count);

    void press(MouseButton button);

    void release(MouseButton button);

    /**
     * Scrolls by wheel notches. Positive {@code dy} scrolls down, positive {@code dx} scrolls right.
     */
    void scroll(int dx, int dy);

    /** Waits between steps of a gesture so the OS registers each one. */
    void pause(int millis);
}
