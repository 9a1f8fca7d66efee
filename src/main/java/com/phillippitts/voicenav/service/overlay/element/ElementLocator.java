package com.phillippitts.voicenav.service.overlay.element;

import com.phillippitts.voicenav.domain.ScreenBounds;

import java.util.List;

/**
 * Finds clickable UI elements of the foreground window (accessibility APIs, UI automation).
 * Supplied by platform integrations; absent by default.
 */
@FunctionalInterface
public interface ElementLocator {

    /** @return element rectangles in reading order, at most {@code maxElements} */
    List<ScreenBounds> locateClickableElements(int maxElements);
}
