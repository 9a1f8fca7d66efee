package com.phillippitts.voicenav.service.overlay.window;

import java.io.IOException;
import java.util.List;

/**
 * Lists and activates the desktop's top-level windows (window manager tools, platform APIs).
 * Supplied by platform integrations; absent by default.
 */
public interface WindowLocator {

    /** @return visible titled windows in stacking order, at most {@code maxWindows} */
    List<WindowInfo> listWindows(int maxWindows);

    /** Raises and focuses the window. */
    void activate(WindowInfo window) throws IOException;
}
