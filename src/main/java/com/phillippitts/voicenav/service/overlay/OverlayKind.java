package com.phillippitts.voicenav.service.overlay;

import java.util.Locale;

/** Overlays managed by the {@link OverlayCoordinator}. At most one is visible at a time. */
public enum OverlayKind {
    GRID,
    ELEMENT,
    WINDOW,
    HELP;

    /** Lowercase name used in event payloads and logs. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
