package com.phillippitts.voicenav.service.overlay.window;

import java.util.Objects;

/** A top-level window as reported by a {@link WindowLocator}. {@code id} is locator-specific. */
public record WindowInfo(String id, String title) {

    public WindowInfo {
        Objects.requireNonNull(id, "id must not be null");
        title = title == null || title.isBlank() ? "Unknown" : title.trim();
    }
}
