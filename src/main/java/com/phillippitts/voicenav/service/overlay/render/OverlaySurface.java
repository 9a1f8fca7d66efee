package com.phillippitts.voicenav.service.overlay.render;

/**
 * Drawing target for an overlay. Called only from the overlay's {@link RenderLoop} thread.
 */
public interface OverlaySurface {

    void draw(OverlayFrame frame);

    void clear();

    /** Releases native resources. */
    default void dispose() {
    }
}
