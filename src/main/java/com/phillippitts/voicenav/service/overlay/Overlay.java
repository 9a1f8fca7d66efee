package com.phillippitts.voicenav.service.overlay;

import com.phillippitts.voicenav.domain.ScreenPoint;

import java.util.Map;
import java.util.Optional;

/**
 * A screen overlay. Implementations update their logical state synchronously and hand the
 * drawing to their own render queue, so {@link #show} and {@link #hide} return quickly.
 *
 * <p>Callers go through {@link OverlayCoordinator}, which enforces that only one overlay is
 * visible and runs the lifecycle hooks in order: {@code validateBeforeShow}, {@code show},
 * {@code onShow}; and {@code hide}, {@code onHide}.
 */
public interface Overlay {

    OverlayKind kind();

    void show(Map<String, Object> options);

    void hide();

    boolean isVisible();

    /** Screen position of a numbered element according to this overlay's logical state. */
    default Optional<ScreenPoint> elementPosition(int number) {
        return Optional.empty();
    }

    /** @return false to veto a show request, e.g. when the screen size is unknown */
    default boolean validateBeforeShow() {
        return true;
    }

    default void onShow() {
    }

    default void onHide() {
    }
}
