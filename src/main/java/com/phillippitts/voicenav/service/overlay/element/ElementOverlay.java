package com.phillippitts.voicenav.service.overlay.element;

import com.phillippitts.voicenav.domain.ScreenBounds;
import com.phillippitts.voicenav.domain.ScreenPoint;
import com.phillippitts.voicenav.service.overlay.AbstractRenderedOverlay;
import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;
import com.phillippitts.voicenav.service.overlay.OverlayKind;
import com.phillippitts.voicenav.service.overlay.ScreenGeometry;
import com.phillippitts.voicenav.service.overlay.grid.GridState;
import com.phillippitts.voicenav.service.overlay.render.OverlayFrame;
import com.phillippitts.voicenav.service.overlay.render.OverlaySurface;
import com.phillippitts.voicenav.service.overlay.render.RenderLoop;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Numbers the clickable elements of the foreground window. Without an {@link ElementLocator},
 * or when it finds nothing, a coarse grid is numbered instead so "numbers" always gives the
 * user something to address.
 */
public class ElementOverlay extends AbstractRenderedOverlay {

    private static final Logger LOG = LogManager.getLogger(ElementOverlay.class);

    private final Optional<ElementLocator> locator;
    private final ScreenGeometry screen;
    private final int maxElements;
    private final int fallbackGridSize;

    private List<ScreenBounds> elements = List.of();
    private boolean fallback;

    public ElementOverlay(OverlayCoordinator coordinator, RenderLoop renderLoop, OverlaySurface surface,
                          Optional<ElementLocator> locator, ScreenGeometry screen,
                          int maxElements, int fallbackGridSize) {
        super(coordinator, renderLoop, surface);
        this.locator = locator;
        this.screen = screen;
        this.maxElements = maxElements;
        this.fallbackGridSize = fallbackGridSize;
    }

    @Override
    public OverlayKind kind() {
        return OverlayKind.ELEMENT;
    }

    @Override
    public boolean validateBeforeShow() {
        return screen.isUsable();
    }

    @Override
    protected void applyShow(Map<String, Object> options) {
        List<ScreenBounds> found = locate();
        if (found.isEmpty()) {
            elements = fallbackCells();
            fallback = true;
            LOG.info("No UI elements located; numbering a {}x{} grid", fallbackGridSize, fallbackGridSize);
        } else {
            elements = found;
            fallback = false;
            LOG.info("Numbered {} UI elements", found.size());
        }
    }

    @Override
    protected void applyHide() {
        elements = List.of();
        fallback = false;
    }

    @Override
    public Optional<ScreenPoint> elementPosition(int number) {
        return read(() -> number >= 1 && number <= elements.size()
                ? Optional.of(elements.get(number - 1).center())
                : Optional.<ScreenPoint>empty());
    }

    public boolean isFallback() {
        return read(() -> fallback);
    }

    public int getElementCount() {
        return read(() -> elements.size());
    }

    @Override
    protected OverlayFrame currentFrame() {
        List<OverlayFrame.Label> labels = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            labels.add(new OverlayFrame.Label(i + 1, elements.get(i)));
        }
        return new OverlayFrame("elements", screen.bounds().orElseThrow(), labels, List.of());
    }

    private List<ScreenBounds> locate() {
        if (locator.isEmpty()) {
            return List.of();
        }
        try {
            List<ScreenBounds> found = locator.get().locateClickableElements(maxElements);
            if (found == null) {
                return List.of();
            }
            return List.copyOf(found.size() > maxElements ? found.subList(0, maxElements) : found);
        } catch (RuntimeException e) {
            LOG.warn("Element location failed: {}", e.toString());
            return List.of();
        }
    }

    private List<ScreenBounds> fallbackCells() {
        GridState grid = GridState.unshown().show(screen.bounds().orElseThrow(), fallbackGridSize);
        List<ScreenBounds> cells = new ArrayList<>(grid.cellCount());
        for (int n = 1; n <= grid.cellCount(); n++) {
            grid.cellBounds(n).ifPresent(cells::add);
        }
        return List.copyOf(cells);
    }
}
