package com.phillippitts.voicenav.service.overlay.grid;

import com.phillippitts.voicenav.domain.ScreenBounds;
import com.phillippitts.voicenav.domain.ScreenPoint;
import com.phillippitts.voicenav.service.overlay.AbstractRenderedOverlay;
import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;
import com.phillippitts.voicenav.service.overlay.OverlayKind;
import com.phillippitts.voicenav.service.overlay.RefinableOverlay;
import com.phillippitts.voicenav.service.overlay.ScreenGeometry;
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
 * Numbered grid covering the screen. Saying a number addresses a cell; "refine N" zooms into
 * cell N with a 3x3 subdivision. The logical {@link GridState} is updated synchronously so
 * lookups right after a show or refine see the new cells even before the redraw completes.
 */
public class GridOverlay extends AbstractRenderedOverlay implements RefinableOverlay {

    private static final Logger LOG = LogManager.getLogger(GridOverlay.class);

    /** Show option: cells per side. */
    public static final String OPTION_GRID_SIZE = "grid_size";

    private final ScreenGeometry screen;
    private final int defaultSize;

    private GridState state = GridState.unshown();

    public GridOverlay(OverlayCoordinator coordinator, RenderLoop renderLoop, OverlaySurface surface,
                       ScreenGeometry screen, int defaultSize) {
        super(coordinator, renderLoop, surface);
        this.screen = screen;
        this.defaultSize = defaultSize;
    }

    @Override
    public OverlayKind kind() {
        return OverlayKind.GRID;
    }

    @Override
    public boolean validateBeforeShow() {
        if (!screen.isUsable()) {
            LOG.warn("Invalid screen dimensions: {}x{}", screen.getWidth(), screen.getHeight());
            return false;
        }
        return true;
    }

    @Override
    protected void applyShow(Map<String, Object> options) {
        int size = gridSize(options.get(OPTION_GRID_SIZE));
        ScreenBounds bounds = screen.bounds()
                .orElseThrow(() -> new IllegalStateException("screen size unknown"));
        state = state.show(bounds, size);
        LOG.debug("Grid shown: {}", state);
    }

    @Override
    protected void applyHide() {
        state = state.hide();
    }

    @Override
    public boolean refine(int cell) {
        return change(() -> {
            Optional<GridState> next = state.refine(cell);
            if (next.isEmpty()) {
                LOG.info("Invalid refine cell {} for {}", cell, state);
                return false;
            }
            state = next.get();
            LOG.debug("Grid refined: {}", state);
            return true;
        });
    }

    @Override
    public Optional<ScreenPoint> elementPosition(int number) {
        return read(() -> state.elementPosition(number));
    }

    public GridState getState() {
        return read(() -> state);
    }

    @Override
    protected OverlayFrame currentFrame() {
        GridState s = state;
        ScreenBounds area = s.getBounds().orElseThrow();
        List<OverlayFrame.Label> labels = new ArrayList<>(s.cellCount());
        for (int n = 1; n <= s.cellCount(); n++) {
            int cell = n;
            s.cellBounds(n).ifPresent(b -> labels.add(new OverlayFrame.Label(cell, b)));
        }
        String title = s.isRefined() ? "grid (refined " + s.getRefinedCell().getAsInt() + ")" : "grid";
        return new OverlayFrame(title, area, labels, List.of());
    }

    private int gridSize(Object option) {
        if (option instanceof Number n && n.intValue() > 0) {
            return n.intValue();
        }
        if (option instanceof String s && !s.isBlank()) {
            try {
                int v = Integer.parseInt(s.trim());
                if (v > 0) {
                    return v;
                }
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric grid size '{}'", s);
            }
        }
        return defaultSize;
    }
}
