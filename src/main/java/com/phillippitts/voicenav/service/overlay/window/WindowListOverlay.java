package com.phillippitts.voicenav.service.overlay.window;

import com.phillippitts.voicenav.domain.ScreenBounds;
import com.phillippitts.voicenav.domain.ScreenPoint;
import com.phillippitts.voicenav.service.overlay.AbstractRenderedOverlay;
import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;
import com.phillippitts.voicenav.service.overlay.OverlayKind;
import com.phillippitts.voicenav.service.overlay.ScreenGeometry;
import com.phillippitts.voicenav.service.overlay.render.OverlayFrame;
import com.phillippitts.voicenav.service.overlay.render.OverlaySurface;
import com.phillippitts.voicenav.service.overlay.render.RenderLoop;
import com.phillippitts.voicenav.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Numbered list of the open windows, one full-width entry per window stacked from the top of
 * the screen. Needs a {@link WindowLocator}; without one the overlay refuses to show.
 *
 * <p>Element positions are the entry centers; {@link #window(int)} maps a number back to the
 * window so a command can activate it.
 */
public class WindowListOverlay extends AbstractRenderedOverlay {

    private static final Logger LOG = LogManager.getLogger(WindowListOverlay.class);

    public static final String OPTION_MAX_WINDOWS = "max_windows";

    static final int LIST_TOP = 100;
    static final int ENTRY_HEIGHT = 40;
    static final int MAX_TITLE_CHARS = 77;

    private final Optional<WindowLocator> locator;
    private final ScreenGeometry screen;
    private final int defaultMaxWindows;

    private List<WindowInfo> windows = List.of();

    public WindowListOverlay(OverlayCoordinator coordinator, RenderLoop renderLoop, OverlaySurface surface,
                             Optional<WindowLocator> locator, ScreenGeometry screen, int defaultMaxWindows) {
        super(coordinator, renderLoop, surface);
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
        this.screen = screen;
        this.defaultMaxWindows = defaultMaxWindows;
    }

    @Override
    public OverlayKind kind() {
        return OverlayKind.WINDOW;
    }

    @Override
    public boolean validateBeforeShow() {
        if (locator.isEmpty()) {
            LOG.info("No window locator configured; window list unavailable");
            return false;
        }
        return screen.isUsable();
    }

    @Override
    protected void applyShow(Map<String, Object> options) {
        int max = Math.min(maxWindows(options.get(OPTION_MAX_WINDOWS)), fittingEntries());
        windows = enumerate(max);
        LOG.info("Window list shown ({} windows)", windows.size());
    }

    @Override
    protected void applyHide() {
        windows = List.of();
    }

    @Override
    public Optional<ScreenPoint> elementPosition(int number) {
        return read(() -> number >= 1 && number <= windows.size()
                ? Optional.of(entry(number - 1).center())
                : Optional.<ScreenPoint>empty());
    }

    /** Window listed under {@code number}, while the list is shown. */
    public Optional<WindowInfo> window(int number) {
        return read(() -> number >= 1 && number <= windows.size()
                ? Optional.of(windows.get(number - 1))
                : Optional.<WindowInfo>empty());
    }

    public List<WindowInfo> getWindows() {
        return read(() -> windows);
    }

    public void activate(WindowInfo window) throws IOException {
        locator.orElseThrow(() -> new IOException("no window locator configured")).activate(window);
    }

    @Override
    protected OverlayFrame currentFrame() {
        List<OverlayFrame.Label> labels = new ArrayList<>(windows.size());
        for (int i = 0; i < windows.size(); i++) {
            labels.add(new OverlayFrame.Label(i + 1, entry(i),
                    LogSanitizer.abbreviate(windows.get(i).title(), MAX_TITLE_CHARS)));
        }
        List<String> lines = windows.isEmpty()
                ? List.of("Select Window", "No windows found")
                : List.of("Select Window", "Say 'switch window <number>' to select");
        return new OverlayFrame("windows", screen.bounds().orElseThrow(), labels, lines);
    }

    private ScreenBounds entry(int index) {
        double margin = Math.min(50, screen.getWidth() / 4.0);
        return new ScreenBounds(margin, LIST_TOP + (double) index * ENTRY_HEIGHT,
                screen.getWidth() - 2 * margin, ENTRY_HEIGHT);
    }

    private int fittingEntries() {
        return Math.max(0, (screen.getHeight() - LIST_TOP) / ENTRY_HEIGHT);
    }

    private List<WindowInfo> enumerate(int max) {
        if (max <= 0) {
            return List.of();
        }
        try {
            List<WindowInfo> found = locator.orElseThrow().listWindows(max);
            if (found == null) {
                return List.of();
            }
            return List.copyOf(found.size() > max ? found.subList(0, max) : found);
        } catch (RuntimeException e) {
            LOG.warn("Window enumeration failed: {}", e.toString());
            return List.of();
        }
    }

    private int maxWindows(Object option) {
        if (option instanceof Number n && n.intValue() > 0) {
            return n.intValue();
        }
        return defaultMaxWindows;
    }
}
