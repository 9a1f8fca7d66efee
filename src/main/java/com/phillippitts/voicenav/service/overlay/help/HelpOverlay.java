package com.phillippitts.voicenav.service.overlay.help;

import com.phillippitts.voicenav.domain.ScreenBounds;
import com.phillippitts.voicenav.service.overlay.AbstractRenderedOverlay;
import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;
import com.phillippitts.voicenav.service.overlay.OverlayKind;
import com.phillippitts.voicenav.service.overlay.ScreenGeometry;
import com.phillippitts.voicenav.service.overlay.render.OverlayFrame;
import com.phillippitts.voicenav.service.overlay.render.OverlaySurface;
import com.phillippitts.voicenav.service.overlay.render.RenderLoop;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/** Centered panel listing the available commands. Has no numbered elements. */
public class HelpOverlay extends AbstractRenderedOverlay {

    private final Supplier<String> helpText;
    private final ScreenGeometry screen;

    private List<String> lines = List.of();

    public HelpOverlay(OverlayCoordinator coordinator, RenderLoop renderLoop, OverlaySurface surface,
                       Supplier<String> helpText, ScreenGeometry screen) {
        super(coordinator, renderLoop, surface);
        this.helpText = helpText;
        this.screen = screen;
    }

    @Override
    public OverlayKind kind() {
        return OverlayKind.HELP;
    }

    @Override
    public boolean validateBeforeShow() {
        return screen.isUsable();
    }

    @Override
    protected void applyShow(Map<String, Object> options) {
        lines = List.of(helpText.get().split("\n", -1));
    }

    @Override
    protected void applyHide() {
        lines = List.of();
    }

    public List<String> getLines() {
        return read(() -> lines);
    }

    @Override
    protected OverlayFrame currentFrame() {
        double w = screen.getWidth() * 0.6;
        double h = screen.getHeight() * 0.8;
        ScreenBounds panel = new ScreenBounds((screen.getWidth() - w) / 2, (screen.getHeight() - h) / 2, w, h);
        return new OverlayFrame("help", panel, List.of(), lines);
    }
}
