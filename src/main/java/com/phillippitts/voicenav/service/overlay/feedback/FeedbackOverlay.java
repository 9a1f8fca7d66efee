package com.phillippitts.voicenav.service.overlay.feedback;

import com.phillippitts.voicenav.domain.ScreenBounds;
import com.phillippitts.voicenav.service.overlay.ScreenGeometry;
import com.phillippitts.voicenav.service.overlay.render.OverlayFrame;
import com.phillippitts.voicenav.service.overlay.render.OverlaySurface;
import com.phillippitts.voicenav.service.overlay.render.RenderLoop;
import com.phillippitts.voicenav.util.LogSanitizer;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Transient banner naming the command that just ran. It is independent of the
 * coordinated overlays: it can appear on top of the grid and never counts as the visible one.
 * Each message auto-hides after the configured duration unless a newer one replaced it.
 */
public class FeedbackOverlay implements AutoCloseable {

    static final int MAX_CHARS = 80;

    private final RenderLoop renderLoop;
    private final OverlaySurface surface;
    private final ScreenGeometry screen;
    private final long durationMs;
    private final AtomicLong sequence = new AtomicLong();
    private final ScheduledExecutorService hideTimer;
    private volatile boolean closed;

    public FeedbackOverlay(RenderLoop renderLoop, OverlaySurface surface, ScreenGeometry screen, long durationMs) {
        this.renderLoop = renderLoop;
        this.surface = surface;
        this.screen = screen;
        this.durationMs = durationMs;
        this.hideTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "feedback-hide");
            t.setDaemon(true);
            return t;
        });
    }

    public void show(String text) {
        if (closed || !screen.isUsable() || text == null || text.isBlank()) {
            return;
        }
        long id = sequence.incrementAndGet();
        String shown = LogSanitizer.abbreviate(text.trim(), MAX_CHARS);
        renderLoop.submit(() -> surface.draw(frame(shown)));
        hideTimer.schedule(() -> {
            if (sequence.get() == id) {
                renderLoop.submit(surface::clear);
            }
        }, durationMs, TimeUnit.MILLISECONDS);
    }

    public void hide() {
        sequence.incrementAndGet();
        renderLoop.submit(surface::clear);
    }

    public RenderLoop getRenderLoop() {
        return renderLoop;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        hideTimer.shutdownNow();
        renderLoop.runLast(() -> {
            surface.clear();
            surface.dispose();
        });
    }

    private OverlayFrame frame(String text) {
        double w = Math.min(600, screen.getWidth());
        double h = Math.min(60, screen.getHeight());
        ScreenBounds area = new ScreenBounds((screen.getWidth() - w) / 2, screen.getHeight() - h - 80 > 0
                ? screen.getHeight() - h - 80 : 0, w, h);
        return new OverlayFrame("feedback", area, List.of(), List.of(text));
    }
}
