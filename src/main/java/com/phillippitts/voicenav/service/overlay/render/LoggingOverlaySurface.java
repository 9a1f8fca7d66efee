package com.phillippitts.voicenav.service.overlay.render;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/** Headless surface: records the last frame and logs what would be drawn. */
public class LoggingOverlaySurface implements OverlaySurface {
    private static final Logger LOG = LogManager.getLogger(LoggingOverlaySurface.class);

    private final String name;
    private final AtomicReference<OverlayFrame> lastFrame = new AtomicReference<>();
    private final AtomicBoolean disposed = new AtomicBoolean();

    public LoggingOverlaySurface(String name) {
        this.name = name;
    }

    @Override
    public void draw(OverlayFrame frame) {
        lastFrame.set(frame);
        LOG.debug("[{}] draw '{}' area={} labels={} lines={}", name, frame.title(), frame.area(),
                frame.labels().size(), frame.lines().size());
    }

    @Override
    public void clear() {
        lastFrame.set(null);
        LOG.debug("[{}] clear", name);
    }

    @Override
    public void dispose() {
        lastFrame.set(null);
        disposed.set(true);
        LOG.debug("[{}] dispose", name);
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    /** Frame currently "on screen", or null after a clear. */
    public OverlayFrame getLastFrame() {
        return lastFrame.get();
    }
}
