package com.phillippitts.voicenav.service.overlay;

import com.phillippitts.voicenav.domain.ScreenBounds;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.Dimension;
import java.awt.GraphicsEnvironment;
import java.awt.HeadlessException;
import java.awt.Toolkit;
import java.util.Optional;

/**
 * Primary screen size used by overlays and pointer commands.
 */
public final class ScreenGeometry {
    private static final Logger LOG = LogManager.getLogger(ScreenGeometry.class);

    static final int FALLBACK_WIDTH = 1920;
    static final int FALLBACK_HEIGHT = 1080;

    private final int width;
    private final int height;

    private ScreenGeometry(int width, int height) {
        this.width = width;
        this.height = height;
    }

    /** Uses the given size as is; a non-positive dimension makes the screen unusable. */
    public static ScreenGeometry fixed(int width, int height) {
        return new ScreenGeometry(width, height);
    }

    /**
     * Uses the configured size when both dimensions are positive, otherwise asks AWT,
     * falling back to 1920x1080 when no display is available.
     */
    public static ScreenGeometry detect(int configuredWidth, int configuredHeight) {
        if (configuredWidth > 0 && configuredHeight > 0) {
            return new ScreenGeometry(configuredWidth, configuredHeight);
        }
        if (!GraphicsEnvironment.isHeadless()) {
            try {
                Dimension d = Toolkit.getDefaultToolkit().getScreenSize();
                LOG.info("Detected screen size {}x{}", d.width, d.height);
                return new ScreenGeometry(d.width, d.height);
            } catch (HeadlessException e) {
                LOG.debug("No display: {}", e.toString());
            }
        }
        LOG.info("Screen size unavailable; assuming {}x{}", FALLBACK_WIDTH, FALLBACK_HEIGHT);
        return new ScreenGeometry(FALLBACK_WIDTH, FALLBACK_HEIGHT);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isUsable() {
        return width > 0 && height > 0;
    }

    public Optional<ScreenBounds> bounds() {
        return isUsable() ? Optional.of(ScreenBounds.screen(width, height)) : Optional.empty();
    }
}
