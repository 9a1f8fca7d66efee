package com.phillippitts.voicenav.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Overlay rendering and layout settings.
 */
@Validated
@ConfigurationProperties(prefix = "overlay")
public class OverlayProperties {

    /** Cells per side of the numbered grid. */
    @Min(2)
    @Max(12)
    private final int gridSize;

    /** swing draws translucent always-on-top windows; logging only logs frames (headless). */
    @Pattern(regexp = "swing|logging")
    private final String renderer;

    /** 0 detects the screen size. */
    @Min(0)
    private final int screenWidth;

    @Min(0)
    private final int screenHeight;

    private final boolean feedbackEnabled;

    @Min(100)
    private final long feedbackDurationMs;

    @Min(1)
    private final int elementMaxElements;

    @Min(2)
    @Max(12)
    private final int elementFallbackGridSize;

    @Min(1)
    private final int windowMaxWindows;

    /** none, or wmctrl to list windows through the wmctrl tool (X11). */
    @Pattern(regexp = "none|wmctrl")
    private final String windowLocator;

    @ConstructorBinding
    public OverlayProperties(Integer gridSize,
                             String renderer,
                             Integer screenWidth,
                             Integer screenHeight,
                             Boolean feedbackEnabled,
                             Long feedbackDurationMs,
                             Integer elementMaxElements,
                             Integer elementFallbackGridSize,
                             Integer windowMaxWindows,
                             String windowLocator) {
        this.gridSize = gridSize == null ? 9 : gridSize;
        this.renderer = renderer == null ? "swing" : renderer;
        this.screenWidth = screenWidth == null ? 0 : screenWidth;
        this.screenHeight = screenHeight == null ? 0 : screenHeight;
        this.feedbackEnabled = feedbackEnabled == null || feedbackEnabled;
        this.feedbackDurationMs = feedbackDurationMs == null ? 1500L : feedbackDurationMs;
        this.elementMaxElements = elementMaxElements == null ? 50 : elementMaxElements;
        this.elementFallbackGridSize = elementFallbackGridSize == null ? 5 : elementFallbackGridSize;
        this.windowMaxWindows = windowMaxWindows == null ? 20 : windowMaxWindows;
        this.windowLocator = windowLocator == null ? "none" : windowLocator;
    }

    public int getGridSize() {
        return gridSize;
    }

    public String getRenderer() {
        return renderer;
    }

    public boolean isSwingRenderer() {
        return "swing".equals(renderer);
    }

    public int getScreenWidth() {
        return screenWidth;
    }

    public int getScreenHeight() {
        return screenHeight;
    }

    public boolean isFeedbackEnabled() {
        return feedbackEnabled;
    }

    public long getFeedbackDurationMs() {
        return feedbackDurationMs;
    }

    public int getElementMaxElements() {
        return elementMaxElements;
    }

    public int getElementFallbackGridSize() {
        return elementFallbackGridSize;
    }

    public int getWindowMaxWindows() {
        return windowMaxWindows;
    }

    public String getWindowLocator() {
        return windowLocator;
    }
}
