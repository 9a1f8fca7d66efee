package com.phillippitts.voicenav.domain;

/**
 * Axis-aligned screen rectangle in pixels. Fractional values are kept so that
 * repeated subdivision does not accumulate truncation error.
 */
public record ScreenBounds(double x, double y, double width, double height) {

    public ScreenBounds {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("bounds must have positive size: " + width + "x" + height);
        }
    }

    public static ScreenBounds screen(int width, int height) {
        return new ScreenBounds(0, 0, width, height);
    }

    public ScreenPoint center() {
        return ScreenPoint.rounded(x + width / 2.0, y + height / 2.0);
    }

    public boolean contains(ScreenBounds other) {
        return other.x >= x && other.y >= y
                && other.x + other.width <= x + width + 1e-9
                && other.y + other.height <= y + height + 1e-9;
    }

    public boolean contains(ScreenPoint p) {
        return p.x() >= x && p.y() >= y && p.x() <= x + width && p.y() <= y + height;
    }
}
