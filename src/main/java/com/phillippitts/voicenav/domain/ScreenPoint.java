package com.phillippitts.voicenav.domain;

/**
 * A pixel coordinate on the primary screen.
 */
public record ScreenPoint(int x, int y) {

    /** Rounds fractional coordinates to the nearest whole pixel. */
    public static ScreenPoint rounded(double x, double y) {
        return new ScreenPoint((int) Math.round(x), (int) Math.round(y));
    }
}
