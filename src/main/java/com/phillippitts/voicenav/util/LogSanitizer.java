package com.phillippitts.voicenav.util;

/** Utility for privacy-safe previews of spoken text in logs and on screen. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Like {@link #truncate} but marks the cut with "...": the first {@code max} characters
     * followed by the ellipsis when the input is longer.
     */
    public static String abbreviate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
