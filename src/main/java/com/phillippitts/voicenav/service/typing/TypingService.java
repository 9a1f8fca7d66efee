package com.phillippitts.voicenav.service.typing;

/**
 * Delivers literal text (a command's result or dictated text) into the focused application
 * using a strategy chain with graceful fallbacks (keystroke paste, clipboard, notify-only).
 */
public interface TypingService {
    /**
     * Attempts to type the given text using the best available strategy.
     * Implementations must be privacy-safe in logs and avoid leaking full text at INFO.
     *
     * @return true if any tier succeeded
     */
    boolean type(String text);
}
