package com.phillippitts.voicenav.service.hotkey;

import java.util.function.Consumer;

/**
 * Abstraction over a global keyboard hook (e.g., JNativeHook).
 *
 * Provides a test seam so unit tests can inject a fake implementation
 * and remain hermetic (no OS-level hooks required in CI).
 */
public interface GlobalKeyHook {

    /**
     * Register the global hook. Idempotent.
     *
     * @throws SecurityException if the OS refuses the hook (missing permission, headless)
     */
    void register();

    /** Unregister the global hook. Idempotent. */
    void unregister();

    /** Subscribe to normalized key events. */
    void addListener(Consumer<NormalizedKeyEvent> listener);
}
