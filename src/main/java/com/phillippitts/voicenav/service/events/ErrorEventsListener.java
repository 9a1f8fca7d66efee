package com.phillippitts.voicenav.service.events;

import com.phillippitts.voicenav.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.voicenav.service.hotkey.event.HotkeyPermissionDeniedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing hotkey error events. Throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onHotkeyPermissionDenied(HotkeyPermissionDeniedEvent e) {
        if (shouldLog("hotkey-permission")) {
            LOG.warn("Hotkeys disabled ({}). On macOS grant Accessibility: "
                    + "System Settings > Privacy & Security > Accessibility (then restart app)", e.reason());
        }
    }

    @EventListener
    void onHotkeyConflict(HotkeyConflictEvent e) {
        String key = "hotkey-conflict-" + e.binding() + '-' + e.combination();
        if (shouldLog(key)) {
            LOG.warn("Hotkey '{}' conflicts with OS-reserved shortcut {}. Update hotkeys.bindings.",
                    e.binding(), e.combination());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
