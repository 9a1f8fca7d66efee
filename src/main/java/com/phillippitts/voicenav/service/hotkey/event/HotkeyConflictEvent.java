package com.phillippitts.voicenav.service.hotkey.event;

import java.time.Instant;

/**
 * Published when a configured hotkey conflicts with an OS-reserved shortcut
 * (e.g., Cmd+Tab on macOS, Win+L on Windows).
 */
public record HotkeyConflictEvent(String binding, String combination, Instant at) { }
