package com.phillippitts.voicenav.service.hotkey;

import java.awt.event.KeyEvent;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonicalizes key and modifier names from configuration and native hooks, and maps them to
 * {@link KeyEvent} codes for injection.
 */
public final class KeyNameMapper {

    private static final Set<String> MODIFIERS = Set.of("META", "SHIFT", "CONTROL", "ALT");

    private static final Map<String, String> ALIASES = Map.of(
            "CMD", "META",
            "COMMAND", "META",
            "WIN", "WINDOWS",
            "SUPER", "WINDOWS",
            "CTRL", "CONTROL",
            "OPTION", "ALT",
            "ESC", "ESCAPE",
            "RETURN", "ENTER",
            "DEL", "DELETE",
            "PGUP", "PAGE_UP");

    private static final Map<String, Integer> KEY_CODES;

    static {
        Map<String, Integer> m = new HashMap<>();
        for (char c = 'A'; c <= 'Z'; c++) {
            m.put(String.valueOf(c), KeyEvent.VK_A + (c - 'A'));
        }
        for (char c = '0'; c <= '9'; c++) {
            m.put(String.valueOf(c), KeyEvent.VK_0 + (c - '0'));
        }
        for (int i = 1; i <= 12; i++) {
            m.put("F" + i, KeyEvent.VK_F1 + (i - 1));
        }
        for (int i = 13; i <= 24; i++) {
            m.put("F" + i, KeyEvent.VK_F13 + (i - 13));
        }
        m.put("ESCAPE", KeyEvent.VK_ESCAPE);
        m.put("ENTER", KeyEvent.VK_ENTER);
        m.put("TAB", KeyEvent.VK_TAB);
        m.put("SPACE", KeyEvent.VK_SPACE);
        m.put("BACKSPACE", KeyEvent.VK_BACK_SPACE);
        m.put("DELETE", KeyEvent.VK_DELETE);
        m.put("INSERT", KeyEvent.VK_INSERT);
        m.put("HOME", KeyEvent.VK_HOME);
        m.put("END", KeyEvent.VK_END);
        m.put("PAGE_UP", KeyEvent.VK_PAGE_UP);
        m.put("PAGE_DOWN", KeyEvent.VK_PAGE_DOWN);
        m.put("UP", KeyEvent.VK_UP);
        m.put("DOWN", KeyEvent.VK_DOWN);
        m.put("LEFT", KeyEvent.VK_LEFT);
        m.put("RIGHT", KeyEvent.VK_RIGHT);
        m.put("META", KeyEvent.VK_META);
        m.put("SHIFT", KeyEvent.VK_SHIFT);
        m.put("CONTROL", KeyEvent.VK_CONTROL);
        m.put("ALT", KeyEvent.VK_ALT);
        m.put("WINDOWS", KeyEvent.VK_WINDOWS);
        KEY_CODES = Map.copyOf(m);
    }

    private KeyNameMapper() {}

    /** Canonical upper-case key name: spaces become underscores, aliases are resolved. */
    public static String normalizeKey(String keyText) {
        if (keyText == null || keyText.isBlank()) {
            return "UNKNOWN";
        }
        String k = keyText.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        return ALIASES.getOrDefault(k, k);
    }

    /** Canonical modifier name; left/right variants collapse to the plain modifier. */
    public static String normalizeModifier(String mod) {
        if (mod == null) {
            return "";
        }
        String m = normalizeKey(mod);
        if (m.startsWith("LEFT_") || m.startsWith("RIGHT_")) {
            m = normalizeKey(m.substring(m.indexOf('_') + 1));
        }
        return m;
    }

    public static Set<String> normalizeModifiers(List<String> mods) {
        if (mods == null) {
            return Set.of();
        }
        return mods.stream()
                .map(KeyNameMapper::normalizeModifier)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static boolean isValidKey(String key) {
        return KEY_CODES.containsKey(normalizeKey(key));
    }

    public static boolean isValidModifier(String mod) {
        return MODIFIERS.contains(normalizeModifier(mod));
    }

    /** {@link KeyEvent} code for a key or modifier name. */
    public static OptionalInt toKeyCode(String name) {
        Integer code = KEY_CODES.get(normalizeModifier(name));
        return code == null ? OptionalInt.empty() : OptionalInt.of(code);
    }

    /**
     * Compares configured modifiers and key against a combination string such as
     * {@code "META+TAB"} or {@code "CONTROL+SHIFT+D"}.
     */
    public static boolean matchesCombination(Set<String> configuredMods, String configuredKey, String combination) {
        if (combination == null || combination.isBlank()) {
            return false;
        }
        Set<String> mods = new HashSet<>();
        String key = null;
        for (String part : combination.split("\\+")) {
            String p = part.trim();
            if (p.isEmpty()) {
                continue;
            }
            if (isValidModifier(p)) {
                mods.add(normalizeModifier(p));
            } else {
                key = normalizeKey(p);
            }
        }
        Set<String> configured = configuredMods.stream()
                .map(KeyNameMapper::normalizeModifier)
                .collect(Collectors.toSet());
        return normalizeKey(configuredKey).equals(key) && configured.equals(mods);
    }
}
