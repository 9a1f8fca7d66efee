package com.phillippitts.voicenav.service.hotkey;

import com.phillippitts.voicenav.exception.InvalidCommandConfigurationException;

import java.util.List;
import java.util.Set;

/**
 * A validated key combination and the utterance it dispatches.
 */
public record HotkeyBinding(String name, String key, Set<String> modifiers, String utterance) {

    /**
     * Builds a binding from raw configuration values.
     *
     * @throws InvalidCommandConfigurationException if the key, a modifier or the utterance is invalid
     */
    public static HotkeyBinding of(String name, String key, List<String> modifiers, String utterance) {
        String label = name == null || name.isBlank() ? String.valueOf(key) : name;
        if (!KeyNameMapper.isValidKey(key)) {
            throw new InvalidCommandConfigurationException(label, "unknown key '" + key + "'");
        }
        List<String> mods = modifiers == null ? List.of() : modifiers;
        for (String m : mods) {
            if (!KeyNameMapper.isValidModifier(m)) {
                throw new InvalidCommandConfigurationException(label,
                        "unknown modifier '" + m + "' (allowed: META, SHIFT, CONTROL, ALT)");
            }
        }
        if (utterance == null || utterance.isBlank()) {
            throw new InvalidCommandConfigurationException(label, "utterance must not be blank");
        }
        return new HotkeyBinding(label, KeyNameMapper.normalizeKey(key),
                KeyNameMapper.normalizeModifiers(mods), utterance.trim());
    }

    /** True for a key press of exactly this key with exactly these modifiers held. */
    public boolean matches(NormalizedKeyEvent e) {
        return e.type() == NormalizedKeyEvent.Type.PRESSED
                && key.equals(e.key())
                && modifiers.equals(e.modifiers());
    }

    public String describe() {
        return modifiers.isEmpty() ? key : String.join("+", modifiers.stream().sorted().toList()) + "+" + key;
    }
}
