package com.phillippitts.voicenav.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Global hotkeys that speak a fixed utterance, e.g.
 *
 * <pre>
 * hotkeys.bindings[0].name=hide-overlay
 * hotkeys.bindings[0].key=ESCAPE
 * hotkeys.bindings[0].modifiers=CONTROL,SHIFT
 * hotkeys.bindings[0].utterance=hide
 * </pre>
 *
 * Bindings are checked at startup; invalid ones are skipped with a warning.
 */
@Validated
@ConfigurationProperties(prefix = "hotkeys")
public class HotkeyProperties {

    private final boolean enabled;
    private final List<Binding> bindings;

    /** Reserved OS shortcuts to flag as conflicts (e.g., META+TAB, META+L). */
    private final List<String> reserved;

    @ConstructorBinding
    public HotkeyProperties(Boolean enabled, List<Binding> bindings, List<String> reserved) {
        this.enabled = enabled == null || enabled;
        this.bindings = bindings == null ? List.of() : List.copyOf(bindings);
        this.reserved = (reserved == null || reserved.isEmpty())
                ? List.of("META+TAB", "META+L", "ALT+TAB", "ALT+F4")
                : List.copyOf(reserved);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<Binding> getBindings() {
        return bindings;
    }

    public List<String> getReserved() {
        return reserved;
    }

    public record Binding(String name, String key, List<String> modifiers, String utterance) {
        public Binding {
            modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        }
    }
}
